package faberromanus.faberc.compiler.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import faberromanus.faberc.compiler.backend.CollectionMethod.Emission;

/**
 * Translations of the methods of 'tabula', the map type.
 */
public class TabulaMethods {

    private TabulaMethods() {}

    private static final Map<String, CollectionMethod> METHODS
        = new LinkedHashMap<>();

    private static void add(
        String name, boolean mutates, Emission ts, Emission py
    ) {
        METHODS.put(name, new CollectionMethod(
            name, mutates, false, ts, py, List.of()
        ));
    }

    private static void property(String name, Emission ts, Emission py) {
        METHODS.put(name, new CollectionMethod(
            name, false, true, ts, py, List.of()
        ));
    }

    private static String keyList(List<String> args) {
        return "[" + String.join(", ", args) + "]";
    }

    static {
        add("pone", true,
            CollectionMethod.renamed("set"),
            (o, a) -> a.size() >= 2
                ? o + "[" + a.get(0) + "] = " + a.get(1)
                : o + ".update(" + ListaMethods.arg(a, 0, "{}") + ")");
        add("accipe", false,
            CollectionMethod.renamed("get"),
            CollectionMethod.renamed("get"));
        add("accipeAut", false,
            (o, a) -> a.size() >= 2
                ? "(" + o + ".get(" + a.get(0) + ") ?? " + a.get(1) + ")"
                : o + ".get(" + ListaMethods.arg(a, 0, "undefined") + ")",
            CollectionMethod.renamed("get"));
        add("habet", false,
            CollectionMethod.renamed("has"),
            (o, a) -> "(" + ListaMethods.arg(a, 0, "None") + " in " + o + ")");
        add("dele", true,
            CollectionMethod.renamed("delete"),
            (o, a) -> o + ".pop(" + ListaMethods.arg(a, 0, "None")
                + ", None)");
        property("longitudo",
            (o, a) -> o + ".size",
            (o, a) -> "len(" + o + ")");
        property("vacua",
            (o, a) -> "(" + o + ".size === 0)",
            (o, a) -> "(len(" + o + ") == 0)");
        add("purga", true,
            CollectionMethod.renamed("clear"),
            CollectionMethod.renamed("clear"));
        property("claves",
            (o, a) -> o + ".keys()",
            (o, a) -> o + ".keys()");
        property("valores",
            (o, a) -> o + ".values()",
            (o, a) -> o + ".values()");
        property("paria",
            (o, a) -> o + ".entries()",
            (o, a) -> o + ".items()");
        add("selige", false,
            (o, a) -> "new Map([..." + o + "].filter(([k]) => "
                + keyList(a) + ".includes(k)))",
            (o, a) -> "{k: " + o + "[k] for k in " + keyList(a)
                + " if k in " + o + "}");
        add("omitte", false,
            (o, a) -> "new Map([..." + o + "].filter(([k]) => !"
                + keyList(a) + ".includes(k)))",
            (o, a) -> "{k: v for k, v in " + o + ".items() if k not in "
                + keyList(a) + "}");
        add("confla", false,
            (o, a) -> "new Map([..." + o + ", ..."
                + ListaMethods.arg(a, 0, "[]") + "])",
            (o, a) -> "{**" + o + ", **" + ListaMethods.arg(a, 0, "{}") + "}");
        property("inversa",
            (o, a) -> "new Map([..." + o + "].map(([k, v]) => [v, k]))",
            (o, a) -> "{v: k for k, v in " + o + ".items()}");
        add("mappaValores", false,
            (o, a) -> "new Map([..." + o + "].map(([k, v]) => [k, ("
                + ListaMethods.arg(a, 0, "(x) => x") + ")(v)]))",
            (o, a) -> "{k: (" + ListaMethods.arg(a, 0, "None")
                + ")(v) for k, v in " + o + ".items()}");
        add("mappaClaves", false,
            (o, a) -> "new Map([..." + o + "].map(([k, v]) => [("
                + ListaMethods.arg(a, 0, "(x) => x") + ")(k), v]))",
            (o, a) -> "{(" + ListaMethods.arg(a, 0, "None")
                + ")(k): v for k, v in " + o + ".items()}");
        property("inLista",
            (o, a) -> "[..." + o + "]",
            (o, a) -> "list(" + o + ".items())");
        property("inObjectum",
            (o, a) -> "Object.fromEntries(" + o + ")",
            (o, a) -> "dict(" + o + ")");
    }

    public static Optional<CollectionMethod> get(String name) {
        return Optional.ofNullable(METHODS.get(name));
    }

    public static Map<String, CollectionMethod> all() {
        return Collections.unmodifiableMap(METHODS);
    }

}
