package faberromanus.faberc.compiler.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import faberromanus.faberc.compiler.backend.CollectionMethod.Emission;

/**
 * Translations of the methods of 'copia', the set type.
 */
public class CopiaMethods {

    private CopiaMethods() {}

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

    static {
        add("adde", true,
            CollectionMethod.renamed("add"),
            CollectionMethod.renamed("add"));
        add("habet", false,
            CollectionMethod.renamed("has"),
            (o, a) -> "(" + ListaMethods.arg(a, 0, "None") + " in " + o + ")");
        add("dele", true,
            CollectionMethod.renamed("delete"),
            CollectionMethod.renamed("discard"));
        property("longitudo",
            (o, a) -> o + ".size",
            (o, a) -> "len(" + o + ")");
        property("vacua",
            (o, a) -> "(" + o + ".size === 0)",
            (o, a) -> "(len(" + o + ") == 0)");
        add("purga", true,
            CollectionMethod.renamed("clear"),
            CollectionMethod.renamed("clear"));
        property("valores",
            (o, a) -> o + ".values()",
            (o, a) -> "iter(" + o + ")");
        add("perambula", false,
            CollectionMethod.renamed("forEach"),
            (o, a) -> "[(" + ListaMethods.arg(a, 0, "None")
                + ")(x) for x in " + o + "]");
        add("unio", false,
            (o, a) -> "new Set([..." + o + ", ..."
                + ListaMethods.arg(a, 0, "[]") + "])",
            (o, a) -> "(" + o + " | " + ListaMethods.arg(a, 0, "set()") + ")");
        add("intersectio", false,
            (o, a) -> "new Set([..." + o + "].filter((x) => "
                + ListaMethods.arg(a, 0, "new Set()") + ".has(x)))",
            (o, a) -> "(" + o + " & " + ListaMethods.arg(a, 0, "set()") + ")");
        add("differentia", false,
            (o, a) -> "new Set([..." + o + "].filter((x) => !"
                + ListaMethods.arg(a, 0, "new Set()") + ".has(x)))",
            (o, a) -> "(" + o + " - " + ListaMethods.arg(a, 0, "set()") + ")");
        add("symmetrica", false,
            (o, a) -> {
                String other = ListaMethods.arg(a, 0, "new Set()");
                return "new Set([...[..." + o + "].filter((x) => !" + other
                    + ".has(x)), ...[..." + other + "].filter((x) => !" + o
                    + ".has(x))])";
            },
            (o, a) -> "(" + o + " ^ " + ListaMethods.arg(a, 0, "set()") + ")");
        add("subcopia", false,
            (o, a) -> "[..." + o + "].every((x) => "
                + ListaMethods.arg(a, 0, "new Set()") + ".has(x))",
            (o, a) -> "(" + o + " <= " + ListaMethods.arg(a, 0, "set()")
                + ")");
        add("supercopia", false,
            (o, a) -> "[..." + ListaMethods.arg(a, 0, "[]")
                + "].every((x) => " + o + ".has(x))",
            (o, a) -> "(" + o + " >= " + ListaMethods.arg(a, 0, "set()")
                + ")");
        property("inLista",
            (o, a) -> "[..." + o + "]",
            (o, a) -> "list(" + o + ")");
    }

    public static Optional<CollectionMethod> get(String name) {
        return Optional.ofNullable(METHODS.get(name));
    }

    public static Map<String, CollectionMethod> all() {
        return Collections.unmodifiableMap(METHODS);
    }

}
