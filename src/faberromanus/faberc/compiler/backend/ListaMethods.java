package faberromanus.faberc.compiler.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import faberromanus.faberc.compiler.backend.CollectionMethod.Emission;

/**
 * Translations of the methods of 'lista', the sequence type.
 */
public class ListaMethods {

    private ListaMethods() {}

    private static final Map<String, CollectionMethod> METHODS
        = new LinkedHashMap<>();

    private static void add(
        String name, boolean mutates, Emission ts, Emission py,
        Feature... pyFeatures
    ) {
        METHODS.put(name, new CollectionMethod(
            name, mutates, false, ts, py, List.of(pyFeatures)
        ));
    }

    private static void property(
        String name, Emission ts, Emission py, Feature... pyFeatures
    ) {
        METHODS.put(name, new CollectionMethod(
            name, false, true, ts, py, List.of(pyFeatures)
        ));
    }

    static String arg(List<String> args, int index, String missing) {
        return index < args.size()? args.get(index) : missing;
    }

    static {
        // adding and removing
        add("adde", true,
            CollectionMethod.renamed("push"),
            CollectionMethod.renamed("append"));
        add("addita", false,
            (o, a) -> "[..." + o + ", " + String.join(", ", a) + "]",
            (o, a) -> "[*" + o + ", " + String.join(", ", a) + "]");
        add("praepone", true,
            CollectionMethod.renamed("unshift"),
            (o, a) -> o + ".insert(0, " + arg(a, 0, "None") + ")");
        add("praeposita", false,
            (o, a) -> "[" + String.join(", ", a) + ", ..." + o + "]",
            (o, a) -> "[" + String.join(", ", a) + ", *" + o + "]");
        add("remove", true,
            CollectionMethod.renamed("pop"),
            CollectionMethod.renamed("pop"));
        property("remota",
            (o, a) -> o + ".slice(0, -1)",
            (o, a) -> o + "[:-1]");
        add("decapita", true,
            CollectionMethod.renamed("shift"),
            (o, a) -> o + ".pop(0)");
        property("decapitata",
            (o, a) -> o + ".slice(1)",
            (o, a) -> o + "[1:]");
        add("purga", true,
            (o, a) -> o + ".length = 0",
            CollectionMethod.renamed("clear"));
        // reading
        property("primus",
            (o, a) -> o + "[0]",
            (o, a) -> o + "[0]");
        property("ultimus",
            (o, a) -> o + ".at(-1)",
            (o, a) -> o + "[-1]");
        add("accipe", false,
            (o, a) -> o + "[" + arg(a, 0, "0") + "]",
            (o, a) -> o + "[" + arg(a, 0, "0") + "]");
        property("longitudo",
            (o, a) -> o + ".length",
            (o, a) -> "len(" + o + ")");
        property("vacua",
            (o, a) -> "(" + o + ".length === 0)",
            (o, a) -> "(len(" + o + ") == 0)");
        add("continet", false,
            CollectionMethod.renamed("includes"),
            (o, a) -> "(" + arg(a, 0, "None") + " in " + o + ")");
        add("indiceDe", false,
            CollectionMethod.renamed("indexOf"),
            CollectionMethod.renamed("index"));
        add("inveni", false,
            CollectionMethod.renamed("find"),
            (o, a) -> "next(filter(" + arg(a, 0, "None") + ", " + o
                + "), None)");
        add("inveniIndicem", false,
            CollectionMethod.renamed("findIndex"),
            (o, a) -> "next((i for i, x in enumerate(" + o + ") if ("
                + arg(a, 0, "None") + ")(x)), -1)");
        add("omnes", false,
            CollectionMethod.renamed("every"),
            (o, a) -> "all(map(" + arg(a, 0, "bool") + ", " + o + "))");
        add("aliquis", false,
            CollectionMethod.renamed("some"),
            (o, a) -> "any(map(" + arg(a, 0, "bool") + ", " + o + "))");
        // producing new sequences
        add("filtrata", false,
            CollectionMethod.renamed("filter"),
            (o, a) -> "list(filter(" + arg(a, 0, "None") + ", " + o + "))");
        add("mappata", false,
            CollectionMethod.renamed("map"),
            (o, a) -> "list(map(" + arg(a, 0, "None") + ", " + o + "))");
        // reducta(seed, fn), both targets take the function first
        add("reducta", false,
            (o, a) -> a.size() >= 2
                ? o + ".reduce(" + a.get(1) + ", " + a.get(0) + ")"
                : o + ".reduce(" + arg(a, 0, "") + ")",
            (o, a) -> a.size() >= 2
                ? "functools.reduce(" + a.get(1) + ", " + o + ", "
                    + a.get(0) + ")"
                : "functools.reduce(" + arg(a, 0, "None") + ", " + o + ")",
            Feature.FUNCTOOLS);
        add("explanata", false,
            CollectionMethod.renamed("flatMap"),
            (o, a) -> "[y for x in " + o + " for y in ("
                + arg(a, 0, "None") + ")(x)]");
        property("plana",
            (o, a) -> o + ".flat()",
            (o, a) -> "[y for x in " + o + " for y in x]");
        property("inversa",
            (o, a) -> "[..." + o + "].reverse()",
            (o, a) -> o + "[::-1]");
        add("ordinata", false,
            (o, a) -> "[..." + o + "].sort(" + String.join(", ", a) + ")",
            (o, a) -> a.isEmpty()
                ? "sorted(" + o + ")"
                : "sorted(" + o + ", key=" + a.get(0) + ")");
        add("sectio", false,
            CollectionMethod.renamed("slice"),
            (o, a) -> a.size() >= 2
                ? o + "[" + a.get(0) + ":" + a.get(1) + "]"
                : o + "[" + arg(a, 0, "") + ":]");
        add("prima", false,
            (o, a) -> o + ".slice(0, " + arg(a, 0, "1") + ")",
            (o, a) -> o + "[:" + arg(a, 0, "1") + "]");
        add("ultima", false,
            (o, a) -> o + ".slice(-" + arg(a, 0, "1") + ")",
            (o, a) -> o + "[-" + arg(a, 0, "1") + ":]");
        add("omitte", false,
            (o, a) -> o + ".slice(" + arg(a, 0, "0") + ")",
            (o, a) -> o + "[" + arg(a, 0, "0") + ":]");
        // in place
        add("filtra", true,
            (o, a) -> o + ".splice(0, " + o + ".length, ..." + o
                + ".filter(" + arg(a, 0, "Boolean") + "))",
            (o, a) -> o + "[:] = [x for x in " + o + " if ("
                + arg(a, 0, "bool") + ")(x)]");
        add("ordina", true,
            CollectionMethod.renamed("sort"),
            (o, a) -> a.isEmpty()
                ? o + ".sort()"
                : o + ".sort(key=" + a.get(0) + ")");
        add("inverte", true,
            CollectionMethod.renamed("reverse"),
            CollectionMethod.renamed("reverse"));
        add("misce", true,
            (o, a) -> o + ".sort(() => Math.random() - 0.5)",
            (o, a) -> "random.shuffle(" + o + ")",
            Feature.RANDOM);
        // iteration and aggregation
        add("perambula", false,
            CollectionMethod.renamed("forEach"),
            (o, a) -> "[(" + arg(a, 0, "None") + ")(x) for x in " + o + "]");
        add("coniunge", false,
            (o, a) -> o + ".join(" + arg(a, 0, "\"\"") + ")",
            (o, a) -> arg(a, 0, "\"\"") + ".join(" + o + ")");
        property("summa",
            (o, a) -> o + ".reduce((a, b) => a + b, 0)",
            (o, a) -> "sum(" + o + ")");
        property("medium",
            (o, a) -> "(" + o + ".reduce((a, b) => a + b, 0) / " + o
                + ".length)",
            (o, a) -> "(sum(" + o + ") / len(" + o + "))");
        property("minimus",
            (o, a) -> "Math.min(..." + o + ")",
            (o, a) -> "min(" + o + ")");
        property("maximus",
            (o, a) -> "Math.max(..." + o + ")",
            (o, a) -> "max(" + o + ")");
        add("minimusPer", false,
            (o, a) -> o + ".reduce((a, b) => (" + arg(a, 0, "(x) => x")
                + ")(b) < (" + arg(a, 0, "(x) => x") + ")(a) ? b : a)",
            (o, a) -> "min(" + o + ", key=" + arg(a, 0, "None") + ")");
        add("maximusPer", false,
            (o, a) -> o + ".reduce((a, b) => (" + arg(a, 0, "(x) => x")
                + ")(b) > (" + arg(a, 0, "(x) => x") + ")(a) ? b : a)",
            (o, a) -> "max(" + o + ", key=" + arg(a, 0, "None") + ")");
        add("numera", false,
            (o, a) -> o + ".filter(" + arg(a, 0, "Boolean") + ").length",
            (o, a) -> "sum(1 for x in " + o + " if (" + arg(a, 0, "bool")
                + ")(x))");
        add("congrega", false,
            (o, a) -> "Object.groupBy(" + o + ", " + arg(a, 0, "String")
                + ")",
            (o, a) -> "{k: list(g) for k, g in itertools.groupby(sorted("
                + o + ", key=" + arg(a, 0, "None") + "), key="
                + arg(a, 0, "None") + ")}",
            Feature.ITERTOOLS);
        property("frequentia",
            (o, a) -> o + ".reduce((m, x) => m.set(x, (m.get(x) ?? 0) + 1),"
                + " new Map())",
            (o, a) -> "dict(collections.Counter(" + o + "))",
            Feature.COLLECTIONS);
        property("unica",
            (o, a) -> "[...new Set(" + o + ")]",
            (o, a) -> "list(dict.fromkeys(" + o + "))");
        add("fragmenta", false,
            (o, a) -> "Array.from({ length: Math.ceil(" + o + ".length / "
                + arg(a, 0, "1") + ") }, (_, i) => " + o + ".slice(i * "
                + arg(a, 0, "1") + ", (i + 1) * " + arg(a, 0, "1") + "))",
            (o, a) -> "[" + o + "[i:i + " + arg(a, 0, "1")
                + "] for i in range(0, len(" + o + "), "
                + arg(a, 0, "1") + ")]");
        property("densa",
            (o, a) -> o + ".filter(Boolean)",
            (o, a) -> "[x for x in " + o + " if x]");
        add("partire", false,
            (o, a) -> "[" + o + ".filter(" + arg(a, 0, "Boolean") + "), "
                + o + ".filter((x) => !(" + arg(a, 0, "Boolean")
                + ")(x))]",
            (o, a) -> "[[x for x in " + o + " if (" + arg(a, 0, "bool")
                + ")(x)], [x for x in " + o + " if not ("
                + arg(a, 0, "bool") + ")(x)]]");
        property("specimen",
            (o, a) -> o + "[Math.floor(Math.random() * " + o + ".length)]",
            (o, a) -> "random.choice(" + o + ")",
            Feature.RANDOM);
        add("specimina", false,
            (o, a) -> "[..." + o + "].sort(() => Math.random() - 0.5)"
                + ".slice(0, " + arg(a, 0, "1") + ")",
            (o, a) -> "random.sample(" + o + ", " + arg(a, 0, "1") + ")",
            Feature.RANDOM);
    }

    public static Optional<CollectionMethod> get(String name) {
        return Optional.ofNullable(METHODS.get(name));
    }

    public static Map<String, CollectionMethod> all() {
        return Collections.unmodifiableMap(METHODS);
    }

}
