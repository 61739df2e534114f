package faberromanus.faberc.compiler.backend;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import faberromanus.faberc.compiler.Target;

/**
 * Exact translations of every collection method for a receiver 'r'.
 */
class CollectionMethodsTest {

    private record Row(
        String collection, String method, List<String> args,
        String ts, String py
    ) {}

    private static final List<Row> ROWS = new ArrayList<>();

    private static void row(
        String collection, String method, List<String> args,
        String ts, String py
    ) {
        ROWS.add(new Row(collection, method, args, ts, py));
    }

    static {
        // lista
        row("lista", "adde", List.of("x"), "r.push(x)", "r.append(x)");
        row("lista", "addita", List.of("x"), "[...r, x]", "[*r, x]");
        row("lista", "praepone", List.of("x"), "r.unshift(x)", "r.insert(0, x)");
        row("lista", "praeposita", List.of("x"), "[x, ...r]", "[x, *r]");
        row("lista", "remove", List.of(), "r.pop()", "r.pop()");
        row("lista", "remota", List.of(), "r.slice(0, -1)", "r[:-1]");
        row("lista", "decapita", List.of(), "r.shift()", "r.pop(0)");
        row("lista", "decapitata", List.of(), "r.slice(1)", "r[1:]");
        row("lista", "purga", List.of(), "r.length = 0", "r.clear()");
        row("lista", "primus", List.of(), "r[0]", "r[0]");
        row("lista", "ultimus", List.of(), "r.at(-1)", "r[-1]");
        row("lista", "accipe", List.of("i"), "r[i]", "r[i]");
        row("lista", "longitudo", List.of(), "r.length", "len(r)");
        row("lista", "vacua", List.of(), "(r.length === 0)", "(len(r) == 0)");
        row("lista", "continet", List.of("x"), "r.includes(x)", "(x in r)");
        row("lista", "indiceDe", List.of("x"), "r.indexOf(x)", "r.index(x)");
        row("lista", "inveni", List.of("f"),
            "r.find(f)", "next(filter(f, r), None)");
        row("lista", "inveniIndicem", List.of("f"),
            "r.findIndex(f)",
            "next((i for i, x in enumerate(r) if (f)(x)), -1)");
        row("lista", "omnes", List.of("f"), "r.every(f)", "all(map(f, r))");
        row("lista", "aliquis", List.of("f"), "r.some(f)", "any(map(f, r))");
        row("lista", "filtrata", List.of("f"),
            "r.filter(f)", "list(filter(f, r))");
        row("lista", "mappata", List.of("f"), "r.map(f)", "list(map(f, r))");
        row("lista", "reducta", List.of("s", "f"),
            "r.reduce(f, s)", "functools.reduce(f, r, s)");
        row("lista", "explanata", List.of("f"),
            "r.flatMap(f)", "[y for x in r for y in (f)(x)]");
        row("lista", "plana", List.of(),
            "r.flat()", "[y for x in r for y in x]");
        row("lista", "inversa", List.of(), "[...r].reverse()", "r[::-1]");
        row("lista", "ordinata", List.of("f"),
            "[...r].sort(f)", "sorted(r, key=f)");
        row("lista", "sectio", List.of("i", "j"), "r.slice(i, j)", "r[i:j]");
        row("lista", "prima", List.of("n"), "r.slice(0, n)", "r[:n]");
        row("lista", "ultima", List.of("n"), "r.slice(-n)", "r[-n:]");
        row("lista", "omitte", List.of("n"), "r.slice(n)", "r[n:]");
        row("lista", "filtra", List.of("f"),
            "r.splice(0, r.length, ...r.filter(f))",
            "r[:] = [x for x in r if (f)(x)]");
        row("lista", "ordina", List.of("f"), "r.sort(f)", "r.sort(key=f)");
        row("lista", "inverte", List.of(), "r.reverse()", "r.reverse()");
        row("lista", "misce", List.of(),
            "r.sort(() => Math.random() - 0.5)", "random.shuffle(r)");
        row("lista", "perambula", List.of("f"),
            "r.forEach(f)", "[(f)(x) for x in r]");
        row("lista", "coniunge", List.of("s"), "r.join(s)", "s.join(r)");
        row("lista", "summa", List.of(),
            "r.reduce((a, b) => a + b, 0)", "sum(r)");
        row("lista", "medium", List.of(),
            "(r.reduce((a, b) => a + b, 0) / r.length)", "(sum(r) / len(r))");
        row("lista", "minimus", List.of(), "Math.min(...r)", "min(r)");
        row("lista", "maximus", List.of(), "Math.max(...r)", "max(r)");
        row("lista", "minimusPer", List.of("f"),
            "r.reduce((a, b) => (f)(b) < (f)(a) ? b : a)", "min(r, key=f)");
        row("lista", "maximusPer", List.of("f"),
            "r.reduce((a, b) => (f)(b) > (f)(a) ? b : a)", "max(r, key=f)");
        row("lista", "numera", List.of("f"),
            "r.filter(f).length", "sum(1 for x in r if (f)(x))");
        row("lista", "congrega", List.of("f"),
            "Object.groupBy(r, f)",
            "{k: list(g) for k, g in itertools.groupby(sorted(r, key=f),"
                + " key=f)}");
        row("lista", "frequentia", List.of(),
            "r.reduce((m, x) => m.set(x, (m.get(x) ?? 0) + 1), new Map())",
            "dict(collections.Counter(r))");
        row("lista", "unica", List.of(),
            "[...new Set(r)]", "list(dict.fromkeys(r))");
        row("lista", "fragmenta", List.of("n"),
            "Array.from({ length: Math.ceil(r.length / n) },"
                + " (_, i) => r.slice(i * n, (i + 1) * n))",
            "[r[i:i + n] for i in range(0, len(r), n)]");
        row("lista", "densa", List.of(),
            "r.filter(Boolean)", "[x for x in r if x]");
        row("lista", "partire", List.of("f"),
            "[r.filter(f), r.filter((x) => !(f)(x))]",
            "[[x for x in r if (f)(x)], [x for x in r if not (f)(x)]]");
        row("lista", "specimen", List.of(),
            "r[Math.floor(Math.random() * r.length)]", "random.choice(r)");
        row("lista", "specimina", List.of("n"),
            "[...r].sort(() => Math.random() - 0.5).slice(0, n)",
            "random.sample(r, n)");
        // tabula
        row("tabula", "pone", List.of("k", "v"), "r.set(k, v)", "r[k] = v");
        row("tabula", "accipe", List.of("k"), "r.get(k)", "r.get(k)");
        row("tabula", "accipeAut", List.of("k", "v"),
            "(r.get(k) ?? v)", "r.get(k, v)");
        row("tabula", "habet", List.of("k"), "r.has(k)", "(k in r)");
        row("tabula", "dele", List.of("k"), "r.delete(k)", "r.pop(k, None)");
        row("tabula", "longitudo", List.of(), "r.size", "len(r)");
        row("tabula", "vacua", List.of(), "(r.size === 0)", "(len(r) == 0)");
        row("tabula", "purga", List.of(), "r.clear()", "r.clear()");
        row("tabula", "claves", List.of(), "r.keys()", "r.keys()");
        row("tabula", "valores", List.of(), "r.values()", "r.values()");
        row("tabula", "paria", List.of(), "r.entries()", "r.items()");
        row("tabula", "selige", List.of("a", "b"),
            "new Map([...r].filter(([k]) => [a, b].includes(k)))",
            "{k: r[k] for k in [a, b] if k in r}");
        row("tabula", "omitte", List.of("a", "b"),
            "new Map([...r].filter(([k]) => ![a, b].includes(k)))",
            "{k: v for k, v in r.items() if k not in [a, b]}");
        row("tabula", "confla", List.of("o"),
            "new Map([...r, ...o])", "{**r, **o}");
        row("tabula", "inversa", List.of(),
            "new Map([...r].map(([k, v]) => [v, k]))",
            "{v: k for k, v in r.items()}");
        row("tabula", "mappaValores", List.of("f"),
            "new Map([...r].map(([k, v]) => [k, (f)(v)]))",
            "{k: (f)(v) for k, v in r.items()}");
        row("tabula", "mappaClaves", List.of("f"),
            "new Map([...r].map(([k, v]) => [(f)(k), v]))",
            "{(f)(k): v for k, v in r.items()}");
        row("tabula", "inLista", List.of(), "[...r]", "list(r.items())");
        row("tabula", "inObjectum", List.of(),
            "Object.fromEntries(r)", "dict(r)");
        // copia
        row("copia", "adde", List.of("x"), "r.add(x)", "r.add(x)");
        row("copia", "habet", List.of("x"), "r.has(x)", "(x in r)");
        row("copia", "dele", List.of("x"), "r.delete(x)", "r.discard(x)");
        row("copia", "longitudo", List.of(), "r.size", "len(r)");
        row("copia", "vacua", List.of(), "(r.size === 0)", "(len(r) == 0)");
        row("copia", "purga", List.of(), "r.clear()", "r.clear()");
        row("copia", "valores", List.of(), "r.values()", "iter(r)");
        row("copia", "perambula", List.of("f"),
            "r.forEach(f)", "[(f)(x) for x in r]");
        row("copia", "unio", List.of("o"), "new Set([...r, ...o])", "(r | o)");
        row("copia", "intersectio", List.of("o"),
            "new Set([...r].filter((x) => o.has(x)))", "(r & o)");
        row("copia", "differentia", List.of("o"),
            "new Set([...r].filter((x) => !o.has(x)))", "(r - o)");
        row("copia", "symmetrica", List.of("o"),
            "new Set([...[...r].filter((x) => !o.has(x)),"
                + " ...[...o].filter((x) => !r.has(x))])",
            "(r ^ o)");
        row("copia", "subcopia", List.of("o"),
            "[...r].every((x) => o.has(x))", "(r <= o)");
        row("copia", "supercopia", List.of("o"),
            "[...o].every((x) => r.has(x))", "(r >= o)");
        row("copia", "inLista", List.of(), "[...r]", "list(r)");
    }

    private static Map<String, CollectionMethod> registry(String collection) {
        switch(collection) {
            case "lista": return ListaMethods.all();
            case "tabula": return TabulaMethods.all();
            case "copia": return CopiaMethods.all();
            default: throw new IllegalArgumentException(collection);
        }
    }

    static Stream<Arguments> translations() {
        return ROWS.stream().flatMap(row -> Stream.of(
            Arguments.of(row.collection(), row.method(), row.args(),
                Target.TYPESCRIPT, row.ts()),
            Arguments.of(row.collection(), row.method(), row.args(),
                Target.PYTHON, row.py())
        ));
    }

    @ParameterizedTest(name = "{0}.{1} -> {3}")
    @MethodSource("translations")
    void translatesEveryMethod(
        String collection, String method, List<String> args, Target target,
        String expected
    ) {
        CollectionMethod entry = CollectionMethodsTest.registry(collection)
            .get(method);
        assertThat(entry).as("%s.%s", collection, method).isNotNull();
        assertThat(entry.emission(target).emit("r", args))
            .isEqualTo(expected);
    }

    @Test
    void tableCoversEveryRegisteredMethod() {
        for(String collection: List.of("lista", "tabula", "copia")) {
            List<String> listed = ROWS.stream()
                .filter(row -> row.collection().equals(collection))
                .map(Row::method)
                .collect(Collectors.toList());
            assertThat(listed)
                .as(collection)
                .containsExactlyInAnyOrderElementsOf(
                    CollectionMethodsTest.registry(collection).keySet()
                );
        }
    }

    @Test
    void propertiesTakeNoArguments() {
        for(Row row: ROWS) {
            CollectionMethod entry = CollectionMethodsTest
                .registry(row.collection()).get(row.method());
            if(entry.nullary()) {
                assertThat(row.args()).as(row.method()).isEmpty();
            }
        }
    }

}
