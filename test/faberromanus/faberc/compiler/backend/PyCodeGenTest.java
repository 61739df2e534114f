package faberromanus.faberc.compiler.backend;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;

import faberromanus.faberc.compiler.Analyzer;
import faberromanus.faberc.compiler.Compiler;
import faberromanus.faberc.compiler.Options;
import faberromanus.faberc.compiler.Result;
import faberromanus.faberc.compiler.Target;

class PyCodeGenTest {

    private static final Options PYTHON = Options.DEFAULT
        .withTarget(Target.PYTHON);

    private static Result<String> compile(String source, Analyzer analyzer) {
        return Compiler.compile(
            Map.of("test.fab", source), "test.fab", PYTHON, analyzer
        );
    }

    private static String lower(String source, Analyzer analyzer) {
        Result<String> result = PyCodeGenTest.compile(source, analyzer);
        assertThat(result.isError())
            .as(() -> result.isError()? result.getError().toString() : "")
            .isFalse();
        return result.getValue();
    }

    private static String lower(String source) {
        return PyCodeGenTest.lower(source, Analyzer.NONE);
    }

    @Test
    void annotatesVariables() {
        String output = PyCodeGenTest.lower(
            "fixum numerus x = 1\nvaria textus nomen\nvaria y = verum"
        );
        assertThat(output).isEqualTo(
            "x: int = 1\nnomen: str = None\ny = True\n"
        );
    }

    @Test
    void convertsImportPathsToModules() {
        String output = PyCodeGenTest.lower(
            "ex \"./util\" importa a ut b, c\n"
                + "ex \"../lib/tools\" importa *\n"
                + "ex \"norma/tempus\" importa nunc"
        );
        assertThat(output).isEqualTo(
            "from .util import a as b, c\nfrom ..lib import tools\n"
        );
    }

    @Test
    void lowersRangesToRangeCalls() {
        String output = PyCodeGenTest.lower(
            "ex 0 ante 10 pro i {}\n"
                + "ex 0 usque 10 pro i {}\n"
                + "ex 1 usque n per 2 pro i {}"
        );
        assertThat(output).isEqualTo(
            "for i in range(0, 10):\n    pass\n"
                + "for i in range(0, 11):\n    pass\n"
                + "for i in range(1, n + 1, 2):\n    pass\n"
        );
    }

    @Test
    void chainsConditionsWithElif() {
        String output = PyCodeGenTest.lower(
            "si x > 0 {\n    scribe \"pos\"\n}"
                + " aliter si x < 0 {\n    scribe \"neg\"\n}"
                + " aliter {\n    scribe \"nulla\"\n}"
        );
        assertThat(output).isEqualTo(
            "if x > 0:\n    print(\"pos\")\n"
                + "elif x < 0:\n    print(\"neg\")\n"
                + "else:\n    print(\"nulla\")\n"
        );
    }

    @Test
    void lowersEligeToComparisons() {
        String output = PyCodeGenTest.lower(
            "elige s {\n"
                + "    casu 1 { scribe \"a\" }\n"
                + "    si 2 { scribe \"b\" }\n"
                + "    aliter { scribe \"c\" }\n"
                + "}"
        );
        assertThat(output).isEqualTo(
            "if s == 1:\n    print(\"a\")\n"
                + "elif s == 2:\n    print(\"b\")\n"
                + "else:\n    print(\"c\")\n"
        );
    }

    @Test
    void computesEnumValues() {
        String output = PyCodeGenTest.lower(
            "ordo Color { Ruber, Viridis = 5, Caeruleus }"
        );
        assertThat(output).isEqualTo(
            "from enum import Enum\n\n"
                + "class Color(Enum):\n"
                + "    Ruber = 0\n"
                + "    Viridis = 5\n"
                + "    Caeruleus = 6\n"
        );
    }

    @Test
    void lowersUnionsToDataclasses() {
        String output = PyCodeGenTest.lower(
            "discretio Forma { Circulus { numerus radius }, Punctum }"
        );
        assertThat(output).isEqualTo(
            "from dataclasses import dataclass\n\n"
                + "@dataclass\n"
                + "class Forma_Circulus:\n"
                + "    radius: int\n"
                + "    tag: str = \"Circulus\"\n"
                + "\n"
                + "@dataclass\n"
                + "class Forma_Punctum:\n"
                + "    tag: str = \"Punctum\"\n"
                + "\n"
                + "Forma = Forma_Circulus | Forma_Punctum\n"
        );
    }

    @Test
    void matchesVariantClassesWhenTyped() {
        String output = PyCodeGenTest.lower(
            "discerne f {\n"
                + "    si Circulus pro r { scribe r }\n"
                + "    aliter { scribe 0 }\n"
                + "}",
            new TypedNames().with("f", TypedNames.FORMA)
        );
        assertThat(output).isEqualTo(
            "match f:\n"
                + "    case Forma_Circulus(radius=r):\n"
                + "        print(r)\n"
                + "    case _:\n"
                + "        print(0)\n"
        );
    }

    @Test
    void matchesTagsWhenUntyped() {
        String output = PyCodeGenTest.lower(
            "discerne f {\n    si Circulus pro r { scribe r }\n}"
        );
        assertThat(output)
            .contains("    case object(tag=\"Circulus\", r=r):\n");
    }

    @Test
    void lowersGenusToAClass() {
        String output = PyCodeGenTest.lower(
            "genus Punctum implet Forma {\n"
                + "    numerus x: 0\n"
                + "    functio norma() -> numerus { redde ego.x }\n"
                + "    generis functio origo() -> Punctum { redde novum Punctum }\n"
                + "}"
        );
        assertThat(output).isEqualTo(
            "class Punctum(Forma):\n"
                + "    x: int = 0\n"
                + "\n"
                + "    def __init__(self, overrides: dict = {}):\n"
                + "        if \"x\" in overrides:\n"
                + "            self.x = overrides[\"x\"]\n"
                + "\n"
                + "    def norma(self) -> int:\n"
                + "        return self.x\n"
                + "\n"
                + "    @staticmethod\n"
                + "    def origo() -> Punctum:\n"
                + "        return Punctum()\n"
        );
    }

    @Test
    void lowersPactumToAProtocol() {
        String output = PyCodeGenTest.lower(
            "pactum Forma { functio area() -> numerus }"
        );
        assertThat(output).isEqualTo(
            "from typing import Protocol\n\n"
                + "class Forma(Protocol):\n"
                + "    def area(self) -> int: ...\n"
        );
    }

    @Test
    void declaresTypeVariablesOnce() {
        String output = PyCodeGenTest.lower(
            "functio primus<T>(T[] xs) -> T { redde xs[0] }\n"
                + "functio ultimus<T>(T[] xs) -> T { redde xs[-1] }"
        );
        assertThat(output).startsWith("from typing import TypeVar\n\n");
        assertThat(output.split("T = TypeVar\\(\"T\"\\)", -1)).hasSize(2);
        assertThat(output).contains("def primus(xs: list[T]) -> T:\n");
    }

    @Test
    void wrapsSingleVerbsInDrain() {
        String output = PyCodeGenTest.lower(
            "functio divide(numerus a, numerus b) fit numerus {\n"
                + "    si b == 0 {\n"
                + "        iace \"nulla divisio\"\n"
                + "    }\n"
                + "    redde a / b\n"
                + "}"
        );
        assertThat(output).contains("def drain(gen):");
        assertThat(output).endsWith(
            "def divide(a: int, b: int) -> int:\n"
                + "    def _fluxus():\n"
                + "        if b == 0:\n"
                + "            yield respond.error(\"EFAIL\", \"nulla divisio\")\n"
                + "            return\n"
                + "        yield respond.ok(a / b)\n"
                + "        return\n"
                + "        yield respond.done()\n"
                + "    return drain(_fluxus())\n"
        );
    }

    @Test
    void delegatesStreamVerbsToFlow() {
        String output = PyCodeGenTest.lower(
            "functio numeri(numerus n) fiunt numerus {\n"
                + "    ex 0 ante n pro i {\n"
                + "        cede i\n"
                + "    }\n"
                + "}"
        );
        assertThat(output)
            .contains("from typing import Iterator\n")
            .contains("def numeri(n: int) -> Iterator[int]:\n")
            .contains("            yield respond.item(i)\n")
            .contains("    yield from flow(_fluxus())\n");
    }

    @Test
    void delegatesAsyncStreamVerbs() {
        String output = PyCodeGenTest.lower(
            "functio f(numerus x) fient numerus {\n    cede x\n}"
        );
        assertThat(output)
            .contains("async def drain_async(gen):")
            .contains("async def f(x: int) -> AsyncIterator[int]:\n")
            .contains("    async def _fluxus():\n")
            .contains("        yield respond.item(await x)\n")
            .endsWith(
                "    async for _res in flow_async(_fluxus()):\n"
                    + "        yield _res\n"
            );
    }

    @Test
    void rejectsCedeInSingleVerbs() {
        Result<String> result = PyCodeGenTest.compile(
            "functio f(numerus x) fit numerus {\n    redde cede x\n}",
            Analyzer.NONE
        );
        assertThat(result.isError()).isTrue();
        assertThat(result.getError().get(0).message())
            .isEqualTo("'cede' is not supported when targeting py");
    }

    @Test
    void acceptsOnlySingleReturnLambdaBlocks() {
        assertThat(PyCodeGenTest.lower("fixum g = pro a { redde a + 1 }"))
            .isEqualTo("g = lambda a: a + 1\n");
        Result<String> result = PyCodeGenTest.compile(
            "fixum f = pro a { scribe a }", Analyzer.NONE
        );
        assertThat(result.isError()).isTrue();
        assertThat(result.getError().get(0).message()).isEqualTo(
            "'lambda with a statement body' is not supported when targeting py"
        );
    }

    @Test
    void passesTheReducerBeforeTheSeed() {
        String output = PyCodeGenTest.lower(
            "fixum s = items.reducta(0, (acc, n) => acc + n)"
        );
        assertThat(output)
            .startsWith("import functools\n")
            .endsWith("s = functools.reduce(lambda acc, n: acc + n, items, 0)\n");
    }

    @Test
    void parenthesizesCompoundInclusiveEnds() {
        String output = PyCodeGenTest.lower(
            "fixum x = items[0 usque (n & 3)]\n"
                + "ex 0 usque (n << 1) pro i {}\n"
                + "ex 0 usque n + 1 pro j {}"
        );
        assertThat(output).isEqualTo(
            "x = items[0:(n & 3) + 1]\n"
                + "for i in range(0, (n << 1) + 1):\n    pass\n"
                + "for j in range(0, n + 1 + 1):\n    pass\n"
        );
    }

    @Test
    void restoresPlainReturnsAfterVerbBodies() {
        String output = PyCodeGenTest.lower(
            "functio f(numerus x) fit numerus {\n"
                + "    fixum g = pro a { redde a + 1 }\n"
                + "    redde g(x)\n"
                + "}\n"
                + "functio h() -> numerus {\n"
                + "    redde 1\n"
                + "}"
        );
        assertThat(output)
            .contains("        g = lambda a: a + 1\n")
            .contains("        yield respond.ok(g(x))\n")
            .endsWith("def h() -> int:\n    return 1\n");
    }

    @Test
    void lowersTestSuitesToPytestClasses() {
        String output = PyCodeGenTest.lower(
            "probandum \"vector math\" {\n"
                + "    praepara { scribe 0 }\n"
                + "    postpara omnia { scribe 9 }\n"
                + "    proba \"adds two numbers\" { scribe 1 }\n"
                + "    proba futurum \"later\" \"rounds\" {}\n"
                + "}\n"
                + "proba omitte \"flaky\" \"connects\" { scribe 2 }"
        );
        assertThat(output).startsWith("import pytest\n").endsWith(
            "class TestVectorMath:\n"
                + "    def setup_method(self):\n"
                + "        print(0)\n"
                + "    @classmethod\n"
                + "    def teardown_class(cls):\n"
                + "        print(9)\n"
                + "    def test_adds_two_numbers(self):\n"
                + "        print(1)\n"
                + "    @pytest.mark.skip(reason=\"todo: later\")\n"
                + "    def test_rounds(self):\n"
                + "        pass\n"
                + "@pytest.mark.skip(reason=\"flaky\")\n"
                + "def test_connects():\n"
                + "    print(2)\n"
        );
    }

    @Test
    void lowersCuraToContextManagers() {
        String output = PyCodeGenTest.lower(
            "cura aperi(via) pro textus f { scribe f } cape e { scribe e }\n"
                + "cura arena fit a {}"
        );
        assertThat(output).isEqualTo(
            "try:\n"
                + "    with aperi(via) as f:\n"
                + "        print(f)\n"
                + "except Exception as e:\n"
                + "    print(e)\n"
                + "pass\n"
        );
    }

    @Test
    void lowersEntryPointsUnderAMainGuard() {
        String output = PyCodeGenTest.lower(
            "incipit { scribe 1 }\nincipiet ergo scribe cede f()"
        );
        assertThat(output).startsWith("import asyncio\n").endsWith(
            "if __name__ == \"__main__\":\n"
                + "    print(1)\n"
                + "if __name__ == \"__main__\":\n"
                + "    async def _incipiet():\n"
                + "        print(await f())\n"
                + "    asyncio.run(_incipiet())\n"
        );
    }

    @Test
    void assignsFieldsInsideInBlocks() {
        String output = PyCodeGenTest.lower(
            "in crea() { x = 3\n y += 1 }"
        );
        assertThat(output).isEqualTo(
            "_in0 = crea()\n_in0.x = 3\n_in0.y += 1\n"
        );
    }

    @Test
    void lowersRegexLiteralsAndInput() {
        String output = PyCodeGenTest.lower(
            "fixum r = sed \"\\\\d+\" im\nfixum s = lege\nfixum t = lege lineam"
        );
        assertThat(output)
            .contains("import re\n")
            .contains("import sys\n")
            .endsWith(
                "r = re.compile(r\"(?im)\\d+\")\n"
                    + "s = sys.stdin.read()\n"
                    + "t = input()\n"
            );
    }

    @Test
    void mapsOutputLevels() {
        String output = PyCodeGenTest.lower(
            "scribe \"a\"\nvide \"b\"\nmone \"c\""
        );
        assertThat(output).isEqualTo(
            "import sys\nimport warnings\n\n"
                + "print(\"a\")\n"
                + "print(\"b\", file=sys.stderr)\n"
                + "warnings.warn(\"c\")\n"
        );
    }

    @Test
    void translatesOperators() {
        String output = PyCodeGenTest.lower(
            "scribe a et b, a aut b, a vel b, a == nihil, a != nihil"
        );
        assertThat(output).isEqualTo(
            "print(a and b, a or b, (a if a is not None else b),"
                + " a is None, a is not None)\n"
        );
    }

    @Test
    void translatesTypeChecks() {
        String output = PyCodeGenTest.lower(
            "scribe x est nihil, x est numerus, x non est textus"
        );
        assertThat(output).isEqualTo(
            "print(x is None, isinstance(x, int), not isinstance(x, str))\n"
        );
    }

    @Test
    void raisesPanicsErrorsAndAssertions() {
        String output = PyCodeGenTest.lower(
            "functio f() {\n    mori \"fractum\"\n}\n"
                + "functio g() {\n    iace \"malum\"\n}\n"
                + "adfirma x > 0, \"positivum\""
        );
        assertThat(output)
            .contains("class Panic(Exception):")
            .contains("    raise Panic(\"fractum\")\n")
            .contains("    raise Exception(\"malum\")\n")
            .endsWith("assert x > 0, \"positivum\"\n");
    }

    @Test
    void lowersTryStatements() {
        String output = PyCodeGenTest.lower(
            "tempta {\n    scribe 1\n} cape e {\n    scribe e\n}"
                + " demum {\n    scribe 2\n}"
        );
        assertThat(output).isEqualTo(
            "try:\n    print(1)\n"
                + "except Exception as e:\n    print(e)\n"
                + "finally:\n    print(2)\n"
        );
    }

    @Test
    void lowersExpressionForms() {
        String output = PyCodeGenTest.lower(
            "fixum s = `a${x}b`\n"
                + "fixum y = c ? 1 : 2\n"
                + "fixum t = scriptum(\"§ et §\", a, b)\n"
                + "fixum p = novum Punctum { x: 1 }"
        );
        assertThat(output).isEqualTo(
            "s = f\"a{x}b\"\n"
                + "y = (1 if c else 2)\n"
                + "t = \"{} et {}\".format(a, b)\n"
                + "p = Punctum({\"x\": 1})\n"
        );
    }

    @Test
    void constructsVariantsOfKnownUnions() {
        assertThat(PyCodeGenTest.lower(
            "fixum c = finge Circulus { radius: 2 } qua Forma"
        )).isEqualTo("c = Forma_Circulus(radius=2)\n");
        assertThat(PyCodeGenTest.lower(
            "fixum c = finge Circulus { radius: 2 }"
        )).isEqualTo(
            "from types import SimpleNamespace\n\n"
                + "c = SimpleNamespace(tag=\"Circulus\", radius=2)\n"
        );
    }

    @Test
    void guardsOptionalChainsOnce() {
        assertThat(PyCodeGenTest.lower("scribe a?.b?.c")).isEqualTo(
            "print((a.b.c if a is not None and a.b is not None else None))\n"
        );
    }

    @Test
    void importsMathOnlyWhenNeeded() {
        assertThat(PyCodeGenTest.lower(
            "ex \"norma/mathesis\" importa radix, PI\nscribe radix(2), PI"
        )).isEqualTo("import math\n\nprint(math.sqrt(2), math.pi)\n");
        assertThat(PyCodeGenTest.lower(
            "ex \"norma/mathesis\" importa absolutum\nscribe absolutum(x)"
        )).isEqualTo("print(abs(x))\n");
    }

    @Test
    void evaluatesBlockPraefixumThroughTheHelper() {
        String output = PyCodeGenTest.lower(
            "fixum v = praefixum {\n"
                + "    fixum a = 2\n"
                + "    scribe a\n"
                + "    redde a * 3\n"
                + "}"
        );
        assertThat(output)
            .contains("def __praefixum__(code):")
            .endsWith(
                "v = __praefixum__(\"\"\"def __block__():\n"
                    + "    a = 2\n"
                    + "    print(a)\n"
                    + "    return a * 3\n"
                    + "\"\"\")\n"
            );
    }

    @Test
    void translatesMethodsOfTypedCollections() {
        Analyzer analyzer = new TypedNames()
            .with("xs", TypedNames.lista(TypedNames.NUMERUS))
            .with("m", TypedNames.tabula(TypedNames.TEXTUS, TypedNames.NUMERUS));
        String output = PyCodeGenTest.lower(
            "xs.adde(1)\n"
                + "scribe xs.longitudo\n"
                + "m.pone(\"a\", 1)\n"
                + "scribe m.habet(\"a\")",
            analyzer
        );
        assertThat(output).isEqualTo(
            "xs.append(1)\n"
                + "print(len(xs))\n"
                + "m[\"a\"] = 1\n"
                + "print((\"a\" in m))\n"
        );
    }

}
