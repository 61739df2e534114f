package faberromanus.faberc.compiler.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.Test;

import faberromanus.faberc.compiler.Analyzer;
import faberromanus.faberc.compiler.Compiler;
import faberromanus.faberc.compiler.Options;
import faberromanus.faberc.compiler.Result;
import faberromanus.faberc.compiler.UnknownNodeException;
import faberromanus.faberc.compiler.frontend.AstNode;

class TsCodeGenTest {

    private static Result<String> compile(
        String source, Options options, Analyzer analyzer
    ) {
        return Compiler.compile(
            Map.of("test.fab", source), "test.fab", options, analyzer
        );
    }

    private static String lower(String source, Options options, Analyzer analyzer) {
        Result<String> result = TsCodeGenTest.compile(source, options, analyzer);
        assertThat(result.isError())
            .as(() -> result.isError()? result.getError().toString() : "")
            .isFalse();
        return result.getValue();
    }

    private static String lower(String source, Analyzer analyzer) {
        return TsCodeGenTest.lower(source, Options.DEFAULT, analyzer);
    }

    private static String lower(String source) {
        return TsCodeGenTest.lower(source, Options.DEFAULT, Analyzer.NONE);
    }

    @Test
    void declaresConstantsAndVariables() {
        String output = TsCodeGenTest.lower(
            "fixum numerus x = 1\nvaria y = \"a\""
        );
        assertThat(output).isEqualTo(
            "const x: number = 1;\nlet y = \"a\";\n"
        );
    }

    @Test
    void omitsSemicolonsWhenDisabled() {
        String output = TsCodeGenTest.lower(
            "fixum x = 1", Options.DEFAULT.withSemicolons(false), Analyzer.NONE
        );
        assertThat(output).isEqualTo("const x = 1\n");
    }

    @Test
    void usesTheConfiguredIndentation() {
        String output = TsCodeGenTest.lower(
            "functio f() {\n    scribe 1\n}",
            Options.DEFAULT.withIndent(Options.spaces(2)), Analyzer.NONE
        );
        assertThat(output).isEqualTo(
            "function f() {\n  console.log(1);\n}\n"
        );
    }

    @Test
    void dropsStandardLibraryImports() {
        String output = TsCodeGenTest.lower(
            "ex \"./util\" importa a ut b, c\n"
                + "ex \"norma/tempus\" importa nunc"
        );
        assertThat(output).isEqualTo(
            "import { a as b, c } from \"./util\";\n"
        );
    }

    @Test
    void translatesMathesisIntrinsics() {
        String output = TsCodeGenTest.lower(
            "ex \"norma/mathesis\" importa radix, PI ut pi\n"
                + "scribe radix(2), pi"
        );
        assertThat(output).isEqualTo("console.log(Math.sqrt(2), Math.PI);\n");
    }

    @Test
    void lowersPlainFunctions() {
        String output = TsCodeGenTest.lower(
            "functio add(numerus a, numerus b) -> numerus {\n"
                + "    redde a + b\n"
                + "}"
        );
        assertThat(output).isEqualTo(
            "function add(a: number, b: number): number {\n"
                + "    return a + b;\n"
                + "}\n"
        );
    }

    @Test
    void wrapsSingleVerbsInDrain() {
        String output = TsCodeGenTest.lower(
            "functio divide(numerus a, numerus b) fit numerus {\n"
                + "    si b == 0 {\n"
                + "        iace \"nulla divisio\"\n"
                + "    }\n"
                + "    redde a / b\n"
                + "}"
        );
        assertThat(output).contains("function drain<T>");
        assertThat(output).contains("type Responsum<T>");
        assertThat(output).endsWith(
            "function divide(a: number, b: number): number {\n"
                + "    return drain((function* () {\n"
                + "        if (b === 0) {\n"
                + "            yield respond.error(\"EFAIL\", \"nulla divisio\");\n"
                + "            return;\n"
                + "        }\n"
                + "        yield respond.ok(a / b);\n"
                + "        return;\n"
                + "        yield respond.done();\n"
                + "    })());\n"
                + "}\n"
        );
    }

    @Test
    void awaitsInsideAsyncVerbs() {
        String output = TsCodeGenTest.lower(
            "functio lege(textus via) fiet textus {\n"
                + "    fixum r = cede pete(via)\n"
                + "    redde r\n"
                + "}"
        );
        assertThat(output)
            .contains("async function drainAsync<T>")
            .contains("async function lege(via: string): Promise<string> {\n")
            .contains("    return drainAsync((async function* () {\n")
            .contains("        const r = await pete(via);\n")
            .contains("        yield respond.ok(r);\n");
    }

    @Test
    void yieldsItemsInsideStreamVerbs() {
        String output = TsCodeGenTest.lower(
            "functio numeri(numerus n) fiunt numerus {\n"
                + "    ex 0 ante n pro i {\n"
                + "        cede i\n"
                + "    }\n"
                + "}"
        );
        assertThat(output)
            .contains("function* numeri(n: number): Generator<number> {\n")
            .contains("    yield* flow((function* () {\n")
            .contains("        for (let i = 0; i < n; i++) {\n")
            .contains("            yield respond.item(i);\n")
            .contains("        yield respond.done();\n");
    }

    @Test
    void rejectsCedeInSingleVerbs() {
        Result<String> result = TsCodeGenTest.compile(
            "functio f(numerus x) fit numerus {\n    redde cede x\n}",
            Options.DEFAULT, Analyzer.NONE
        );
        assertThat(result.isError()).isTrue();
        assertThat(result.getError().get(0).message())
            .isEqualTo("'cede' is not supported when targeting ts");
        assertThat(result.getError().get(0).hint()).isPresent();
    }

    @Test
    void lowersNativeModifiersWithoutHelpers() {
        String output = TsCodeGenTest.lower(
            "futura functio f() -> numerus {\n    redde cede g()\n}\n"
                + "cursor functio h(numerus x) -> numerus {\n    cede x\n}"
        );
        assertThat(output)
            .contains("async function f(): Promise<number> {\n")
            .contains("    return await g();\n")
            .contains("function* h(x: number): Generator<number> {\n")
            .contains("    yield x;\n")
            .doesNotContain("drain")
            .doesNotContain("Responsum");
    }

    @Test
    void raisesPanicsAndErrors() {
        String output = TsCodeGenTest.lower(
            "functio f() {\n    mori \"fractum\"\n}\n"
                + "functio g() {\n    iace \"malum\"\n}"
        );
        assertThat(output)
            .contains("class Panic extends Error")
            .contains("    throw new Panic(\"fractum\");\n")
            .contains("    throw new Error(\"malum\");\n");
    }

    @Test
    void mapsOutputLevelsToConsoleMethods() {
        String output = TsCodeGenTest.lower(
            "scribe \"a\"\nvide \"b\"\nmone \"c\""
        );
        assertThat(output).isEqualTo(
            "console.log(\"a\");\nconsole.debug(\"b\");\nconsole.warn(\"c\");\n"
        );
    }

    @Test
    void translatesOperators() {
        String output = TsCodeGenTest.lower(
            "scribe a == b, a != b, a et b, a aut b, a vel b"
        );
        assertThat(output).isEqualTo(
            "console.log(a === b, a !== b, a && b, a || b, a ?? b);\n"
        );
    }

    @Test
    void translatesTypeChecks() {
        String output = TsCodeGenTest.lower(
            "scribe x est numerus, y est nihil, z est lista, w non est textus"
        );
        assertThat(output).isEqualTo(
            "console.log(typeof x === \"number\", y === null,"
                + " Array.isArray(z), typeof w !== \"string\");\n"
        );
    }

    @Test
    void lowersAssertions() {
        String output = TsCodeGenTest.lower("adfirma x > 0, \"positivum\"");
        assertThat(output).isEqualTo(
            "if (!(x > 0)) { throw new Error(\"positivum\"); }\n"
        );
    }

    @Test
    void lowersLoops() {
        String output = TsCodeGenTest.lower(
            "ex 0 usque 10 per 2 pro i {\n    scribe i\n}\n"
                + "ex xs pro x {}\n"
                + "de o pro k {}"
        );
        assertThat(output).isEqualTo(
            "for (let i = 0; i <= 10; i += 2) {\n"
                + "    console.log(i);\n"
                + "}\n"
                + "for (const x of xs) {\n}\n"
                + "for (const k in o) {\n}\n"
        );
    }

    @Test
    void lowersUnionsToTaggedObjectTypes() {
        String output = TsCodeGenTest.lower(
            "discretio Forma { Circulus { numerus radius }, Punctum }"
        );
        assertThat(output).isEqualTo(
            "type Forma =\n"
                + "    | { tag: \"Circulus\"; radius: number }\n"
                + "    | { tag: \"Punctum\" };\n"
        );
    }

    @Test
    void bindsVariantFieldsByPositionWhenTyped() {
        String output = TsCodeGenTest.lower(
            "discerne f {\n"
                + "    si Circulus pro r { scribe r }\n"
                + "    aliter { scribe 0 }\n"
                + "}",
            new TypedNames().with("f", TypedNames.FORMA)
        );
        assertThat(output).isEqualTo(
            "if (f.tag === \"Circulus\") {\n"
                + "    const r = f.radius;\n"
                + "    console.log(r);\n"
                + "} else {\n"
                + "    console.log(0);\n"
                + "}\n"
        );
    }

    @Test
    void bindsVariantFieldsByNameWhenUntyped() {
        String output = TsCodeGenTest.lower(
            "discerne f {\n    si Circulus pro radius { scribe radius }\n}"
        );
        assertThat(output).contains("    const { radius } = f;\n");
    }

    @Test
    void hoistsComputedMatchSubjects() {
        String output = TsCodeGenTest.lower(
            "discerne forma() {\n    si Punctum ut p { scribe p }\n}"
        );
        assertThat(output)
            .startsWith("const _discerne0 = forma();\n")
            .contains("if (_discerne0.tag === \"Punctum\") {\n")
            .contains("    const p = _discerne0;\n");
    }

    @Test
    void lowersGenusToAClass() {
        String output = TsCodeGenTest.lower(
            "genus Punctum implet Forma {\n"
                + "    numerus x: 0\n"
                + "    generis textus nomen: \"p\"\n"
                + "    functio norma() -> numerus { redde ego.x }\n"
                + "}"
        );
        assertThat(output).isEqualTo(
            "class Punctum implements Forma {\n"
                + "    x: number = 0;\n"
                + "    static nomen: string = \"p\";\n"
                + "\n"
                + "    constructor(overrides: Partial<Punctum> = {}) {\n"
                + "        if (overrides.x !== undefined) this.x = overrides.x;\n"
                + "    }\n"
                + "\n"
                + "    norma(): number {\n"
                + "        return this.x;\n"
                + "    }\n"
                + "}\n"
        );
    }

    @Test
    void lowersPactumToAnInterface() {
        String output = TsCodeGenTest.lower(
            "pactum Forma { functio area() -> numerus }"
        );
        assertThat(output).isEqualTo(
            "interface Forma {\n    area(): number;\n}\n"
        );
    }

    @Test
    void lowersObjectConstruction() {
        String output = TsCodeGenTest.lower(
            "fixum p = novum Punctum { x: 1 }\n"
                + "fixum c = finge Circulus { radius: 2 }"
        );
        assertThat(output).isEqualTo(
            "const p = new Punctum({ x: 1 });\n"
                + "const c = { tag: \"Circulus\", radius: 2 };\n"
        );
    }

    @Test
    void lowersExpressionForms() {
        String output = TsCodeGenTest.lower(
            "fixum s = `a${x}`\n"
                + "fixum n = v qua numerus\n"
                + "fixum f = pro a redde a * 2\n"
                + "fixum t = scriptum(\"§ et §\", a, b)"
        );
        assertThat(output).isEqualTo(
            "const s = `a${x}`;\n"
                + "const n = (v as number);\n"
                + "const f = (a) => a * 2;\n"
                + "const t = `${a} et ${b}`;\n"
        );
    }

    @Test
    void translatesMethodsOfTypedCollections() {
        Analyzer analyzer = new TypedNames()
            .with("xs", TypedNames.lista(TypedNames.NUMERUS))
            .with("m", TypedNames.tabula(TypedNames.TEXTUS, TypedNames.NUMERUS));
        String output = TsCodeGenTest.lower(
            "xs.adde(1)\n"
                + "scribe xs.longitudo\n"
                + "m.pone(\"a\", 1)\n"
                + "scribe m.longitudo, m.habet(\"a\")",
            analyzer
        );
        assertThat(output).isEqualTo(
            "xs.push(1);\n"
                + "console.log(xs.length);\n"
                + "m.set(\"a\", 1);\n"
                + "console.log(m.size, m.has(\"a\"));\n"
        );
    }

    @Test
    void guessesSequencesOnlyForUntypedCalls() {
        String output = TsCodeGenTest.lower(
            "ys.adde(1)\nscribe ys.longitudo"
        );
        assertThat(output).isEqualTo(
            "ys.push(1);\nconsole.log(ys.longitudo);\n"
        );
    }

    @Test
    void passesTheReducerBeforeTheSeed() {
        String output = TsCodeGenTest.lower(
            "fixum s = items.reducta(0, (acc, n) => acc + n)"
        );
        assertThat(output).isEqualTo(
            "const s = items.reduce((acc, n) => acc + n, 0);\n"
        );
    }

    @Test
    void parenthesizesCompoundInclusiveEnds() {
        String output = TsCodeGenTest.lower(
            "fixum x = items[0 usque (n & 3)]\n"
                + "fixum y = items[0 usque (a vel b)]\n"
                + "ex 0 usque (a ? b : c) pro i {}\n"
                + "ex 0 usque n + 1 pro j {}"
        );
        assertThat(output).isEqualTo(
            "const x = items.slice(0, (n & 3) + 1);\n"
                + "const y = items.slice(0, (a ?? b) + 1);\n"
                + "for (let i = 0; i <= (a ? b : c); i++) {\n}\n"
                + "for (let j = 0; j <= n + 1; j++) {\n}\n"
        );
    }

    @Test
    void typesRestParametersAsArrays() {
        String output = TsCodeGenTest.lower(
            "functio f(numerus a, ceteri textus b) {}"
        );
        assertThat(output).startsWith(
            "function f(a: number, ...b: string[]) {"
        );
    }

    @Test
    void lowersTestSuitesToRunnerCallbacks() {
        String output = TsCodeGenTest.lower(
            "probandum \"math\" {\n"
                + "    praepara { scribe 0 }\n"
                + "    postparabit omnia { scribe 9 }\n"
                + "    proba \"adds\" { scribe 1 }\n"
                + "    proba omitte \"flaky\" \"divides\" {}\n"
                + "    proba futurum \"later\" \"rounds\" {}\n"
                + "}"
        );
        assertThat(output).isEqualTo(
            "describe(\"math\", () => {\n"
                + "    beforeEach(() => {\n"
                + "        console.log(0);\n"
                + "    });\n"
                + "    afterAll(async () => {\n"
                + "        console.log(9);\n"
                + "    });\n"
                + "    test(\"adds\", () => {\n"
                + "        console.log(1);\n"
                + "    });\n"
                + "    test.skip(\"flaky: divides\", () => {\n"
                + "    });\n"
                + "    test.todo(\"later: rounds\", () => {\n"
                + "    });\n"
                + "});\n"
        );
    }

    @Test
    void releasesCuraResourcesInFinally() {
        String output = TsCodeGenTest.lower(
            "cura aperi(via) pro textus f { scribe f } cape e { mone e }\n"
                + "cura arena fit a { scribe 1 }"
        );
        assertThat(output).isEqualTo(
            "{\n"
                + "    const f: string = aperi(via);\n"
                + "    try {\n"
                + "        console.log(f);\n"
                + "    } catch (e) {\n"
                + "        console.warn(e);\n"
                + "    } finally {\n"
                + "        f.solve?.();\n"
                + "    }\n"
                + "}\n"
                + "{\n"
                + "    console.log(1);\n"
                + "}\n"
        );
    }

    @Test
    void lowersEntryPointsAndFieldScopes() {
        String output = TsCodeGenTest.lower(
            "incipit { scribe 1 }\n"
                + "incipiet ergo scribe cede f()\n"
                + "in p { x = 1\n y += 2\n scribe x }\n"
                + "in crea() { x = 3 }"
        );
        assertThat(output).isEqualTo(
            "console.log(1);\n"
                + "(async () => {\n"
                + "    console.log(await f());\n"
                + "})();\n"
                + "p.x = 1;\n"
                + "p.y += 2;\n"
                + "console.log(x);\n"
                + "const _in0 = crea();\n"
                + "_in0.x = 3;\n"
        );
    }

    @Test
    void lowersRegexLiteralsAndInput() {
        String output = TsCodeGenTest.lower(
            "fixum r = sed \"a/b+\" i\nfixum s = lege\nfixum t = lege lineam"
        );
        assertThat(output)
            .startsWith(
                "const r = /a\\/b+/i;\n"
                    + "const s = await Bun.stdin.text();\n"
            )
            .contains("const t = (await (async () => {")
            .contains("for await (const line of rl)");
    }

    @Test
    void restoresPlainReturnsAfterVerbBodies() {
        String output = TsCodeGenTest.lower(
            "functio f(numerus x) fit numerus {\n"
                + "    fixum g = (numerus a) => {\n"
                + "        redde a + 1\n"
                + "    }\n"
                + "    redde g(x)\n"
                + "}\n"
                + "functio h() -> numerus {\n"
                + "    redde 1\n"
                + "}"
        );
        assertThat(output)
            .contains("return a + 1;\n")
            .contains("yield respond.ok(g(x));\n")
            .doesNotContain("respond.ok(a + 1)")
            .endsWith("function h(): number {\n    return 1;\n}\n");
    }

    @Test
    void recordsFeaturesWhileGenerating() {
        AstNode program = Compiler.parse(
            "test.fab", "functio f() fiunt numerus {\n    cede 1\n}"
        ).getValue();
        TsCodeGen codeGen = new TsCodeGen(Options.DEFAULT);
        codeGen.generate(program);
        assertThat(codeGen.features().contains(Feature.FLUMINA)).isTrue();
        assertThat(codeGen.features().contains(Feature.FLUMINA_ASYNC))
            .isFalse();
    }

    @Test
    void rejectsNodesThatAreNoProgram() {
        AstNode statement = Compiler.parse("test.fab", "f(1)").getValue()
            .<AstNode.Program>getValue().body().get(0);
        assertThatThrownBy(() -> new TsCodeGen(Options.DEFAULT).generate(statement))
            .isInstanceOf(UnknownNodeException.class)
            .hasMessageContaining("EXPRESSION_STATEMENT");
    }

}
