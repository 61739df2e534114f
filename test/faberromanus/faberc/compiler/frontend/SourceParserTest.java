package faberromanus.faberc.compiler.frontend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import faberromanus.faberc.compiler.ErrorException;

class SourceParserTest {

    private static AstNode parse(String text) throws ErrorException {
        return new SourceParser(new Lexer("test.fab", text)).parseProgram();
    }

    private static List<AstNode> body(String text) throws ErrorException {
        return SourceParserTest.parse(text).<AstNode.Program>getValue().body();
    }

    private static AstNode expression(String text) throws ErrorException {
        AstNode statement = SourceParserTest.body(text).get(0);
        assertThat(statement.type)
            .isEqualTo(AstNode.Type.EXPRESSION_STATEMENT);
        return statement.<AstNode.MonoOp>getValue().value();
    }

    @Test
    void programSpansTheWholeFile() throws ErrorException {
        String text = "\n\nscribe 1\n\n";
        AstNode program = SourceParserTest.parse(text);
        assertThat(program.type).isEqualTo(AstNode.Type.PROGRAM);
        assertThat(program.source.startOffset()).isZero();
        assertThat(program.source.endOffset()).isEqualTo(text.length());
    }

    @Test
    void parsesTypedVariables() throws ErrorException {
        AstNode node = SourceParserTest.body("fixum numerus x = 1").get(0);
        assertThat(node.type).isEqualTo(AstNode.Type.VARIABLE);
        AstNode.Variable data = node.getValue();
        assertThat(data.kind()).isEqualTo(AstNode.VarKind.FIXUM);
        assertThat(data.type()).isPresent();
        assertThat(data.type().get().<AstNode.TypeAnnotation>getValue().name())
            .isEqualTo("numerus");
        assertThat(data.target().<AstNode.Identifier>getValue().name())
            .isEqualTo("x");
        assertThat(data.value().get().<AstNode.Literal>getValue().value())
            .isEqualTo("1");
    }

    @Test
    void parsesNullableAndArrayTypes() throws ErrorException {
        List<AstNode> body = SourceParserTest.body(
            "varia textus? nomen\nvaria numerus[][] grid"
        );
        AstNode.TypeAnnotation nullable = body.get(0)
            .<AstNode.Variable>getValue().type().get().getValue();
        assertThat(nullable.name()).isEqualTo("textus");
        assertThat(nullable.nullable()).isTrue();
        AstNode.TypeAnnotation array = body.get(1)
            .<AstNode.Variable>getValue().type().get().getValue();
        assertThat(array.name()).isEqualTo("numerus");
        assertThat(array.arrayDepth()).isEqualTo(2);
    }

    @Test
    void parsesVerbFunctions() throws ErrorException {
        AstNode node = SourceParserTest.body(
            "functio f(numerus a, textus b vel \"x\") fit numerus { redde a }"
        ).get(0);
        AstNode.Function data = node.getValue();
        assertThat(data.name()).isEqualTo("f");
        assertThat(data.verb()).isEqualTo(AstNode.ReturnVerb.FIT);
        assertThat(data.params()).hasSize(2);
        assertThat(data.params().get(1).<AstNode.Parameter>getValue()
            .defaultValue()).isPresent();
        assertThat(data.body()).isPresent();
    }

    @Test
    void binaryOperatorsHonorPrecedence() throws ErrorException {
        AstNode.Binary sum = SourceParserTest.expression("a + b * c")
            .getValue();
        assertThat(sum.operator()).isEqualTo("+");
        assertThat(sum.right().<AstNode.Binary>getValue().operator())
            .isEqualTo("*");
    }

    @Test
    void binaryOperatorsAssociateLeft() throws ErrorException {
        AstNode.Binary difference = SourceParserTest.expression("a - b - c")
            .getValue();
        assertThat(difference.left().type).isEqualTo(AstNode.Type.BINARY);
        assertThat(difference.right().type).isEqualTo(AstNode.Type.IDENTIFIER);
    }

    @Test
    void normalizesLogicalOperators() throws ErrorException {
        AstNode.Binary or = SourceParserTest.expression("a && b || c")
            .getValue();
        assertThat(or.operator()).isEqualTo("aut");
        assertThat(or.left().<AstNode.Binary>getValue().operator())
            .isEqualTo("et");
        assertThat(SourceParserTest.expression("a ?? b")
            .<AstNode.Binary>getValue().operator()).isEqualTo("vel");
    }

    @Test
    void parsesRangeKinds() throws ErrorException {
        AstNode loop = SourceParserTest.body("ex 0 usque 10 per 2 pro i {}")
            .get(0);
        AstNode.Iteratio data = loop.getValue();
        assertThat(data.kind()).isEqualTo(AstNode.IterKind.EX);
        AstNode.Range range = data.iterable().getValue();
        assertThat(range.kind()).isEqualTo(AstNode.RangeKind.INCLUSIVE);
        assertThat(range.step()).isPresent();
        AstNode.Range exclusive = SourceParserTest.expression("0 ante n")
            .getValue();
        assertThat(exclusive.kind()).isEqualTo(AstNode.RangeKind.EXCLUSIVE);
    }

    @Test
    void distinguishesImportsFromDestructuring() throws ErrorException {
        List<AstNode> body = SourceParserTest.body(
            "ex \"norma/mathesis\" importa radix, PI ut pi\n"
                + "ex persona fixum nomen, aetas"
        );
        AstNode.Import imported = body.get(0).getValue();
        assertThat(imported.source()).isEqualTo("norma/mathesis");
        assertThat(imported.specifiers()).hasSize(2);
        assertThat(imported.specifiers().get(1).localName()).isEqualTo("pi");
        assertThat(body.get(1).type).isEqualTo(AstNode.Type.DESTRUCTURE);
    }

    @Test
    void reddeOnlyTakesAValueOnTheSameLine() throws ErrorException {
        AstNode function = SourceParserTest.body(
            "functio f() {\n    redde\n    x\n}"
        ).get(0);
        List<AstNode> statements = function.<AstNode.Function>getValue()
            .body().get().<AstNode.Block>getValue().body();
        assertThat(statements).hasSize(2);
        assertThat(statements.get(0).<AstNode.Redde>getValue().value())
            .isEmpty();
    }

    @Test
    void parsesUnionsAndMatches() throws ErrorException {
        List<AstNode> body = SourceParserTest.body(
            "discretio Forma { Circulus { numerus radius }, Punctum }\n"
                + "discerne f {\n"
                + "    si Circulus pro r { scribe r }\n"
                + "    si Punctum ut p { scribe p }\n"
                + "    aliter { scribe 0 }\n"
                + "}"
        );
        AstNode.Discretio union = body.get(0).getValue();
        assertThat(union.variants()).extracting(AstNode.VariantDecl::name)
            .containsExactly("Circulus", "Punctum");
        AstNode.Discerne match = body.get(1).getValue();
        assertThat(match.cases()).hasSize(2);
        assertThat(match.cases().get(0).bindings()).containsExactly("r");
        assertThat(match.cases().get(1).alias()).contains("p");
        assertThat(match.otherwise()).isPresent();
    }

    @Test
    void parsesGenusMembers() throws ErrorException {
        AstNode node = SourceParserTest.body(
            "genus Punctum implet Forma {\n"
                + "    numerus x: 0\n"
                + "    privatus functio norma() -> numerus { redde ego.x }\n"
                + "}"
        ).get(0);
        AstNode.Genus data = node.getValue();
        assertThat(data.implemented()).containsExactly("Forma");
        assertThat(data.members()).extracting(m -> m.type).containsExactly(
            AstNode.Type.GENUS_FIELD, AstNode.Type.FUNCTION
        );
        assertThat(data.members().get(1).<AstNode.Function>getValue()
            .isPrivate()).isTrue();
    }

    @Test
    void parsesTemplateExpressions() throws ErrorException {
        AstNode.Template data = SourceParserTest.expression("`a${x + 1}b`")
            .getValue();
        assertThat(data.quasis()).containsExactly("a", "b");
        assertThat(data.expressions()).hasSize(1);
        assertThat(data.expressions().get(0).type)
            .isEqualTo(AstNode.Type.BINARY);
    }

    @Test
    void parsesObjectsWithSpreadAndShorthand() throws ErrorException {
        AstNode.ObjectLiteral data = SourceParserTest.expression(
            "({ sparge base, nomen, \"aetas\": 3 })"
        ).getValue();
        assertThat(data.properties()).hasSize(3);
        assertThat(data.properties().get(0).key()).isEmpty();
        assertThat(data.properties().get(0).value().type)
            .isEqualTo(AstNode.Type.SPREAD);
        assertThat(data.properties().get(1).value().type)
            .isEqualTo(AstNode.Type.IDENTIFIER);
    }

    @Test
    void parsesResourceScopes() throws ErrorException {
        List<AstNode> body = SourceParserTest.body(
            "cura aperi(via) fiet textus f { scribe f } cape e { mone e }\n"
                + "cura arena fit a {}\n"
                + "cura post omnia { purga() }"
        );
        AstNode.Cura resource = body.get(0).getValue();
        assertThat(resource.curator()).isEmpty();
        assertThat(resource.resource().get().type)
            .isEqualTo(AstNode.Type.CALL);
        assertThat(resource.async()).isTrue();
        assertThat(resource.type().get().<AstNode.TypeAnnotation>getValue()
            .name()).isEqualTo("textus");
        assertThat(resource.binding()).isEqualTo("f");
        assertThat(resource.cape()).isPresent();
        AstNode.Cura allocator = body.get(1).getValue();
        assertThat(allocator.curator()).contains("arena");
        assertThat(allocator.resource()).isEmpty();
        assertThat(body.get(2).type).isEqualTo(AstNode.Type.PRAEPARA);
        AstNode.Praepara hook = body.get(2).getValue();
        assertThat(hook.after()).isTrue();
        assertThat(hook.all()).isTrue();
    }

    @Test
    void parsesTestSuites() throws ErrorException {
        AstNode suite = SourceParserTest.body(
            "probandum \"math\" {\n"
                + "    praeparabit { cede init() }\n"
                + "    proba \"adds\" { adfirma 1 + 1 == 2 }\n"
                + "    proba omitte \"flaky\" \"divides\" {}\n"
                + "}"
        ).get(0);
        AstNode.Probandum data = suite.getValue();
        assertThat(data.name()).isEqualTo("math");
        assertThat(data.body()).extracting(n -> n.type).containsExactly(
            AstNode.Type.PRAEPARA, AstNode.Type.PROBA, AstNode.Type.PROBA
        );
        assertThat(data.body().get(0).<AstNode.Praepara>getValue().async())
            .isTrue();
        AstNode.Proba skipped = data.body().get(2).getValue();
        assertThat(skipped.name()).isEqualTo("divides");
        assertThat(skipped.modifier()).contains(AstNode.ProbaModifier.OMITTE);
        assertThat(skipped.reason()).contains("flaky");
    }

    @Test
    void rejectsPlainStatementsInTestSuites() {
        assertThatThrownBy(() -> SourceParserTest.parse(
            "probandum \"s\" { scribe 1 }"
        ))
            .isInstanceOf(ErrorException.class)
            .hasMessage("Statement in test suite");
    }

    @Test
    void parsesEntryPointsAndFieldScopes() throws ErrorException {
        List<AstNode> body = SourceParserTest.body(
            "incipiet ergo scribe 1\nin p { x = 1 }"
        );
        AstNode.Incipit entry = body.get(0).getValue();
        assertThat(entry.async()).isTrue();
        assertThat(entry.body().type).isEqualTo(AstNode.Type.SCRIBE);
        AstNode.In scope = body.get(1).getValue();
        assertThat(scope.object().<AstNode.Identifier>getValue().name())
            .isEqualTo("p");
        assertThat(scope.body().<AstNode.Block>getValue().body()).hasSize(1);
    }

    @Test
    void readsRegexLiteralsAndInput() throws ErrorException {
        AstNode.Regex regex = SourceParserTest.expression(
            "sed \"a\\\\d+\" im"
        ).getValue();
        assertThat(regex.pattern()).isEqualTo("a\\d+");
        assertThat(regex.flags()).isEqualTo("im");
        AstNode.Lege line = SourceParserTest.expression("lege lineam")
            .getValue();
        assertThat(line.line()).isTrue();
        assertThat(SourceParserTest.expression("lege(fd)").type)
            .isEqualTo(AstNode.Type.CALL);
    }

    @Test
    void rejectsMethodBodiesInPactum() {
        assertThatThrownBy(() -> SourceParserTest.parse(
            "pactum Forma { functio area() -> numerus { redde 0 } }"
        ))
            .isInstanceOf(ErrorException.class)
            .hasMessage("Method body in interface");
    }

    @Test
    void rejectsAssignmentToLiterals() {
        assertThatThrownBy(() -> SourceParserTest.parse("1 = 2"))
            .isInstanceOf(ErrorException.class)
            .hasMessage("Assignment to a non-assignable expression");
    }

    @Test
    void reportsUnexpectedSyntax() {
        assertThatThrownBy(() -> SourceParserTest.parse("fixum = 1"))
            .isInstanceOf(ErrorException.class)
            .hasMessage("Unexpected syntax");
    }

}
