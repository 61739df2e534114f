package faberromanus.faberc.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.Test;

import faberromanus.faberc.compiler.frontend.AstNode;

class CompilerTest {

    private static Result<String> compile(String fileName, String text) {
        return Compiler.compile(
            Map.of(fileName, text), fileName, Options.DEFAULT
        );
    }

    private static String message(Result<?> result) {
        assertThat(result.isError()).isTrue();
        return result.getError().get(0).message();
    }

    @Test
    void lowersToTheSelectedTarget() {
        Result<String> ts = CompilerTest.compile("a.fab", "scribe 1");
        assertThat(ts.getValue()).isEqualTo("console.log(1);\n");
        Result<String> py = Compiler.compile(
            Map.of("a.fab", "scribe 1"), "a.fab",
            Options.DEFAULT.withTarget(Target.PYTHON)
        );
        assertThat(py.getValue()).isEqualTo("print(1)\n");
    }

    @Test
    void reportsMissingFiles() {
        Result<String> result = Compiler.compile(
            Map.of(), "a.fab", Options.DEFAULT
        );
        assertThat(CompilerTest.message(result))
            .isEqualTo("The file 'a.fab' was not provided");
    }

    @Test
    void reportsUnsupportedExtensions() {
        assertThat(CompilerTest.message(CompilerTest.compile("a.txt", "")))
            .isEqualTo("Unsupported file extension for file 'a.txt'");
    }

    @Test
    void reportsSyntaxErrors() {
        assertThat(CompilerTest.message(CompilerTest.compile(
            "a.fab", "fixum = 1"
        ))).isEqualTo("Unexpected syntax");
    }

    @Test
    void reportsUnsupportedConstructs() {
        Result<String> result = CompilerTest.compile(
            "a.fab", "functio f() fit numerus { redde cede g() }"
        );
        assertThat(CompilerTest.message(result))
            .isEqualTo("'cede' is not supported when targeting ts");
        assertThat(result.getError().get(0).hint()).isPresent();
    }

    @Test
    void lowersTheAnalyzedTree() {
        AstNode replacement = Compiler.parse("a.fab", "scribe 2").getValue();
        Result<String> result = Compiler.compile(
            Map.of("a.fab", "scribe 1"), "a.fab", Options.DEFAULT,
            program -> replacement
        );
        assertThat(result.getValue()).isEqualTo("console.log(2);\n");
    }

    @Test
    void reportsAnalyzerErrors() {
        Result<String> result = Compiler.compile(
            Map.of("a.fab", "scribe 1"), "a.fab", Options.DEFAULT,
            program -> { throw new ErrorException(new Error("Unknown type")); }
        );
        assertThat(CompilerTest.message(result)).isEqualTo("Unknown type");
    }

    @Test
    void propagatesUnknownNodes() {
        assertThatThrownBy(() -> Compiler.compile(
            Map.of("a.fab", "f(1)"), "a.fab", Options.DEFAULT,
            program -> program.<AstNode.Program>getValue().body().get(0)
        ))
            .isInstanceOf(UnknownNodeException.class)
            .hasMessageContaining("EXPRESSION_STATEMENT");
    }

}
