package faberromanus.faberc.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {

    @TempDir
    Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void resetStreams() {
        this.out = new ByteArrayOutputStream();
        this.err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.run(
            args,
            new PrintStream(this.out, true, StandardCharsets.UTF_8),
            new PrintStream(this.err, true, StandardCharsets.UTF_8)
        );
    }

    private String out() {
        return this.out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return this.err.toString(StandardCharsets.UTF_8);
    }

    private String file(String name, String content) throws IOException {
        Path path = this.dir.resolve(name);
        Files.writeString(path, content);
        return path.toString();
    }

    @Test
    void printsHelp() {
        assertThat(this.run("--help")).isZero();
        assertThat(this.out()).startsWith("Usage: faberc").contains("--target");
    }

    @Test
    void requiresInputFiles() {
        assertThat(this.run("-c")).isEqualTo(1);
        assertThat(this.err())
            .contains("No input files were given")
            .contains("usage: faberc");
    }

    @Test
    void rejectsUnknownArguments() {
        assertThat(this.run("--nope")).isEqualTo(1);
        assertThat(this.err()).contains("'--nope' is not a valid argument");
    }

    @Test
    void writesToStandardOutput() throws IOException {
        String input = this.file("a.fab", "fixum x = 1");
        assertThat(this.run(input)).isZero();
        assertThat(this.out()).isEqualTo("const x = 1;\n");
    }

    @Test
    void appliesFormattingFlags() throws IOException {
        String input = this.file("a.fab", "si x { scribe 1 }");
        assertThat(this.run("-i", "2", "-s", "off", input)).isZero();
        assertThat(this.out()).isEqualTo("if (x) {\n  console.log(1)\n}\n");
    }

    @Test
    void writesTheOutputFile() throws IOException {
        String input = this.file("a.fab", "fixum x = 1");
        Path output = this.dir.resolve("build/a.py");
        assertThat(this.run("-c", "-t", "py", "-o", output.toString(), input))
            .isZero();
        assertThat(Files.readString(output)).isEqualTo("x = 1\n");
        assertThat(this.out()).isEmpty();
    }

    @Test
    void writesSeveralFilesIntoADirectory() throws IOException {
        String first = this.file("a.fab", "scribe 1");
        String second = this.file("b.fab", "scribe 2");
        Path output = this.dir.resolve("out");
        assertThat(this.run("-o", output.toString(), first, second)).isZero();
        assertThat(Files.readString(output.resolve("a.ts")))
            .isEqualTo("console.log(1);\n");
        assertThat(Files.readString(output.resolve("b.ts")))
            .isEqualTo("console.log(2);\n");
    }

    @Test
    void readsTheOptionsFile() throws IOException {
        String config = this.file(
            "faberc.json", "{\"target\": \"fab\", \"indent\": 2}"
        );
        String input = this.file("a.fab", "si x {scribe 1}");
        assertThat(this.run("-f", config, input)).isZero();
        assertThat(this.out()).isEqualTo("si x {\n  scribe 1\n}\n");
    }

    @Test
    void flagsOverrideTheOptionsFile() throws IOException {
        String config = this.file("faberc.json", "{\"target\": \"fab\"}");
        String input = this.file("a.fab", "fixum x = 1");
        assertThat(this.run("-f", config, "-t", "py", input)).isZero();
        assertThat(this.out()).isEqualTo("x = 1\n");
    }

    @Test
    void reportsInvalidValues() throws IOException {
        String input = this.file("a.fab", "fixum x = 1");
        assertThat(this.run("-c", "-s", "maybe", input)).isEqualTo(1);
        assertThat(this.err())
            .contains("'maybe' is not a valid value for '--semicolons'");
        assertThat(this.run("-c", "-t", "rs", input)).isEqualTo(1);
        assertThat(this.err()).contains("'rs' is not a valid target language");
        assertThat(this.run("-c", "-b", "0", input)).isEqualTo(1);
        assertThat(this.err())
            .contains("'0' is not a valid value for '--break-threshold'");
    }

    @Test
    void reportsLoweringErrorsWithTheirSource() throws IOException {
        String input = this.file(
            "a.fab", "functio f() fit numerus { redde cede g() }"
        );
        assertThat(this.run("-c", input)).isEqualTo(1);
        assertThat(this.err())
            .contains("'cede' is not supported when targeting ts")
            .contains("redde cede g()");
    }

    @Test
    void reportsUnreadableFiles() {
        String missing = this.dir.resolve("missing.fab").toString();
        assertThat(this.run("-c", missing)).isEqualTo(1);
        assertThat(this.err()).contains("Unable to read file");
    }

}
