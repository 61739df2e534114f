package faberromanus.faberc.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import faberromanus.faberc.compiler.frontend.AstNode;

class LoweringCoverageTest {

    private static final String FILE = "constructs.fab";

    private static String source;

    @BeforeAll
    static void loadSource() throws IOException {
        try(InputStream in = LoweringCoverageTest.class.getResourceAsStream(
            "/faberromanus/faberc/constructs.fab"
        )) {
            assertThat(in).isNotNull();
            source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void fixtureUsesEveryStatementKind() {
        Result<AstNode> parsed = Compiler.parse(FILE, source);
        assertThat(parsed.isError()).isFalse();
        Set<AstNode.Type> seen = EnumSet.noneOf(AstNode.Type.class);
        parsed.getValue().transform(node -> {
            seen.add(node.type);
            return node;
        });
        for(AstNode.Type type: AstNode.Type.values()) {
            if(type.ordinal() > AstNode.Type.FAC.ordinal()) { break; }
            assertThat(seen).as("statement kind %s", type).contains(type);
        }
    }

    @ParameterizedTest
    @EnumSource(Target.class)
    void everyTargetLowersEveryStatementKind(Target target) {
        Result<String> lowered = Compiler.compile(
            Map.of(FILE, source), FILE, Options.DEFAULT.withTarget(target)
        );
        assertThat(lowered.isError())
            .as("errors: %s", lowered.isError()? lowered.getError() : "")
            .isFalse();
        assertThat(lowered.getValue()).isNotBlank().endsWith("\n");
    }

}
