package faberromanus.faberc.compiler.backend;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import faberromanus.faberc.compiler.Target;

class PreambleTest {

    private static Features features(Feature... recorded) {
        Features features = new Features();
        for(Feature feature: recorded) {
            features.add(feature);
        }
        return features;
    }

    @Test
    void rendersNothingWithoutFeatures() {
        assertThat(Preamble.render(Target.TYPESCRIPT, new Features()))
            .isEmpty();
        assertThat(Preamble.render(Target.PYTHON, new Features())).isEmpty();
        assertThat(Preamble.render(
            Target.FABER, PreambleTest.features(Feature.PANIC)
        )).isEmpty();
    }

    @Test
    void ordersPythonImportsByFeature() {
        String preamble = Preamble.render(Target.PYTHON, PreambleTest.features(
            Feature.TYPING_PROTOCOL, Feature.ENUM, Feature.MATH,
            Feature.TYPING_ITERATOR, Feature.SYS
        ));
        assertThat(preamble).isEqualTo(
            "import sys\n"
                + "import math\n"
                + "from enum import Enum\n"
                + "from typing import Iterator, Protocol\n"
                + "\n"
        );
    }

    @Test
    void includesResponseHelpersForEitherStreamKind() {
        String sync = Preamble.render(
            Target.TYPESCRIPT, PreambleTest.features(Feature.FLUMINA)
        );
        assertThat(sync)
            .contains("type Responsum<T>")
            .contains("function drain<T>")
            .doesNotContain("drainAsync");
        String async = Preamble.render(
            Target.PYTHON, PreambleTest.features(Feature.FLUMINA_ASYNC)
        );
        assertThat(async)
            .contains("class Responsum")
            .contains("async def drain_async(gen)")
            .doesNotContain("def drain(gen)");
    }

    @Test
    void importsDecimalForTypeScript() {
        assertThat(Preamble.render(
            Target.TYPESCRIPT, PreambleTest.features(Feature.DECIMAL)
        )).isEqualTo("import Decimal from \"decimal.js\";\n\n");
    }

    @Test
    void featuresOnlyGrow() {
        Features features = PreambleTest.features(Feature.PANIC);
        features.add(Feature.PANIC);
        assertThat(features.contains(Feature.PANIC)).isTrue();
        assertThat(features.contains(Feature.MATH)).isFalse();
        assertThat(features.toString()).isEqualTo("[PANIC]");
    }

}
