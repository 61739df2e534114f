package faberromanus.faberc.compiler.backend;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import faberromanus.faberc.compiler.Compiler;
import faberromanus.faberc.compiler.frontend.AstNode;

class RangesTest {

    private static AstNode expression(String text) {
        AstNode statement = Compiler.parse("test.fab", text).getValue()
            .<AstNode.Program>getValue().body().get(0);
        return statement.<AstNode.MonoOp>getValue().value();
    }

    private static AstNode.Range range(String text) {
        return RangesTest.expression(text).getValue();
    }

    @Test
    void readsIntegerLiterals() {
        assertThat(Ranges.integerLiteral(RangesTest.expression("42")))
            .contains(42L);
        assertThat(Ranges.integerLiteral(RangesTest.expression("-3")))
            .contains(-3L);
        assertThat(Ranges.integerLiteral(RangesTest.expression("1.5")))
            .isEmpty();
        assertThat(Ranges.integerLiteral(RangesTest.expression("n")))
            .isEmpty();
        assertThat(Ranges.isNegativeLiteral(RangesTest.expression("-1")))
            .isTrue();
    }

    @Test
    void keepsExclusiveEnds() {
        assertThat(Ranges.exclusiveEnd(RangesTest.range("0 .. 10"), "10"))
            .isEqualTo("10");
        assertThat(Ranges.exclusiveEnd(RangesTest.range("0 ante n"), "n"))
            .isEqualTo("n");
    }

    @Test
    void movesInclusiveEndsByOne() {
        assertThat(Ranges.exclusiveEnd(RangesTest.range("0 usque 10"), "10"))
            .isEqualTo("11");
        assertThat(Ranges.exclusiveEnd(RangesTest.range("0 usque -2"), "-2"))
            .isEqualTo("-1");
        assertThat(Ranges.exclusiveEnd(RangesTest.range("0 usque n"), "n"))
            .isEqualTo("n + 1");
    }

    @Test
    void parenthesizesLooseInclusiveEnds() {
        assertThat(Ranges.exclusiveEnd(RangesTest.range("0 usque (n & 3)"), "n & 3"))
            .isEqualTo("(n & 3) + 1");
        assertThat(Ranges.exclusiveEnd(RangesTest.range("0 usque n * 2"), "n * 2"))
            .isEqualTo("n * 2 + 1");
        assertThat(Ranges.exclusiveEnd(RangesTest.range("0 .. (n & 3)"), "n & 3"))
            .isEqualTo("n & 3");
    }

    @Test
    void detectsSlicesUpToTheEnd() {
        assertThat(Ranges.isOpenEnded(RangesTest.range("1 usque -1")))
            .isTrue();
        assertThat(Ranges.isOpenEnded(RangesTest.range("1 .. -1")))
            .isFalse();
        assertThat(Ranges.isOpenEnded(RangesTest.range("1 usque n")))
            .isFalse();
    }

}
