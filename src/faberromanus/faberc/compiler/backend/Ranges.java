package faberromanus.faberc.compiler.backend;

import java.util.Optional;

import faberromanus.faberc.compiler.frontend.AstNode;

/**
 * Bound computations shared by the range and slice lowerings of all
 * targets. Targets only know exclusive ends, so inclusive ranges get
 * their end moved by one, at generation time where the end is an integer
 * literal and at runtime otherwise.
 */
public class Ranges {

    private Ranges() {}

    public static Optional<Long> integerLiteral(AstNode node) {
        switch(node.type) {
            case LITERAL: {
                AstNode.Literal literal = node.getValue();
                if(literal.kind() != AstNode.LiteralKind.NUMBER) {
                    return Optional.empty();
                }
                try {
                    return Optional.of(Long.decode(literal.value()));
                } catch(NumberFormatException e) {
                    // fractional literal
                    return Optional.empty();
                }
            }
            case UNARY: {
                AstNode.Unary unary = node.getValue();
                if(!unary.operator().equals("-")) {
                    return Optional.empty();
                }
                return Ranges.integerLiteral(unary.operand()).map(v -> -v);
            }
            default:
                return Optional.empty();
        }
    }

    public static boolean isNegativeLiteral(AstNode node) {
        return Ranges.integerLiteral(node).map(v -> v < 0).orElse(false);
    }

    /**
     * Returns the exclusive end of the given range, given the generated
     * text of its end expression. An end binding looser than addition is
     * parenthesized before one is added.
     */
    public static String exclusiveEnd(AstNode.Range range, String end) {
        if(range.kind() == AstNode.RangeKind.EXCLUSIVE) {
            return end;
        }
        Optional<Long> literal = Ranges.integerLiteral(range.end());
        if(literal.isPresent()) {
            return String.valueOf(literal.get() + 1);
        }
        if(Precedence.needsParens(range.end(), "+", false)) {
            return "(" + end + ") + 1";
        }
        return end + " + 1";
    }

    /**
     * Whether a slice with this range runs up to the end of the sliced
     * value, which is the case for an inclusive end of -1.
     */
    public static boolean isOpenEnded(AstNode.Range range) {
        return range.kind() == AstNode.RangeKind.INCLUSIVE
            && Ranges.integerLiteral(range.end()).map(v -> v == -1)
                .orElse(false);
    }

}
