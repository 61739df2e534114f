package faberromanus.faberc.compiler.backend;

import faberromanus.faberc.compiler.frontend.AstNode;
import faberromanus.faberc.compiler.frontend.Token;

/**
 * Binding strength of expressions, with lower values binding tighter
 * and 0 for primary and postfix expressions.
 */
public class Precedence {

    private Precedence() {}

    public static final int PREFIX = Token.Type.PREFIX_PRECEDENCE;
    public static final int CONDITIONAL = 15;
    public static final int ASSIGNMENT = 16;

    public static int ofOperator(String operator) {
        switch(operator) {
            case "*": case "/": case "%": return 4;
            case "+": case "-": return 5;
            case "<<": case ">>": return 7;
            case "&": return 8;
            case "^": return 9;
            case "|": return 10;
            case "<": case ">": case "<=": case ">=": return 11;
            case "==": case "!=": case "===": case "!==": return 12;
            case "et": return 13;
            case "aut": case "vel": return 14;
            default: throw new IllegalArgumentException(
                "unknown operator '" + operator + "'"
            );
        }
    }

    public static int of(AstNode node) {
        switch(node.type) {
            case BINARY:
                return Precedence.ofOperator(
                    node.<AstNode.Binary>getValue().operator()
                );
            case EST: return 12;
            case RANGE: return 6;
            case QUA: return 2;
            case UNARY:
            case CEDE:
            case SPREAD:
            case LEGE:
                return PREFIX;
            case CONDITIONAL: return CONDITIONAL;
            case ASSIGNMENT:
            case LAMBDA:
            case ARROW:
                return ASSIGNMENT;
            default: return 0;
        }
    }

    /**
     * Whether an operand of a binary operator needs parentheses in a
     * target language. Mixed bitwise, shift and comparison operators are
     * always parenthesized since their relative binding differs between
     * languages.
     */
    public static boolean needsParens(
        AstNode operand, String parentOperator, boolean isRight
    ) {
        if(operand.type == AstNode.Type.CEDE) { return true; }
        int child = Precedence.of(operand);
        if(child == 0) { return false; }
        int parent = Precedence.ofOperator(parentOperator);
        if(child > parent) { return true; }
        boolean mixed = operand.type == AstNode.Type.BINARY
            && !operand.<AstNode.Binary>getValue().operator()
                .equals(parentOperator);
        if(child == parent) { return isRight || mixed; }
        boolean childLoose = child >= 7 && child <= 12;
        boolean parentLoose = parent >= 7 && parent <= 12;
        return childLoose && parentLoose;
    }

}
