package faberromanus.faberc.compiler.backend;

import java.util.Optional;

import faberromanus.faberc.compiler.frontend.AstNode;

/**
 * Statement shapes that the targets lower the same way.
 */
public class Statements {

    private Statements() {}

    /**
     * The assignment of an 'in' block statement that targets a bare name,
     * which assigns a field of the block's object.
     */
    public static Optional<AstNode.Assignment> fieldAssignment(
        AstNode statement
    ) {
        if(statement.type != AstNode.Type.EXPRESSION_STATEMENT) {
            return Optional.empty();
        }
        AstNode value = statement.<AstNode.MonoOp>getValue().value();
        if(value.type != AstNode.Type.ASSIGNMENT) { return Optional.empty(); }
        AstNode.Assignment assignment = value.getValue();
        return assignment.target().type == AstNode.Type.IDENTIFIER
            ? Optional.of(assignment)
            : Optional.empty();
    }

    /** The label of a skipped or pending test, prefixed by its reason. */
    public static String testLabel(AstNode.Proba proba) {
        if(proba.modifier().isEmpty()) { return proba.name(); }
        return proba.reason().orElse("") + ": " + proba.name();
    }

}
