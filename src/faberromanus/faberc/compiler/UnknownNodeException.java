package faberromanus.faberc.compiler;

import faberromanus.faberc.compiler.frontend.AstNode;

/**
 * Thrown when a generator is handed a node kind it has no handler for.
 * This indicates a bug in the generator and is never turned into a
 * user-facing diagnostic.
 */
public class UnknownNodeException extends LoweringException {

    public final AstNode.Type nodeType;

    public UnknownNodeException(
        String generator, AstNode.Type nodeType, Source source
    ) {
        super(new Error(
            "Unknown node kind '" + nodeType + "' in " + generator,
            Error.Marking.error(source, "no handler for this node")
        ));
        this.nodeType = nodeType;
    }

}
