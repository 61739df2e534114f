package faberromanus.faberc.compiler.backend;

import faberromanus.faberc.compiler.frontend.AstNode;

/**
 * How the body of the innermost enclosing function is being lowered.
 */
public record FunctionMode(
    AstNode.ReturnVerb verb,
    boolean isAsync,
    boolean isGenerator,
    boolean inMethod
) {

    public static final FunctionMode TOP_LEVEL = new FunctionMode(
        AstNode.ReturnVerb.ARROW, false, false, false
    );

    public static FunctionMode of(AstNode.Function function, boolean inMethod) {
        switch(function.verb()) {
            case FIT:
                return new FunctionMode(function.verb(), false, true, inMethod);
            case FIET:
            case FIENT:
                return new FunctionMode(function.verb(), true, true, inMethod);
            case FIUNT:
                return new FunctionMode(function.verb(), false, true, inMethod);
            case ARROW:
                return new FunctionMode(
                    function.verb(), function.futura(), function.cursor(),
                    inMethod
                );
            default:
                throw new IllegalArgumentException("unhandled verb!");
        }
    }

    /** The mode of a lambda or arrow function body. */
    public static FunctionMode nested(FunctionMode outer) {
        return new FunctionMode(
            AstNode.ReturnVerb.ARROW, false, false, outer.inMethod()
        );
    }

    public boolean isVerb() {
        return this.verb != AstNode.ReturnVerb.ARROW;
    }

    public boolean isStream() {
        return this.verb == AstNode.ReturnVerb.FIUNT
            || this.verb == AstNode.ReturnVerb.FIENT;
    }

}
