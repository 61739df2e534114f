package faberromanus.faberc.compiler.backend;

import java.util.List;

import faberromanus.faberc.compiler.Target;

/**
 * A method of one of the collection types together with its translation
 * for each target.
 */
public record CollectionMethod(
    String name,
    boolean mutates,
    boolean nullary,
    Emission ts,
    Emission py,
    List<Feature> pyFeatures
) {

    /**
     * Produces the target expression for a call. The arguments are passed
     * as generated fragments so that translations may reorder them.
     */
    @FunctionalInterface
    public static interface Emission {
        String emit(String receiver, List<String> args);
    }

    /** A translation to a method of the same arity on the target side. */
    public static Emission renamed(String method) {
        return (receiver, args) -> receiver + "." + method
            + "(" + String.join(", ", args) + ")";
    }

    public Emission emission(Target target) {
        switch(target) {
            case TYPESCRIPT: return this.ts;
            case PYTHON: return this.py;
            default: throw new IllegalArgumentException(
                "no collection translations for " + target.targetName
            );
        }
    }

}
