package faberromanus.faberc.compiler.backend;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import faberromanus.faberc.compiler.frontend.DataType;

/**
 * Resolves a method name to a collection method translation based on the
 * resolved type of the receiver.
 */
public class MethodRegistry {

    private static final Logger LOGGER = Logger.getLogger(
        MethodRegistry.class.getName()
    );

    private MethodRegistry() {}

    public static final String LISTA = "lista";
    public static final String TABULA = "tabula";
    public static final String COPIA = "copia";

    private static boolean isUntyped(Optional<DataType> receiverType) {
        return receiverType.isEmpty()
            || receiverType.get().type == DataType.Type.UNKNOWN;
    }

    /**
     * Looks up a method on the collection the receiver type names. When
     * the receiver has no resolved type the sequence methods are used as
     * a best-effort guess, since sequences are by far the most common
     * receivers. Receivers with a resolved non-collection type never
     * resolve to a collection method.
     */
    public static Optional<CollectionMethod> lookup(
        Optional<DataType> receiverType, String methodName
    ) {
        if(MethodRegistry.isUntyped(receiverType)) {
            Optional<CollectionMethod> guessed = ListaMethods.get(methodName);
            if(guessed.isPresent()) {
                LOGGER.log(
                    Level.FINE,
                    "Receiver of ''{0}'' has no resolved type,"
                        + " assuming a sequence",
                    methodName
                );
            }
            return guessed;
        }
        Optional<String> collection = receiverType.get().genericName();
        if(collection.isEmpty()) {
            return Optional.empty();
        }
        switch(collection.get()) {
            case LISTA: return ListaMethods.get(methodName);
            case TABULA: return TabulaMethods.get(methodName);
            case COPIA: return CopiaMethods.get(methodName);
            default: return Optional.empty();
        }
    }

    /**
     * Looks up a method applicable to plain member access without a call.
     * This only happens when the receiver type is known.
     */
    public static Optional<CollectionMethod> lookupProperty(
        Optional<DataType> receiverType, String propertyName
    ) {
        if(MethodRegistry.isUntyped(receiverType)) {
            return Optional.empty();
        }
        return MethodRegistry.lookup(receiverType, propertyName)
            .filter(CollectionMethod::nullary);
    }

}
