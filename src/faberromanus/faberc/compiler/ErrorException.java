package faberromanus.faberc.compiler;

/**
 * A failure that is reported to the user instead of crashing the
 * compiler, such as a syntax error or an unreadable options file.
 */
public class ErrorException extends Exception {

    public final Error error;

    public ErrorException(Error error) {
        super(error.message());
        this.error = error;
    }

    /** A failure caused by the source text at the given location. */
    public static ErrorException at(
        Source location, String message, String note
    ) {
        return new ErrorException(
            new Error(message, Error.Marking.error(location, note))
        );
    }

}
