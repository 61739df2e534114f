package faberromanus.faberc.compiler;

/**
 * Thrown when a valid source construct has no translation for the
 * selected target. The error always carries the construct to use instead.
 */
public class UnsupportedConstructException extends LoweringException {

    public UnsupportedConstructException(
        String construct, Target target, String suggestion, Source source
    ) {
        super(new Error(
            "'" + construct + "' is not supported when targeting "
                + target.targetName,
            suggestion,
            Error.Marking.error(source, "cannot be lowered")
        ));
    }

}
