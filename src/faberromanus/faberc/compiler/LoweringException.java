package faberromanus.faberc.compiler;

public abstract class LoweringException extends RuntimeException {

    public final Error error;

    protected LoweringException(Error error) {
        super(error.message());
        this.error = error;
    }

}
