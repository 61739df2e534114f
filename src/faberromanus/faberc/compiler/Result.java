package faberromanus.faberc.compiler;

import java.util.List;

/**
 * Either a value or the errors that prevented producing it. A result
 * never holds both, and an error result holds at least one error.
 */
public final class Result<T> {

    private final T value;
    private final List<Error> errors;

    private Result(T value, List<Error> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static <T> Result<T> ofValue(T value) {
        if(value == null) {
            throw new IllegalArgumentException(
                "A 'Result' value may not be null!"
            );
        }
        return new Result<>(value, List.of());
    }

    public static <T> Result<T> ofError(Error... errors) {
        return Result.ofError(List.of(errors));
    }

    public static <T> Result<T> ofError(List<Error> errors) {
        if(errors.isEmpty()) {
            throw new IllegalArgumentException(
                "An error 'Result' needs at least one error!"
            );
        }
        return new Result<>(null, List.copyOf(errors));
    }

    public boolean isError() {
        return !this.errors.isEmpty();
    }

    public T getValue() {
        if(this.isError()) {
            throw new IllegalStateException(
                "Attempted to get the value of a 'Result' holding errors: "
                    + this.errors.get(0).message()
            );
        }
        return this.value;
    }

    /** The errors in the order they were reported. */
    public List<Error> getError() {
        if(!this.isError()) {
            throw new IllegalStateException(
                "Attempted to get the errors of a 'Result' holding a value!"
            );
        }
        return this.errors;
    }

}
