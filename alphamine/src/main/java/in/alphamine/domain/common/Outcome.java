package in.alphamine.domain.common;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of one unit of remote work: either a value or a classified failure.
 */
public record Outcome<T>(T value, ErrorKind errorKind, String errorMessage) {

    public Outcome {
        if (errorKind == null && value == null) {
            throw new IllegalArgumentException("A successful outcome needs a value");
        }
        if (errorKind != null && value != null) {
            throw new IllegalArgumentException("A failed outcome cannot carry a value");
        }
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Outcome<T> failure(ErrorKind kind, String message) {
        return new Outcome<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
        if (isFailure()) {
            return failure(errorKind, errorMessage);
        }
        return success(mapper.apply(value));
    }

    /**
     * @throws IllegalStateException if this outcome is a failure
     */
    public T orElseThrow() {
        if (isFailure()) {
            throw new IllegalStateException(errorKind + ": " + errorMessage);
        }
        return value;
    }
}
