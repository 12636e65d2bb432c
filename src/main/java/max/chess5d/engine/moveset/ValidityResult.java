package max.chess5d.engine.moveset;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a value or the reason why it could not be built.
 *
 * @param <T> type of the value
 */
public final class ValidityResult<T> {
    private final T value;
    private final MovesetValidityErr error;

    private ValidityResult(T value, MovesetValidityErr error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ValidityResult<T> ok(T value) {
        return new ValidityResult<>(Objects.requireNonNull(value), null);
    }

    public static <T> ValidityResult<T> err(MovesetValidityErr error) {
        return new ValidityResult<>(null, Objects.requireNonNull(error));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isErr() {
        return error != null;
    }

    public T get() {
        if(error != null) {
            throw new IllegalStateException("No value, moveset rejected with " + error);
        }
        return value;
    }

    public Optional<T> ok() {
        return Optional.ofNullable(value);
    }

    public Optional<MovesetValidityErr> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof ValidityResult<?> other)) {
            return false;
        }
        return Objects.equals(value, other.value) && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
