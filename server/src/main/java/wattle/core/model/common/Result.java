package wattle.core.model.common;

import java.util.function.Function;

import io.smallrye.mutiny.Uni;

/**
 * Outcome of an operation that either produced a value or failed with an expected error.
 *
 * <p>Expected failures (protocol errors, rejected input) travel as {@link Failure} values
 * instead of exceptions, so a validation pipeline can short-circuit on the first failure
 * with {@link #flatMap} or {@link #flatMapUni}.
 *
 * @param <T> success value type
 * @param <E> failure value type
 */
public sealed interface Result<T, E> {

    record Success<T, E>(T value) implements Result<T, E> {
        public Success {
            if (value == null) {
                throw new IllegalArgumentException("Success value cannot be null");
            }
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        public Failure {
            if (error == null) {
                throw new IllegalArgumentException("Failure error cannot be null");
            }
        }
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * Returns the success value.
     *
     * @throws IllegalStateException if this is a failure
     */
    default T getSuccess() {
        if (this instanceof Success<T, E> success) {
            return success.value();
        }
        throw new IllegalStateException("Result is a failure: " + ((Failure<T, E>) this).error());
    }

    /**
     * Returns the failure value.
     *
     * @throws IllegalStateException if this is a success
     */
    default E getFailure() {
        if (this instanceof Failure<T, E> failure) {
            return failure.error();
        }
        throw new IllegalStateException("Result is a success");
    }

    default <R> Result<R, E> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T, E> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return new Failure<>(getFailure());
    }

    default <R> Result<R, E> flatMap(Function<? super T, Result<R, E>> mapper) {
        if (this instanceof Success<T, E> success) {
            return mapper.apply(success.value());
        }
        return new Failure<>(getFailure());
    }

    /**
     * Chains an asynchronous step that only runs when this result is a success.
     */
    default <R> Uni<Result<R, E>> flatMapUni(Function<? super T, Uni<Result<R, E>>> mapper) {
        if (this instanceof Success<T, E> success) {
            return mapper.apply(success.value());
        }
        return Uni.createFrom().item(new Failure<>(getFailure()));
    }
}
