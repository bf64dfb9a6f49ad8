package com.baufi.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a fallible calculation: either a value or one error from the caller's closed error set.
 * Business-rule violations are reported through this type, never through exceptions.
 *
 * @param <T> value type
 * @param <E> error type, usually an enum owned by the type being constructed
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException if this is a failure
     */
    T getValue();

    /**
     * Error of a failed result.
     *
     * @throws IllegalStateException if this is a success
     */
    E getError();

    default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T, E> s) {
            return success(mapper.apply(s.value()));
        }
        return failure(getError());
    }

    default <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        if (this instanceof Success<T, E> s) {
            return mapper.apply(s.value());
        }
        return failure(getError());
    }

    default <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
        if (this instanceof Failure<T, E> f) {
            return failure(mapper.apply(f.error()));
        }
        return success(getValue());
    }

    default <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
        if (this instanceof Success<T, E> s) {
            return onSuccess.apply(s.value());
        }
        return onFailure.apply(getError());
    }

    default T getOrElse(T fallback) {
        return isSuccess() ? getValue() : fallback;
    }

    default Optional<T> toOptional() {
        return isSuccess() ? Optional.ofNullable(getValue()) : Optional.empty();
    }

    /**
     * Unwraps a result that cannot fail for the given input, e.g. library constants.
     * A failure here is a programming defect.
     */
    default T orElseThrow() {
        if (this instanceof Failure<T, E> f) {
            throw new IllegalStateException("Expected a valid value but construction failed with " + f.error());
        }
        return getValue();
    }

    record Success<T, E>(T value) implements Result<T, E> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public E getError() {
            throw new IllegalStateException("Success has no error");
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {

        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Failure has no value: " + error);
        }

        @Override
        public E getError() {
            return error;
        }
    }
}
