package com.eventsourcing.domain.model;

import java.util.function.Function;

/**
 * Outcome of a command that can fail for an expected business reason.
 * Infrastructure failures are exceptions, not Failures.
 *
 * @param <T> the type of the success value
 * @param <E> the type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    record Success<T, E>(T value) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public E errorOrNull() {
            return null;
        }

        @Override
        public <U> Result<U, E> map(Function<T, U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U, E> flatMap(Function<T, Result<U, E>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public <R> R fold(Function<T, R> onSuccess, Function<E, R> onFailure) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T, E>(E error) implements Result<T, E> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new IllegalStateException("Cannot get value from Failure: " + error);
        }

        @Override
        public E errorOrNull() {
            return error;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Result<U, E> map(Function<T, U> mapper) {
            return (Result<U, E>) this;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Result<U, E> flatMap(Function<T, Result<U, E>> mapper) {
            return (Result<U, E>) this;
        }

        @Override
        public <R> R fold(Function<T, R> onSuccess, Function<E, R> onFailure) {
            return onFailure.apply(error);
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    T getOrThrow();

    E errorOrNull();

    <U> Result<U, E> map(Function<T, U> mapper);

    <U> Result<U, E> flatMap(Function<T, Result<U, E>> mapper);

    <R> R fold(Function<T, R> onSuccess, Function<E, R> onFailure);

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
