package net.quantuminvestor.fetch;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Represents the outcome of a single provider call.
 * Either {@link Ok} containing a normalized result, {@link Exists} for a create-style call
 * whose target was already there, or {@link Fail} containing a {@link ClassifiedFailure}.
 *
 * <p>{@code Exists} is terminal and success-like: it never enters the retry loop.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Exists, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Outcome<T> {

        public Ok {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }
    }

    /**
     * The target of a create-style call already exists.
     *
     * @param detail what the provider said about the existing resource
     */
    record Exists<T>(String detail) implements Outcome<T> {

        public Exists {
            Objects.requireNonNull(detail, "detail must not be null");
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException("Resource already exists: " + detail);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Exists<>(detail);
        }
    }

    /**
     * A failed outcome containing failure details.
     *
     * @param failure the failure details
     */
    record Fail<T>(ClassifiedFailure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isExists() {
        return this instanceof Exists;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * Returns the value of an {@code Ok}, empty otherwise.
     */
    default Optional<T> toOptional() {
        return this instanceof Ok<T> ok ? Optional.of(ok.value()) : Optional.empty();
    }

    /**
     * Returns the failure of a {@code Fail}, empty otherwise.
     */
    default Optional<ClassifiedFailure> failureIfPresent() {
        return this instanceof Fail<T> fail ? Optional.of(fail.failure()) : Optional.empty();
    }

    T getOrThrow();

    T getOrElse(T defaultValue);

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> exists(String detail) {
        return new Exists<>(detail);
    }

    static <T> Outcome<T> fail(ClassifiedFailure failure) {
        return new Fail<>(failure);
    }
}
