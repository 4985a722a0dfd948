package net.quantuminvestor.fetch.core;

import net.quantuminvestor.fetch.ClassifiedFailure;

import java.util.Objects;
import java.util.Optional;

/**
 * How one entity's fetch ended.
 *
 * @param entityKey the entity
 * @param source which path produced the result
 * @param value the result; null unless {@code source} is PRIMARY or FALLBACK
 * @param lastFailure the last failure seen; null unless {@code source} is FAILED
 * @param primaryAttempts how many times the primary provider was invoked
 */
public record FetchResult<T>(
        String entityKey,
        Source source,
        T value,
        ClassifiedFailure lastFailure,
        int primaryAttempts
) {

    public enum Source {
        /** The primary provider returned a value, possibly after retries. */
        PRIMARY,
        /** The primary was exhausted and the single fallback attempt returned a value. */
        FALLBACK,
        /** A create-style call found the resource already there. */
        EXISTING,
        /** Every source failed. */
        FAILED
    }

    public FetchResult {
        Objects.requireNonNull(entityKey, "entityKey must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    static <T> FetchResult<T> primary(String entityKey, T value, int attempts) {
        return new FetchResult<>(entityKey, Source.PRIMARY, value, null, attempts);
    }

    static <T> FetchResult<T> fallback(String entityKey, T value, int attempts) {
        return new FetchResult<>(entityKey, Source.FALLBACK, value, null, attempts);
    }

    static <T> FetchResult<T> existing(String entityKey, int attempts) {
        return new FetchResult<>(entityKey, Source.EXISTING, null, null, attempts);
    }

    static <T> FetchResult<T> failed(String entityKey, ClassifiedFailure lastFailure, int attempts) {
        return new FetchResult<>(entityKey, Source.FAILED, null, lastFailure, attempts);
    }

    /**
     * True when a value was obtained from the primary or the fallback.
     */
    public boolean isSuccess() {
        return source == Source.PRIMARY || source == Source.FALLBACK;
    }

    public boolean isFailure() {
        return source == Source.FAILED;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }
}
