package net.quantuminvestor.fetch.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit of work for the {@link ResilientFetcher}.
 *
 * @param entityKey what to fetch for (ticker, email address)
 * @param primary the provider tried first, with retries
 * @param fallback provider tried once after the primary is exhausted (may be null)
 * @param rateLimitDelay pause between entities of a batch; also the floor of every backoff delay
 */
public record FetchRequest<T>(
        String entityKey,
        ProviderAdapter<T> primary,
        ProviderAdapter<T> fallback,
        Duration rateLimitDelay
) {

    public FetchRequest {
        Objects.requireNonNull(entityKey, "entityKey must not be null");
        Objects.requireNonNull(primary, "primary must not be null");
        rateLimitDelay = rateLimitDelay == null ? Duration.ZERO : rateLimitDelay;
        if (rateLimitDelay.isNegative()) {
            throw new IllegalArgumentException("rateLimitDelay must not be negative");
        }
    }

    public static <T> FetchRequest<T> of(String entityKey, ProviderAdapter<T> primary) {
        return new FetchRequest<>(entityKey, primary, null, Duration.ZERO);
    }

    public FetchRequest<T> withFallback(ProviderAdapter<T> fallback) {
        return new FetchRequest<>(entityKey, primary, fallback, rateLimitDelay);
    }

    public FetchRequest<T> withRateLimitDelay(Duration delay) {
        return new FetchRequest<>(entityKey, primary, fallback, delay);
    }

    public Optional<ProviderAdapter<T>> fallbackAdapter() {
        return Optional.ofNullable(fallback);
    }
}
