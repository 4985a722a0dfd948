package net.quantuminvestor.fetch.core;

import net.quantuminvestor.fetch.boundary.ProviderException;

import java.time.Duration;
import java.util.Objects;

/**
 * One external source of data, normalised to a common result type.
 *
 * <p>An adapter builds the provider-specific request, parses the provider-specific
 * response and turns every unusable response (empty body, missing field, non-2xx status,
 * unparsable JSON, network error) into a {@link ProviderException}. It never retries and
 * never rate-limits itself; {@link ResilientFetcher} does both.
 *
 * @param <T> the normalised result type
 */
public interface ProviderAdapter<T> {

    /**
     * Stable provider identity, used as the rate-limiter key and in operation names.
     */
    String id();

    /**
     * Minimum time between two calls to this provider.
     */
    default Duration minInterval() {
        return Duration.ZERO;
    }

    /**
     * Fetches the result for one entity.
     *
     * @param entityKey e.g. a ticker symbol or an email address
     * @return the normalised result, never null
     * @throws ProviderException if the provider did not produce a usable result
     */
    T fetch(String entityKey) throws ProviderException;

    /**
     * Adapts a plain function, for providers that need no state of their own.
     */
    static <T> ProviderAdapter<T> of(String id, Duration minInterval, Call<T> call) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(minInterval, "minInterval must not be null");
        Objects.requireNonNull(call, "call must not be null");
        return new ProviderAdapter<>() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public Duration minInterval() {
                return minInterval;
            }

            @Override
            public T fetch(String entityKey) throws ProviderException {
                return call.fetch(entityKey);
            }

            @Override
            public String toString() {
                return "ProviderAdapter[" + id + "]";
            }
        };
    }

    @FunctionalInterface
    interface Call<T> {
        T fetch(String entityKey) throws ProviderException;
    }
}
