package net.quantuminvestor.fetch.config;

import net.quantuminvestor.fetch.ops.ConfigResolver;
import net.quantuminvestor.fetch.retry.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Recognised options of the fetch layer.
 *
 * @param maxRetries retries per entity after the first attempt
 * @param backoffBase exponential backoff multiplier
 * @param timeout per-request timeout applied by HTTP provider adapters
 * @param initialDelay backoff delay before the first retry
 */
public record FetchConfig(int maxRetries, double backoffBase, Duration timeout, Duration initialDelay) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public FetchConfig {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static FetchConfig defaults() {
        return new FetchConfig(RetryPolicy.DEFAULT_MAX_RETRIES, RetryPolicy.DEFAULT_BACKOFF_BASE,
                DEFAULT_TIMEOUT, RetryPolicy.DEFAULT_INITIAL_DELAY);
    }

    /**
     * Reads each option from its system property, then its environment variable,
     * falling back to the defaults.
     */
    public static FetchConfig fromEnvironment() {
        FetchConfig d = defaults();
        return new FetchConfig(
                ConfigResolver.resolveInt("fetch.max-retries", "FETCH_MAX_RETRIES", d.maxRetries()),
                ConfigResolver.resolveDouble("fetch.backoff-base", "FETCH_BACKOFF_BASE", d.backoffBase()),
                ConfigResolver.resolveSeconds("fetch.timeout", "FETCH_TIMEOUT", d.timeout()),
                ConfigResolver.resolveSeconds("fetch.initial-delay", "FETCH_INITIAL_DELAY", d.initialDelay()));
    }

    /**
     * The retry policy these options describe.
     */
    public RetryPolicy retryPolicy(String id) {
        return RetryPolicy.exponentialBackoff(id, maxRetries, backoffBase, initialDelay);
    }
}
