package net.quantuminvestor.fetch.retry;

import net.quantuminvestor.fetch.ClassifiedFailure;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when to retry after a failure. Immutable; share freely.
 *
 * <p>The delay before retry {@code i} (0-based) is
 * {@code initialDelay * backoffBase^i + minDelayFloor}, raised to the failure's
 * {@code retryAfter} hint when the provider sent one.
 *
 * @param id identifier used in reporting
 * @param maxRetries retries after the first attempt (so {@code maxRetries + 1} attempts in total)
 * @param backoffBase exponential multiplier, strictly greater than 1
 * @param initialDelay delay before the first retry, before the floor is added
 * @param minDelayFloor fixed amount added to every computed delay
 */
public record RetryPolicy(
        String id,
        int maxRetries,
        double backoffBase,
        Duration initialDelay,
        Duration minDelayFloor
) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final double DEFAULT_BACKOFF_BASE = 2.0;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);

    public RetryPolicy {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        minDelayFloor = minDelayFloor == null ? Duration.ZERO : minDelayFloor;
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was: " + maxRetries);
        }
        if (!(backoffBase > 1.0)) {
            throw new IllegalArgumentException("backoffBase must be > 1, was: " + backoffBase);
        }
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be negative");
        }
        if (minDelayFloor.isNegative()) {
            throw new IllegalArgumentException("minDelayFloor must not be negative");
        }
    }

    /**
     * Three retries, base 2, one second initial delay, no floor.
     */
    public static RetryPolicy defaults(String id) {
        return exponentialBackoff(id, DEFAULT_MAX_RETRIES, DEFAULT_BACKOFF_BASE, DEFAULT_INITIAL_DELAY);
    }

    public static RetryPolicy exponentialBackoff(String id, int maxRetries, double backoffBase, Duration initialDelay) {
        return new RetryPolicy(id, maxRetries, backoffBase, initialDelay, Duration.ZERO);
    }

    /**
     * A policy that never retries.
     */
    public static RetryPolicy noRetry(String id) {
        return exponentialBackoff(id, 0, DEFAULT_BACKOFF_BASE, Duration.ZERO);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Returns a copy whose floor is at least {@code floor}.
     */
    public RetryPolicy withMinDelayFloor(Duration floor) {
        Objects.requireNonNull(floor, "floor must not be null");
        if (floor.compareTo(minDelayFloor) <= 0) {
            return this;
        }
        return new RetryPolicy(id, maxRetries, backoffBase, initialDelay, floor);
    }

    /**
     * Computes the backoff before retry {@code retryIndex} (0 for the first retry).
     */
    public Duration delayFor(int retryIndex) {
        if (retryIndex < 0) {
            throw new IllegalArgumentException("retryIndex must be >= 0");
        }
        double millis = initialDelay.toMillis() * Math.pow(backoffBase, retryIndex);
        return Duration.ofMillis(Math.round(millis)).plus(minDelayFloor);
    }

    /**
     * Evaluates a failed attempt and decides whether to retry.
     *
     * @param context the attempt that just failed
     * @param failure its classified failure
     * @return Retry with a delay, or GiveUp
     */
    public RetryDecision decide(RetryContext context, ClassifiedFailure failure) {
        if (!failure.isRetryable()) {
            return RetryDecision.GiveUp.because("failure is not retryable");
        }
        if (context.attemptNumber() >= maxAttempts()) {
            return RetryDecision.GiveUp.because("max retries reached");
        }

        Duration delay = delayFor(context.retryIndex());

        // Respect a provider-imposed wait
        Duration hint = failure.retryAfter();
        if (hint != null && hint.compareTo(delay) > 0) {
            delay = hint;
        }
        return RetryDecision.Retry.after(delay);
    }
}
