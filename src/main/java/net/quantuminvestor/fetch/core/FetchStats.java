package net.quantuminvestor.fetch.core;

/**
 * Immutable snapshot of the fetch counters.
 *
 * <p>{@code retriesUsed} only counts retries that preceded a primary success. Retries
 * spent before a fallback success or a final failure are not included.
 */
public record FetchStats(
        long totalAttempts,
        long primarySuccesses,
        long fallbackSuccesses,
        long totalFailures,
        long retriesUsed
) {

    public static final FetchStats EMPTY = new FetchStats(0, 0, 0, 0, 0);

    /**
     * Percentage of attempts that produced a value, 100.0 when nothing was attempted.
     */
    public double successRate() {
        if (totalAttempts == 0) {
            return 100.0;
        }
        return (primarySuccesses + fallbackSuccesses) * 100.0 / totalAttempts;
    }
}
