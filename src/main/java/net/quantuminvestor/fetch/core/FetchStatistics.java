package net.quantuminvestor.fetch.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulates fetch counters and the failure map for one {@link ResilientFetcher}.
 *
 * <p>Counters only grow until {@link #reset()}. The failure map keeps the latest reason per
 * entity, in first-failure order. Mutators are package-private: only the owning fetcher
 * records outcomes.
 */
public final class FetchStatistics {

    private long totalAttempts;
    private long primarySuccesses;
    private long fallbackSuccesses;
    private long totalFailures;
    private long retriesUsed;
    private final Map<String, String> failures = new LinkedHashMap<>();

    void recordAttempt() {
        totalAttempts++;
    }

    void recordPrimarySuccess(int retries) {
        primarySuccesses++;
        if (retries > 0) {
            retriesUsed += retries;
        }
    }

    void recordFallbackSuccess() {
        fallbackSuccesses++;
    }

    void recordFailure(String entityKey, String reason) {
        failures.put(entityKey, reason);
        totalFailures++;
    }

    public FetchStats snapshot() {
        return new FetchStats(totalAttempts, primarySuccesses, fallbackSuccesses, totalFailures, retriesUsed);
    }

    /**
     * Failed entities and their last failure reason.
     */
    public Map<String, String> failures() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int failureCount() {
        return failures.size();
    }

    public double successRate() {
        return snapshot().successRate();
    }

    public void reset() {
        totalAttempts = 0;
        primarySuccesses = 0;
        fallbackSuccesses = 0;
        totalFailures = 0;
        retriesUsed = 0;
        failures.clear();
    }
}
