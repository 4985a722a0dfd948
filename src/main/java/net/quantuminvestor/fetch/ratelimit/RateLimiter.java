package net.quantuminvestor.fetch.ratelimit;

import net.quantuminvestor.fetch.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Enforces a minimum interval between consecutive calls to the same provider.
 *
 * <p>State is one "last call" instant per provider key, created on first use and kept for
 * the lifetime of the limiter. The slot is consumed whether or not the call that follows
 * succeeds, since the provider counts every request against its quota.
 *
 * <p>Not thread-safe. The fetch layer calls providers strictly sequentially; a concurrent
 * caller would have to serialise the check-sleep-record sequence per provider key.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<String, Instant> lastCall = new HashMap<>();
    private final Clock clock;
    private final Sleeper sleeper;

    public RateLimiter() {
        this(Clock.systemUTC(), Sleeper.THREAD);
    }

    public RateLimiter(Clock clock, Sleeper sleeper) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Blocks until {@code minInterval} has elapsed since the last call recorded for
     * {@code providerKey}, then records now as that provider's last call. Never throws.
     *
     * @return how long the caller was suspended
     */
    public Duration waitIfNeeded(String providerKey, Duration minInterval) {
        Objects.requireNonNull(providerKey, "providerKey must not be null");
        Duration waited = Duration.ZERO;

        Instant previous = lastCall.get(providerKey);
        if (previous != null && minInterval != null && !minInterval.isNegative()) {
            Duration elapsed = Duration.between(previous, clock.instant());
            if (elapsed.compareTo(minInterval) < 0) {
                waited = minInterval.minus(elapsed);
                log.debug("[Rate limit] Waiting {} ms for {}", ceilMillis(waited), providerKey);
                sleep(waited);
            }
        }

        lastCall.put(providerKey, clock.instant());
        return waited;
    }

    /**
     * The last recorded call for a provider, if it has been called at all.
     */
    public Optional<Instant> lastCall(String providerKey) {
        return Optional.ofNullable(lastCall.get(providerKey));
    }

    private void sleep(Duration duration) {
        try {
            sleeper.sleep(ceilMillis(duration));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // sub-millisecond remainders round up so the call never lands early
    static long ceilMillis(Duration duration) {
        return (duration.toNanos() + 999_999L) / 1_000_000L;
    }
}
