package net.quantuminvestor.fetch.ratelimit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RateLimiterTest {

    private static final Instant START = Instant.parse("2024-01-02T10:00:00Z");

    private MutableClock clock;
    private List<Long> sleeps;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        sleeps = new ArrayList<>();
        limiter = new RateLimiter(clock, millis -> {
            sleeps.add(millis);
            clock.advanceMillis(millis);
        });
    }

    @Test
    void firstCall_neverWaits() {
        Duration waited = limiter.waitIfNeeded("alphavantage", Duration.ofSeconds(12));

        assertThat(waited).isZero();
        assertThat(sleeps).isEmpty();
        assertThat(limiter.lastCall("alphavantage")).contains(START);
    }

    @Test
    void secondCallWithinInterval_waitsForRemainder() {
        limiter.waitIfNeeded("alphavantage", Duration.ofSeconds(12));
        clock.advance(Duration.ofSeconds(5));

        Duration waited = limiter.waitIfNeeded("alphavantage", Duration.ofSeconds(12));

        assertThat(waited).isEqualTo(Duration.ofSeconds(7));
        assertThat(sleeps).containsExactly(7000L);
        assertThat(limiter.lastCall("alphavantage")).contains(START.plusSeconds(12));
    }

    @Test
    void callAfterInterval_doesNotWait() {
        limiter.waitIfNeeded("finnhub", Duration.ofMillis(1300));
        clock.advance(Duration.ofSeconds(2));

        assertThat(limiter.waitIfNeeded("finnhub", Duration.ofMillis(1300))).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void providersAreTrackedIndependently() {
        limiter.waitIfNeeded("alphavantage", Duration.ofSeconds(12));

        assertThat(limiter.waitIfNeeded("marketstack", Duration.ofSeconds(2))).isZero();
        assertThat(limiter.lastCall("finnhub")).isEmpty();
    }

    @Test
    void suspensionIsAtLeastIntervalMinusElapsed() {
        Duration interval = Duration.ofMillis(2000);
        long[] gaps = {0, 1, 250, 1999, 2000, 3500};

        for (long gap : gaps) {
            sleeps.clear();
            limiter.waitIfNeeded("p", interval);
            clock.advanceMillis(gap);

            Duration waited = limiter.waitIfNeeded("p", interval);

            long expected = Math.max(0, interval.toMillis() - gap);
            assertThat(waited.toMillis()).as("gap %d", gap).isGreaterThanOrEqualTo(expected);
            clock.advance(interval);
        }
    }

    @Test
    void subMillisecondRemainder_isRoundedUp() {
        limiter.waitIfNeeded("alphavantage", Duration.ofSeconds(12));
        clock.advance(Duration.ofNanos(11_999_400_000L));

        limiter.waitIfNeeded("alphavantage", Duration.ofSeconds(12));

        assertThat(sleeps).containsExactly(1L);
        Duration gap = Duration.between(START, limiter.lastCall("alphavantage").orElseThrow());
        assertThat(gap).isGreaterThanOrEqualTo(Duration.ofSeconds(12));
    }

    @Test
    void zeroInterval_neverWaits() {
        limiter.waitIfNeeded("p", Duration.ZERO);

        assertThat(limiter.waitIfNeeded("p", Duration.ZERO)).isZero();
        assertThat(sleeps).isEmpty();
    }
}
