package net.quantuminvestor.fetch.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FetchStatisticsTest {

    @Test
    void emptyTracker_isVacuouslySuccessful() {
        FetchStatistics statistics = new FetchStatistics();

        assertThat(statistics.snapshot()).isEqualTo(FetchStats.EMPTY);
        assertThat(statistics.successRate()).isEqualTo(100.0);
        assertThat(statistics.hasFailures()).isFalse();
    }

    @Test
    void retriesAreOnlyTalliedOnPrimarySuccess() {
        FetchStatistics statistics = new FetchStatistics();

        statistics.recordAttempt();
        statistics.recordPrimarySuccess(2);
        statistics.recordAttempt();
        statistics.recordFallbackSuccess();
        statistics.recordAttempt();
        statistics.recordFailure("BAD", "gone");

        FetchStats stats = statistics.snapshot();
        assertThat(stats).isEqualTo(new FetchStats(3, 1, 1, 1, 2));
        assertThat(stats.successRate()).isCloseTo(66.666, within(0.001));
    }

    @Test
    void failures_keepsFirstFailureOrderAndLatestReason() {
        FetchStatistics statistics = new FetchStatistics();

        statistics.recordFailure("B", "first");
        statistics.recordFailure("A", "x");
        statistics.recordFailure("B", "second");

        assertThat(statistics.failures()).containsExactly(Map.entry("B", "second"), Map.entry("A", "x"));
        assertThat(statistics.failureCount()).isEqualTo(2);
    }

    @Test
    void failures_isASnapshot() {
        FetchStatistics statistics = new FetchStatistics();
        statistics.recordFailure("A", "x");

        Map<String, String> view = statistics.failures();
        statistics.reset();

        assertThat(view).containsOnlyKeys("A");
        assertThatThrownBy(() -> view.put("B", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void reset_isIdempotent() {
        FetchStatistics statistics = new FetchStatistics();
        statistics.recordAttempt();
        statistics.recordFailure("A", "x");

        statistics.reset();
        statistics.reset();

        assertThat(statistics.snapshot()).isEqualTo(FetchStats.EMPTY);
        assertThat(statistics.failures()).isEmpty();
    }
}
