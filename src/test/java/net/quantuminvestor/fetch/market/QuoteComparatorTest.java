package net.quantuminvestor.fetch.market;

import com.fasterxml.jackson.databind.JsonNode;
import net.quantuminvestor.fetch.FailureKind;
import net.quantuminvestor.fetch.boundary.Boundary;
import net.quantuminvestor.fetch.boundary.ProviderException;
import net.quantuminvestor.fetch.ratelimit.MutableClock;
import net.quantuminvestor.fetch.ratelimit.RateLimiter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class QuoteComparatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    /**
     * Answers from a fixed symbol-to-price map without touching the network.
     */
    private static final class FixedQuoteProvider extends HttpQuoteProvider {
        private final Map<String, String> prices;

        FixedQuoteProvider(String id, Duration minInterval, Map<String, String> prices) {
            super(id, "key", URI.create("http://localhost"), minInterval, TIMEOUT,
                    HttpClient.newHttpClient());
            this.prices = prices;
        }

        @Override
        protected URI requestUri(String symbol) {
            return baseUri();
        }

        @Override
        protected Quote parseQuote(String symbol, JsonNode body) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Quote fetch(String symbol) throws ProviderException {
            String price = prices.get(symbol);
            if (price == null) {
                throw ProviderException.of(id(), FailureKind.NOT_FOUND, "No quote data for " + symbol);
            }
            return new Quote(symbol, new BigDecimal(price), null, id());
        }
    }

    private final List<Long> sleeps = new ArrayList<>();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-02T10:00:00Z"));
    private final RateLimiter limiter = new RateLimiter(clock, millis -> {
        sleeps.add(millis);
        clock.advanceMillis(millis);
    });

    @Test
    void compare_computesSpreadAndFlagsDiscrepancy() {
        QuoteComparator comparator = new QuoteComparator(List.of(
                new FixedQuoteProvider("a", Duration.ZERO, Map.of("AAPL", "100.00")),
                new FixedQuoteProvider("b", Duration.ZERO, Map.of("AAPL", "102.00")),
                new FixedQuoteProvider("c", Duration.ZERO, Map.of())), Boundary.silent(), limiter);

        PriceComparison comparison = comparator.compare("AAPL");

        assertThat(comparison.quotes()).extracting(Quote::source).containsExactly("a", "b");
        assertThat(comparison.failures()).containsOnlyKeys("c");
        assertThat(comparison.min()).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("100"));
        assertThat(comparison.max()).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("102"));
        assertThat(comparison.spread()).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("2"));
        assertThat(comparison.spreadPercent()).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("2"));
        assertThat(comparison.hasDiscrepancy()).isTrue();
        assertThat(comparison.queries()).isEqualTo(3);
    }

    @Test
    void compare_smallSpreadIsConsistent() {
        QuoteComparator comparator = new QuoteComparator(List.of(
                new FixedQuoteProvider("a", Duration.ZERO, Map.of("MSFT", "374.00")),
                new FixedQuoteProvider("b", Duration.ZERO, Map.of("MSFT", "374.50"))), Boundary.silent(), limiter);

        assertThat(comparator.compare("MSFT").hasDiscrepancy()).isFalse();
    }

    @Test
    void compare_singleSourceHasNoSpread() {
        QuoteComparator comparator = new QuoteComparator(List.of(
                new FixedQuoteProvider("a", Duration.ZERO, Map.of("IBM", "180"))), Boundary.silent(), limiter);

        PriceComparison comparison = comparator.compare("IBM");

        assertThat(comparison.spread()).isEmpty();
        assertThat(comparison.hasDiscrepancy()).isFalse();
    }

    @Test
    void compareAll_respectsProviderIntervals() {
        QuoteComparator comparator = new QuoteComparator(List.of(
                new FixedQuoteProvider("slow", Duration.ofSeconds(12), Map.of("A", "1", "B", "2"))),
                Boundary.silent(), limiter);

        List<PriceComparison> comparisons = comparator.compareAll(List.of("A", "B"));

        assertThat(comparisons).hasSize(2);
        assertThat(sleeps).containsExactly(12000L);
    }
}
