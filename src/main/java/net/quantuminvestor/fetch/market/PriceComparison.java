package net.quantuminvestor.fetch.market;

import net.quantuminvestor.fetch.ClassifiedFailure;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prices for one symbol from every configured provider.
 *
 * @param symbol the symbol compared
 * @param quotes successful quotes, in provider order
 * @param failures provider id to the failure it returned
 */
public record PriceComparison(String symbol, List<Quote> quotes, Map<String, ClassifiedFailure> failures) {

    /** Spreads above this percentage are flagged. */
    public static final BigDecimal DISCREPANCY_THRESHOLD_PERCENT = BigDecimal.ONE;

    public PriceComparison {
        quotes = List.copyOf(quotes);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public Optional<BigDecimal> min() {
        return quotes.stream().map(Quote::price).min(Comparator.naturalOrder());
    }

    public Optional<BigDecimal> max() {
        return quotes.stream().map(Quote::price).max(Comparator.naturalOrder());
    }

    /**
     * max − min, present when at least two providers answered.
     */
    public Optional<BigDecimal> spread() {
        if (quotes.size() < 2) {
            return Optional.empty();
        }
        return Optional.of(max().orElseThrow().subtract(min().orElseThrow()));
    }

    /**
     * Spread relative to the lowest price, as a percentage rounded to four decimals.
     */
    public Optional<BigDecimal> spreadPercent() {
        return spread().map(s -> s.multiply(BigDecimal.valueOf(100))
                .divide(min().orElseThrow(), 4, RoundingMode.HALF_UP));
    }

    public boolean hasDiscrepancy() {
        return spreadPercent().map(p -> p.compareTo(DISCREPANCY_THRESHOLD_PERCENT) > 0).orElse(false);
    }

    public int queries() {
        return quotes.size() + failures.size();
    }
}
