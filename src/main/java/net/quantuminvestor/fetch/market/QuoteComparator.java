package net.quantuminvestor.fetch.market;

import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.Outcome;
import net.quantuminvestor.fetch.boundary.Boundary;
import net.quantuminvestor.fetch.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Queries every provider once per symbol and compares the prices.
 *
 * <p>Each call goes through the shared {@link RateLimiter}; there are no retries, since the
 * point is to see what each provider says right now.
 */
public final class QuoteComparator {

    private static final Logger log = LoggerFactory.getLogger(QuoteComparator.class);

    private final List<? extends HttpQuoteProvider> providers;
    private final Boundary boundary;
    private final RateLimiter rateLimiter;

    public QuoteComparator(List<? extends HttpQuoteProvider> providers, Boundary boundary, RateLimiter rateLimiter) {
        this.providers = List.copyOf(providers);
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
    }

    /**
     * Compares across every configured provider.
     */
    public QuoteComparator(QuoteProviders providers, Boundary boundary, RateLimiter rateLimiter) {
        this(providers.all(), boundary, rateLimiter);
    }

    public PriceComparison compare(String symbol) {
        List<Quote> quotes = new ArrayList<>();
        Map<String, ClassifiedFailure> failures = new LinkedHashMap<>();

        for (HttpQuoteProvider provider : providers) {
            rateLimiter.waitIfNeeded(provider.id(), provider.minInterval());
            Outcome<Quote> outcome = boundary.call(provider.id() + ":" + symbol, () -> provider.fetch(symbol));
            if (outcome instanceof Outcome.Ok<Quote> ok) {
                quotes.add(ok.value());
            } else {
                outcome.failureIfPresent().ifPresent(f -> failures.put(provider.id(), f));
            }
        }

        PriceComparison comparison = new PriceComparison(symbol, quotes, failures);
        logComparison(comparison);
        return comparison;
    }

    public List<PriceComparison> compareAll(List<String> symbols) {
        List<PriceComparison> comparisons = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            comparisons.add(compare(symbol));
        }
        int queries = comparisons.stream().mapToInt(PriceComparison::queries).sum();
        int successful = comparisons.stream().mapToInt(c -> c.quotes().size()).sum();
        log.info("Compared {} symbols: {} queries, {} successful, {} failed",
                comparisons.size(), queries, successful, queries - successful);
        return comparisons;
    }

    private static void logComparison(PriceComparison c) {
        for (Quote q : c.quotes()) {
            log.info("{} {}: {} ({})", c.symbol(), q.source(), q.price(), q.date() != null ? q.date() : "N/A");
        }
        c.failures().forEach((provider, failure) ->
                log.info("{} {}: {}", c.symbol(), provider, failure.describe()));

        if (c.spread().isPresent()) {
            if (c.hasDiscrepancy()) {
                log.warn("{}: price discrepancy {} ({}%) exceeds {}%", c.symbol(), c.spread().get(),
                        c.spreadPercent().get(), PriceComparison.DISCREPANCY_THRESHOLD_PERCENT);
            } else {
                log.info("{}: prices consistent, spread {} ({}%)", c.symbol(), c.spread().get(),
                        c.spreadPercent().get());
            }
        } else if (c.quotes().size() == 1) {
            log.info("{}: only one source returned valid data", c.symbol());
        } else {
            log.warn("{}: no valid prices retrieved from any source", c.symbol());
        }
    }
}
