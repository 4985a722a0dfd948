package net.quantuminvestor.fetch.market;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A price quote normalised across providers.
 *
 * @param symbol the ticker as requested
 * @param price last or closing price, always positive
 * @param date trading day the price belongs to (may be null if the provider omits it)
 * @param source id of the provider that produced it
 */
public record Quote(String symbol, BigDecimal price, LocalDate date, String source) {

    public Quote {
        Objects.requireNonNull(symbol, "symbol must not be null");
        Objects.requireNonNull(price, "price must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive: " + price);
        }
    }
}
