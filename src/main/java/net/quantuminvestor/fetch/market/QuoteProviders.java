package net.quantuminvestor.fetch.market;

import net.quantuminvestor.fetch.config.FetchConfig;
import net.quantuminvestor.fetch.ops.ConfigResolver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Builds the quote providers whose API keys are configured.
 *
 * <p>Keys and intervals are resolved through {@link ConfigResolver}: system property first
 * ({@code finnhub.api-key}, {@code finnhub.min-interval}), then environment variable
 * ({@code FINNHUB_API_KEY}, {@code FINNHUB_MIN_INTERVAL}). Intervals are in seconds.
 */
public final class QuoteProviders {

    private final List<HttpQuoteProvider> providers;

    private QuoteProviders(List<HttpQuoteProvider> providers) {
        this.providers = Collections.unmodifiableList(providers);
    }

    /**
     * @throws IllegalStateException if no provider has an API key
     */
    public static QuoteProviders fromEnvironment(FetchConfig config) {
        Duration timeout = config.timeout();
        List<HttpQuoteProvider> providers = new ArrayList<>();

        apiKey("alphavantage", "ALPHAVANTAGE").ifPresent(key -> providers.add(new AlphaVantageQuoteProvider(key,
                interval("alphavantage", "ALPHAVANTAGE", AlphaVantageQuoteProvider.DEFAULT_MIN_INTERVAL), timeout)));
        apiKey("finnhub", "FINNHUB").ifPresent(key -> providers.add(new FinnhubQuoteProvider(key,
                interval("finnhub", "FINNHUB", FinnhubQuoteProvider.DEFAULT_MIN_INTERVAL), timeout)));
        apiKey("marketstack", "MARKETSTACK").ifPresent(key -> providers.add(new MarketstackQuoteProvider(key,
                interval("marketstack", "MARKETSTACK", MarketstackQuoteProvider.DEFAULT_MIN_INTERVAL), timeout)));

        return of(providers);
    }

    static QuoteProviders of(List<HttpQuoteProvider> providers) {
        if (providers.isEmpty()) {
            throw new IllegalStateException("At least one API key required: set ALPHAVANTAGE_API_KEY, "
                    + "FINNHUB_API_KEY or MARKETSTACK_API_KEY");
        }
        return new QuoteProviders(new ArrayList<>(providers));
    }

    /**
     * Configured providers in preference order: Alpha Vantage, Finnhub, Marketstack.
     */
    public List<HttpQuoteProvider> all() {
        return providers;
    }

    public HttpQuoteProvider primary() {
        return providers.get(0);
    }

    /**
     * The second configured provider, if any.
     */
    public Optional<HttpQuoteProvider> fallback() {
        return providers.size() > 1 ? Optional.of(providers.get(1)) : Optional.empty();
    }

    public Optional<HttpQuoteProvider> byId(String id) {
        return providers.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    private static Optional<String> apiKey(String prefix, String envPrefix) {
        return ConfigResolver.resolveOptional(prefix + ".api-key", envPrefix + "_API_KEY");
    }

    private static Duration interval(String prefix, String envPrefix, Duration defaultValue) {
        return ConfigResolver.resolveSeconds(prefix + ".min-interval", envPrefix + "_MIN_INTERVAL", defaultValue);
    }
}
