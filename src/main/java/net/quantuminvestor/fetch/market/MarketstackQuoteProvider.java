package net.quantuminvestor.fetch.market;

import com.fasterxml.jackson.databind.JsonNode;
import net.quantuminvestor.fetch.FailureKind;
import net.quantuminvestor.fetch.boundary.ProviderException;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Marketstack end-of-day {@code /v1/eod/latest}. Stocks only.
 */
public final class MarketstackQuoteProvider extends HttpQuoteProvider {

    public static final String ID = "marketstack";
    public static final URI DEFAULT_BASE_URI = URI.create("https://api.marketstack.com");
    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofSeconds(2);

    public MarketstackQuoteProvider(String apiKey, Duration minInterval, Duration timeout) {
        this(apiKey, DEFAULT_BASE_URI, minInterval, timeout, defaultClient(timeout));
    }

    MarketstackQuoteProvider(String apiKey, URI baseUri, Duration minInterval, Duration timeout,
                             HttpClient httpClient) {
        super(ID, apiKey, baseUri, minInterval, timeout, httpClient);
    }

    @Override
    protected URI requestUri(String symbol) {
        return baseUri().resolve("/v1/eod/latest?access_key=" + encode(apiKey()) + "&symbols=" + encode(symbol));
    }

    @Override
    protected Quote parseQuote(String symbol, JsonNode body) throws ProviderException {
        JsonNode data = body.get("data");
        if (data == null || !data.isArray() || data.isEmpty()) {
            throw ProviderException.of(ID, FailureKind.NOT_FOUND, "No data returned for " + symbol);
        }
        JsonNode latest = data.get(0);
        return new Quote(symbol, requirePrice(latest, "close", symbol),
                QuoteDates.parseDate(latest.path("date").asText("")), ID);
    }
}
