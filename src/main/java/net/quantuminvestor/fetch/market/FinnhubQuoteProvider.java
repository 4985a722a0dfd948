package net.quantuminvestor.fetch.market;

import com.fasterxml.jackson.databind.JsonNode;
import net.quantuminvestor.fetch.boundary.ProviderException;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Finnhub {@code /api/v1/quote}. Unknown symbols come back as a 200 with {@code c = 0}.
 */
public final class FinnhubQuoteProvider extends HttpQuoteProvider {

    public static final String ID = "finnhub";
    public static final URI DEFAULT_BASE_URI = URI.create("https://finnhub.io");
    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofMillis(1300);

    public FinnhubQuoteProvider(String apiKey, Duration minInterval, Duration timeout) {
        this(apiKey, DEFAULT_BASE_URI, minInterval, timeout, defaultClient(timeout));
    }

    FinnhubQuoteProvider(String apiKey, URI baseUri, Duration minInterval, Duration timeout,
                         HttpClient httpClient) {
        super(ID, apiKey, baseUri, minInterval, timeout, httpClient);
    }

    @Override
    protected URI requestUri(String symbol) {
        return baseUri().resolve("/api/v1/quote?symbol=" + encode(symbol) + "&token=" + encode(apiKey()));
    }

    @Override
    protected Quote parseQuote(String symbol, JsonNode body) throws ProviderException {
        return new Quote(symbol, requirePrice(body, "c", symbol), tradingDay(body.get("t")), ID);
    }

    private static LocalDate tradingDay(JsonNode timestamp) {
        if (timestamp == null || !timestamp.canConvertToLong() || timestamp.asLong() <= 0) {
            return null;
        }
        return LocalDate.ofInstant(Instant.ofEpochSecond(timestamp.asLong()), ZoneOffset.UTC);
    }
}
