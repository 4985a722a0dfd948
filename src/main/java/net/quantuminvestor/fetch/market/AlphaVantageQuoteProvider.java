package net.quantuminvestor.fetch.market;

import com.fasterxml.jackson.databind.JsonNode;
import net.quantuminvestor.fetch.FailureKind;
import net.quantuminvestor.fetch.boundary.ProviderException;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Alpha Vantage {@code GLOBAL_QUOTE}. The free tier allows five requests a minute and answers
 * quota breaches with a 200 carrying a {@code Note} or {@code Information} message.
 */
public final class AlphaVantageQuoteProvider extends HttpQuoteProvider {

    public static final String ID = "alphavantage";
    public static final URI DEFAULT_BASE_URI = URI.create("https://www.alphavantage.co");
    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofSeconds(12);

    public AlphaVantageQuoteProvider(String apiKey, Duration minInterval, Duration timeout) {
        this(apiKey, DEFAULT_BASE_URI, minInterval, timeout, defaultClient(timeout));
    }

    AlphaVantageQuoteProvider(String apiKey, URI baseUri, Duration minInterval, Duration timeout,
                              HttpClient httpClient) {
        super(ID, apiKey, baseUri, minInterval, timeout, httpClient);
    }

    @Override
    protected URI requestUri(String symbol) {
        return baseUri().resolve("/query?function=GLOBAL_QUOTE&symbol=" + encode(symbol)
                + "&apikey=" + encode(apiKey()));
    }

    @Override
    protected Quote parseQuote(String symbol, JsonNode body) throws ProviderException {
        JsonNode quote = body.get("Global Quote");
        if (quote != null && quote.isObject() && !quote.isEmpty()) {
            return new Quote(symbol, requirePrice(quote, "05. price", symbol),
                    QuoteDates.parseDate(quote.path("07. latest trading day").asText("")), ID);
        }
        for (String notice : new String[] {"Note", "Information"}) {
            if (body.hasNonNull(notice)) {
                throw ProviderException.of(ID, FailureKind.RATE_LIMITED,
                        "Rate limit exceeded: " + body.get(notice).asText());
            }
        }
        if (body.hasNonNull("Error Message")) {
            throw ProviderException.of(ID, FailureKind.NOT_FOUND, body.get("Error Message").asText());
        }
        throw ProviderException.of(ID, FailureKind.NOT_FOUND, "No data returned for " + symbol);
    }
}
