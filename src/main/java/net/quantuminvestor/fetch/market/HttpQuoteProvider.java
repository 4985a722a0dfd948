package net.quantuminvestor.fetch.market;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.quantuminvestor.fetch.FailureKind;
import net.quantuminvestor.fetch.boundary.ProviderException;
import net.quantuminvestor.fetch.core.ProviderAdapter;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Base for quote providers reached over HTTPS with a JSON response.
 *
 * <p>Subclasses build the request URI and pick the price out of the parsed body. This class
 * turns every unusable response into a {@link ProviderException}: non-2xx statuses carry the
 * status and any {@code Retry-After} hint, an empty body is a server error, unparsable JSON
 * and network errors keep their cause for classification.
 */
public abstract class HttpQuoteProvider implements ProviderAdapter<Quote> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final String apiKey;
    private final URI baseUri;
    private final Duration minInterval;
    private final Duration timeout;
    private final HttpClient httpClient;

    protected HttpQuoteProvider(String id, String apiKey, URI baseUri, Duration minInterval,
                                Duration timeout, HttpClient httpClient) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.apiKey = requireNonEmpty(apiKey, id + " API key");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri must not be null");
        this.minInterval = Objects.requireNonNull(minInterval, "minInterval must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    protected static HttpClient defaultClient(Duration timeout) {
        return HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Duration minInterval() {
        return minInterval;
    }

    protected String apiKey() {
        return apiKey;
    }

    protected URI baseUri() {
        return baseUri;
    }

    /**
     * The request for one symbol, relative to {@link #baseUri()}.
     */
    protected abstract URI requestUri(String symbol);

    /**
     * Extracts the quote from a parsed 2xx body.
     *
     * @throws ProviderException if the body carries no usable quote
     */
    protected abstract Quote parseQuote(String symbol, JsonNode body) throws ProviderException;

    @Override
    public Quote fetch(String symbol) throws ProviderException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(requestUri(symbol))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException(id, "Request for " + symbol + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(id, "Interrupted while fetching " + symbol, null,
                    FailureKind.UNKNOWN, null, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw ProviderException.status(id, status, "HTTP " + status + " for " + symbol,
                    retryAfter(response).orElse(null));
        }

        String body = response.body();
        if (body == null || body.isBlank()) {
            throw ProviderException.of(id, FailureKind.SERVER_ERROR, "Empty response body for " + symbol);
        }

        JsonNode json;
        try {
            json = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(id, "Unparsable response for " + symbol, e);
        }
        return parseQuote(symbol, json);
    }

    /**
     * Reads a positive price from a JSON field, failing with {@code NOT_FOUND} when it is
     * missing, zero or not a number.
     */
    protected BigDecimal requirePrice(JsonNode node, String field, String symbol) throws ProviderException {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            throw ProviderException.of(id, FailureKind.NOT_FOUND, "No quote data for " + symbol);
        }
        BigDecimal price;
        try {
            price = value.isNumber() ? value.decimalValue() : new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new ProviderException(id, "Invalid price '" + value.asText() + "' for " + symbol,
                    null, FailureKind.CLIENT_ERROR, null, e);
        }
        if (price.signum() <= 0) {
            throw ProviderException.of(id, FailureKind.NOT_FOUND, "No quote data for " + symbol);
        }
        return price;
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    static Optional<Duration> retryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After").flatMap(value -> {
            try {
                long seconds = Long.parseLong(value.trim());
                return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
            } catch (NumberFormatException e) {
                // HTTP-date form is not honoured
                return Optional.empty();
            }
        });
    }

    private static String requireNonEmpty(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return value;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
