package net.quantuminvestor.fetch.boundary;

import net.quantuminvestor.fetch.FailureKind;

import java.time.Duration;

/**
 * Raised by a provider adapter when a call did not produce a usable result.
 *
 * <p>Carries whatever the adapter knows for classification: the HTTP status if the call
 * reached the provider, an explicit {@link FailureKind} when the adapter recognised the
 * condition from the response body, a {@code Retry-After} hint, and the underlying cause
 * for network or parse errors.
 */
public class ProviderException extends Exception {

    private final String provider;
    private final Integer statusCode;
    private final FailureKind kind;
    private final Duration retryAfter;

    public ProviderException(String provider, String message, Throwable cause) {
        this(provider, message, null, null, null, cause);
    }

    public ProviderException(String provider, String message, Integer statusCode, FailureKind kind,
                             Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.kind = kind;
        this.retryAfter = retryAfter;
    }

    /**
     * A non-2xx response.
     */
    public static ProviderException status(String provider, int statusCode, String message, Duration retryAfter) {
        return new ProviderException(provider, message, statusCode, null, retryAfter, null);
    }

    /**
     * A condition the adapter recognised itself, e.g. a quota notice inside a 200 body.
     */
    public static ProviderException of(String provider, FailureKind kind, String message) {
        return new ProviderException(provider, message, null, kind, null, null);
    }

    public String provider() {
        return provider;
    }

    /**
     * HTTP status, or null if the call never produced a response.
     */
    public Integer statusCode() {
        return statusCode;
    }

    /**
     * Failure kind chosen by the adapter, or null to let the classifier decide.
     */
    public FailureKind kind() {
        return kind;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
