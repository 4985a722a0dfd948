package net.quantuminvestor.fetch;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * The outcome of classifying one failed call attempt.
 *
 * @param kind The failure kind
 * @param message Human-readable description
 * @param statusCode HTTP status reported by the provider (may be null)
 * @param operation The operation that failed (e.g., "finnhub:AAPL")
 * @param occurredAt When the failure happened
 * @param exception The underlying exception (may be null)
 * @param retryAfter Provider-imposed minimum wait before the next call (may be null)
 */
public record ClassifiedFailure(
        FailureKind kind,
        String message,
        Integer statusCode,
        String operation,
        Instant occurredAt,
        Throwable exception,
        Duration retryAfter
) {

    public ClassifiedFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }

    public static ClassifiedFailure of(FailureKind kind, String message, String operation) {
        return new ClassifiedFailure(kind, message, null, operation, Instant.now(), null, null);
    }

    public static ClassifiedFailure of(FailureKind kind, String message, Integer statusCode,
                                       String operation, Throwable exception) {
        return new ClassifiedFailure(kind, message, statusCode, operation, Instant.now(), exception, null);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * Returns a copy carrying the given retry-after hint.
     */
    public ClassifiedFailure withRetryAfter(Duration retryAfter) {
        return new ClassifiedFailure(kind, message, statusCode, operation, occurredAt, exception, retryAfter);
    }

    /**
     * One-line summary used in logs and failure maps.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (statusCode != null) {
            sb.append(" (HTTP ").append(statusCode).append(')');
        }
        return sb.append(": ").append(message).toString();
    }
}
