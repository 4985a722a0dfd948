package net.quantuminvestor.fetch;

/**
 * Closed taxonomy of the ways a call to a remote provider can end badly.
 *
 * <p>Only {@link #TRANSIENT_NETWORK}, {@link #RATE_LIMITED} and {@link #SERVER_ERROR}
 * are retryable. {@link #ALREADY_EXISTS} is not a failure at all: it is the benign
 * result of a duplicate create and is surfaced as {@link Outcome.Exists}.
 */
public enum FailureKind {

    /**
     * Connection refused, timeout, DNS failure or another network-level error.
     */
    TRANSIENT_NETWORK(true),

    /**
     * The provider asked us to slow down (HTTP 429 or an equivalent quota message).
     */
    RATE_LIMITED(true),

    /**
     * The provider failed on its side (HTTP 5xx, empty body).
     */
    SERVER_ERROR(true),

    /**
     * The request itself is wrong: 4xx other than 404/409/429, malformed input, unparsable
     * response, programming error. Retrying will not help.
     */
    CLIENT_ERROR(false),

    /**
     * The requested resource does not exist.
     */
    NOT_FOUND(false),

    /**
     * The resource a create-style call targets already exists.
     */
    ALREADY_EXISTS(false),

    /**
     * Nothing more specific could be determined.
     */
    UNKNOWN(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isBenign() {
        return this == ALREADY_EXISTS;
    }
}
