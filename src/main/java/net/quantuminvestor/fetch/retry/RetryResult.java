package net.quantuminvestor.fetch.retry;

import net.quantuminvestor.fetch.Outcome;

import java.util.Objects;

/**
 * The final outcome of a retry loop and how many attempts it took.
 *
 * @param outcome the outcome of the last attempt
 * @param attempts number of times the operation was invoked (at least 1)
 */
public record RetryResult<T>(Outcome<T> outcome, int attempts) {

    public RetryResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
    }

    public int retriesUsed() {
        return attempts - 1;
    }
}
