package net.quantuminvestor.fetch.retry;

import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.Outcome;
import net.quantuminvestor.fetch.boundary.Boundary;
import net.quantuminvestor.fetch.boundary.ThrowingSupplier;
import net.quantuminvestor.fetch.ops.OpReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Executes operations with retry logic based on a {@link RetryPolicy}.
 * Operates entirely over Outcome values; no exceptions escape.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier retrier = new Retrier(new Log4jOpReporter());
 *
 * RetryResult<Quote> result = retrier.execute(
 *     "finnhub:AAPL",
 *     RetryPolicy.defaults("quotes"),
 *     () -> boundary.call("finnhub:AAPL", () -> finnhub.fetch("AAPL"))
 * );
 * }</pre>
 *
 * <p>{@link Outcome.Exists} ends the loop immediately like a success.
 */
public final class Retrier {

    private final OpReporter reporter;
    private final Sleeper sleeper;

    public Retrier(OpReporter reporter) {
        this(reporter, Sleeper.THREAD);
    }

    public Retrier(OpReporter reporter, Sleeper sleeper) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Executes an operation with retry according to the given policy.
     *
     * @param operation The operation name for reporting
     * @param policy The retry policy
     * @param attempt A supplier that returns an Outcome
     * @return The final Outcome and the number of attempts it took
     */
    public <T> RetryResult<T> execute(String operation, RetryPolicy policy, Supplier<Outcome<T>> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        RetryContext context = RetryContext.first();
        Outcome<T> result = attempt.get();

        while (result instanceof Outcome.Fail<T> fail) {
            ClassifiedFailure failure = fail.failure();
            RetryDecision decision = policy.decide(context, failure);

            if (decision instanceof RetryDecision.GiveUp) {
                reporter.reportRetryExhausted(failure, context.attemptNumber(), policy.id());
                return new RetryResult<>(result, context.attemptNumber());
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            reporter.reportRetryAttempt(failure, context.attemptNumber(), delay, policy.id());
            sleep(delay);
            context = context.next();
            result = attempt.get();
        }

        return new RetryResult<>(result, context.attemptNumber());
    }

    /**
     * Convenience method that wraps a throwing supplier with a Boundary before retrying.
     */
    public <T> RetryResult<T> execute(
            String operation,
            RetryPolicy policy,
            Boundary boundary,
            ThrowingSupplier<T, ? extends Exception> work
    ) {
        return execute(operation, policy, () -> boundary.call(operation, work));
    }

    private void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
