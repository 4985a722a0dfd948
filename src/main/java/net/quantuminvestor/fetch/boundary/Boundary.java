package net.quantuminvestor.fetch.boundary;

import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.FailureKind;
import net.quantuminvestor.fetch.Outcome;
import net.quantuminvestor.fetch.ops.OpReporter;

import java.util.Objects;

/**
 * The boundary adapter between provider adapters, which throw, and the fetch layer, which
 * works on {@link Outcome} values.
 *
 * <p>This is the single point where exceptions are classified. After passing through a
 * Boundary, code operates entirely in outcome-space: a failure of one entity can never
 * unwind a batch.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jOpReporter());
 *
 * Outcome<Quote> result = boundary.call("finnhub:AAPL", () -> finnhub.fetch("AAPL"));
 * }</pre>
 */
public final class Boundary {

    private static final FailureClassifier DEFAULT_CLASSIFIER = new HttpFailureClassifier();

    private final FailureClassifier classifier;
    private final OpReporter reporter;

    /**
     * Creates a Boundary that classifies failures but does not report them.
     */
    public static Boundary silent() {
        return new Boundary(DEFAULT_CLASSIFIER, OpReporter.noOp());
    }

    /**
     * Creates a Boundary with the default {@link HttpFailureClassifier} and the given reporter.
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(DEFAULT_CLASSIFIER, reporter);
    }

    public static Boundary of(FailureClassifier classifier, OpReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(FailureClassifier classifier, OpReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw, translating any exception into an Outcome.
     *
     * <p>A classification of {@code ALREADY_EXISTS} yields {@link Outcome.Exists} and is not
     * reported as a failure. A null result is treated as a provider that returned nothing.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the result, Exists for a benign duplicate, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        T value;
        try {
            value = work.get();
        } catch (RuntimeException e) {
            // one bad entity must not abort the batch
            return handleException(operation, e);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                return fail(ClassifiedFailure.of(FailureKind.UNKNOWN, "Interrupted", null, operation, e));
            }
            return handleException(operation, e);
        }
        if (value == null) {
            return fail(ClassifiedFailure.of(FailureKind.UNKNOWN, "Provider returned no result", operation));
        }
        return Outcome.ok(value);
    }

    private <T> Outcome<T> handleException(String operation, Exception e) {
        ClassifiedFailure failure = classifier.classify(operation, e);
        if (failure.kind().isBenign()) {
            return Outcome.exists(failure.message());
        }
        return fail(failure);
    }

    private <T> Outcome<T> fail(ClassifiedFailure failure) {
        reporter.report(failure);
        return Outcome.fail(failure);
    }
}
