package net.quantuminvestor.fetch;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on an outcome that holds no value.
 * Unchecked because it indicates misuse of the API: the caller should have checked
 * {@link Outcome#isOk()} first.
 */
public class OutcomeFailedException extends RuntimeException {

    private final ClassifiedFailure failure;

    public OutcomeFailedException(ClassifiedFailure failure) {
        super("Outcome failed: " + failure.describe());
        this.failure = failure;
    }

    public OutcomeFailedException(String message) {
        super(message);
        this.failure = null;
    }

    /**
     * The failure behind this exception, or null when the outcome was {@link Outcome.Exists}.
     */
    public ClassifiedFailure failure() {
        return failure;
    }
}
