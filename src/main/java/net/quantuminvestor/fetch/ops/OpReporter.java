package net.quantuminvestor.fetch.ops;

import net.quantuminvestor.fetch.ClassifiedFailure;

import java.time.Duration;

/**
 * Reports provider failures and retry activity for operational visibility.
 * Implementations might emit structured logs or JSON-lines metrics.
 */
public interface OpReporter {

	/**
	 * Reports one classified failure.
	 */
	void report(ClassifiedFailure failure);

	/**
	 * Reports that a retry is about to happen.
	 *
	 * @param failure The failure that triggered the retry
	 * @param attemptNumber The attempt that just failed (1-based)
	 * @param delay How long the caller will wait before the next attempt
	 * @param policyId The retry policy being applied
	 */
	default void reportRetryAttempt(ClassifiedFailure failure, int attemptNumber, Duration delay, String policyId) {
	}

	/**
	 * Reports that the retry loop stopped without a success.
	 *
	 * @param failure The final failure
	 * @param totalAttempts The total number of attempts made
	 * @param policyId The retry policy that was applied
	 */
	default void reportRetryExhausted(ClassifiedFailure failure, int totalAttempts, String policyId) {
	}

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static OpReporter noOp() {
		return failure -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 */
	static OpReporter composite(OpReporter... reporters) {
		return CompositeOpReporter.of(reporters);
	}
}
