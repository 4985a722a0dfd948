package net.quantuminvestor.fetch.ops.log4j;

import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.FailureKind;
import net.quantuminvestor.fetch.ops.OpReporter;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.time.Duration;
import java.util.Locale;

/**
 * Reports provider failures and retries through Log4j2.
 *
 * <p>Failures are logged at a level that follows their {@link FailureKind}:
 * <ul>
 *   <li>retryable kinds → INFO (a retry or fallback usually follows)</li>
 *   <li>{@code NOT_FOUND} → INFO</li>
 *   <li>{@code CLIENT_ERROR}, {@code UNKNOWN} → WARN</li>
 *   <li>{@code ALREADY_EXISTS} → DEBUG</li>
 * </ul>
 *
 * <p>Every retry and every exhausted retry loop is logged at WARN.
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("net.quantuminvestor.fetch.OpReporter"));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(ClassifiedFailure failure) {
		logger.atLevel(levelFor(failure.kind()))
			.withMarker(FAILURE_MARKER)
			.log("Failure in operation [{}]: {}", failure.operation(), failure.describe());
	}

	@Override
	public void reportRetryAttempt(ClassifiedFailure failure, int attemptNumber, Duration delay, String policyId) {
		logger.atWarn()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} for [{}] failed, retrying in {}s with policy [{}]. {}",
				attemptNumber,
				failure.operation(),
				String.format(Locale.ROOT, "%.1f", delay.toMillis() / 1000.0),
				policyId,
				failure.describe());
	}

	@Override
	public void reportRetryExhausted(ClassifiedFailure failure, int totalAttempts, String policyId) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Giving up on [{}] after {} attempts with policy [{}]. {}",
				failure.operation(),
				totalAttempts,
				policyId,
				failure.describe());
	}

	static Level levelFor(FailureKind kind) {
		return switch (kind) {
			case TRANSIENT_NETWORK, RATE_LIMITED, SERVER_ERROR, NOT_FOUND -> Level.INFO;
			case CLIENT_ERROR, UNKNOWN -> Level.WARN;
			case ALREADY_EXISTS -> Level.DEBUG;
		};
	}
}
