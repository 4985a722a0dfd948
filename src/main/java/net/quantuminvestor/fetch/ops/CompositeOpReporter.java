package net.quantuminvestor.fetch.ops;

import net.quantuminvestor.fetch.ClassifiedFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>Every delegate receives every call. A delegate that throws is logged and skipped so the
 * remaining reporters still run and the fetch itself is never affected.
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	@Override
	public void report(ClassifiedFailure failure) {
		fanOut("report", r -> r.report(failure));
	}

	@Override
	public void reportRetryAttempt(ClassifiedFailure failure, int attemptNumber, Duration delay, String policyId) {
		fanOut("reportRetryAttempt", r -> r.reportRetryAttempt(failure, attemptNumber, delay, policyId));
	}

	@Override
	public void reportRetryExhausted(ClassifiedFailure failure, int totalAttempts, String policyId) {
		fanOut("reportRetryExhausted", r -> r.reportRetryExhausted(failure, totalAttempts, policyId));
	}

	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				log.warn("OpReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}
}
