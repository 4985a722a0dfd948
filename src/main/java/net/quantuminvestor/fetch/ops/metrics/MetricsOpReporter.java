package net.quantuminvestor.fetch.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports failures and retries as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"marketdata.finnhub:AAPL","attemptNumber":1,"delayMs":1000,...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "net.quantuminvestor.fetch.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final ObjectMapper mapper = new ObjectMapper();

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace prefix for tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = namespace == null || namespace.isBlank() ? null : namespace.trim();
		this.logger = logger;
	}

	@Override
	public void report(ClassifiedFailure failure) {
		emit(failureEvent(failure));
	}

	@Override
	public void reportRetryAttempt(ClassifiedFailure failure, int attemptNumber, Duration delay, String policyId) {
		emit(retryAttemptEvent(failure, attemptNumber, delay, policyId));
	}

	@Override
	public void reportRetryExhausted(ClassifiedFailure failure, int totalAttempts, String policyId) {
		emit(retryExhaustedEvent(failure, totalAttempts, policyId));
	}

	ObjectNode failureEvent(ClassifiedFailure failure) {
		ObjectNode node = baseEvent("failure", failure);
		node.put("message", failure.message());
		return node;
	}

	ObjectNode retryAttemptEvent(ClassifiedFailure failure, int attemptNumber, Duration delay, String policyId) {
		ObjectNode node = baseEvent("retry_attempt", failure);
		node.put("attemptNumber", attemptNumber);
		node.put("delayMs", delay.toMillis());
		node.put("policy", policyId);
		return node;
	}

	ObjectNode retryExhaustedEvent(ClassifiedFailure failure, int totalAttempts, String policyId) {
		ObjectNode node = baseEvent("retry_exhausted", failure);
		node.put("totalAttempts", totalAttempts);
		node.put("policy", policyId);
		return node;
	}

	String trackingKey(ClassifiedFailure failure) {
		return namespace == null ? failure.operation() : namespace + "." + failure.operation();
	}

	private ObjectNode baseEvent(String eventType, ClassifiedFailure failure) {
		ObjectNode node = mapper.createObjectNode();
		node.put("eventType", eventType);
		node.put("timestamp", ISO_FORMATTER.format(failure.occurredAt()));
		node.put("trackingKey", trackingKey(failure));
		node.put("kind", failure.kind().name());
		if (failure.statusCode() != null) {
			node.put("status", failure.statusCode());
		}
		return node;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialise metrics event {}", event.get("eventType"), e);
		}
	}
}
