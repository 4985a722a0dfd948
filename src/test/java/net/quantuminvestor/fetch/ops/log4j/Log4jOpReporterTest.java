package net.quantuminvestor.fetch.ops.log4j;

import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.FailureKind;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class Log4jOpReporterTest {

	private Logger logger;
	private CapturingAppender appender;

	@BeforeEach
	void setUp() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		logger = context.getLogger("net.quantuminvestor.fetch.ops.log4j.Capture");
		appender = new CapturingAppender();
		appender.start();
		logger.addAppender(appender);
	}

	@AfterEach
	void tearDown() {
		logger.removeAppender(appender);
		appender.stop();
	}

	@Test
	void levelFollowsFailureKind() {
		assertThat(Log4jOpReporter.levelFor(FailureKind.SERVER_ERROR)).isEqualTo(Level.INFO);
		assertThat(Log4jOpReporter.levelFor(FailureKind.RATE_LIMITED)).isEqualTo(Level.INFO);
		assertThat(Log4jOpReporter.levelFor(FailureKind.NOT_FOUND)).isEqualTo(Level.INFO);
		assertThat(Log4jOpReporter.levelFor(FailureKind.CLIENT_ERROR)).isEqualTo(Level.WARN);
		assertThat(Log4jOpReporter.levelFor(FailureKind.UNKNOWN)).isEqualTo(Level.WARN);
		assertThat(Log4jOpReporter.levelFor(FailureKind.ALREADY_EXISTS)).isEqualTo(Level.DEBUG);
	}

	@Test
	void retryAttempt_isWarnWithAttemptAndDelay() {
		Log4jOpReporter reporter = new Log4jOpReporter(logger);
		ClassifiedFailure failure = ClassifiedFailure.of(FailureKind.SERVER_ERROR, "boom", 503, "finnhub:AAPL", null);

		reporter.reportRetryAttempt(failure, 2, Duration.ofMillis(1500), "quotes");

		assertThat(appender.events).hasSize(1);
		LogEvent event = appender.events.get(0);
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker()).isNotNull();
		assertThat(event.getMarker().getName()).isEqualTo("RETRY");
		assertThat(event.getMessage().getFormattedMessage())
			.startsWith("Attempt 2 for [finnhub:AAPL] failed")
			.contains("retrying in 1.5s")
			.contains("[quotes]")
			.contains("SERVER_ERROR");
	}

	@Test
	void failure_usesKindLevelAndFailureMarker() {
		Log4jOpReporter reporter = new Log4jOpReporter(logger);

		reporter.report(ClassifiedFailure.of(FailureKind.CLIENT_ERROR, "bad symbol", 400, "finnhub:???", null));

		assertThat(appender.events).singleElement().satisfies(event -> {
			assertThat(event.getLevel()).isEqualTo(Level.WARN);
			assertThat(event.getMarker().getName()).isEqualTo("FAILURE");
		});
	}

	@Test
	void retryExhausted_isWarnWithTotalAttempts() {
		Log4jOpReporter reporter = new Log4jOpReporter(logger);
		ClassifiedFailure failure = ClassifiedFailure.of(FailureKind.SERVER_ERROR, "boom", 503, "finnhub:AAPL", null);

		reporter.reportRetryExhausted(failure, 4, "quotes");

		assertThat(appender.events).singleElement().satisfies(event -> {
			assertThat(event.getLevel()).isEqualTo(Level.WARN);
			assertThat(event.getMarker().getName()).isEqualTo("RETRY_EXHAUSTED");
			assertThat(event.getMessage().getFormattedMessage()).contains("after 4 attempts");
		});
	}

	private static final class CapturingAppender extends AbstractAppender {

		final List<LogEvent> events = new ArrayList<>();

		CapturingAppender() {
			super("capture", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
