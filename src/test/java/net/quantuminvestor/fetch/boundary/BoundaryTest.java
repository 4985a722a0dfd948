package net.quantuminvestor.fetch.boundary;

import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.FailureKind;
import net.quantuminvestor.fetch.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BoundaryTest {

    private List<ClassifiedFailure> reported;
    private Boundary boundary;

    @BeforeEach
    void setUp() {
        reported = new ArrayList<>();
        boundary = Boundary.withReporter(reported::add);
    }

    @Test
    void call_success_returnsOk() {
        Outcome<String> outcome = boundary.call("op", () -> "hello");

        assertThat(outcome).isEqualTo(Outcome.ok("hello"));
        assertThat(reported).isEmpty();
    }

    @Test
    void call_providerException_returnsClassifiedFailAndReports() {
        Outcome<String> outcome = boundary.call("finnhub:AAPL", () -> {
            throw ProviderException.status("finnhub", 500, "boom", null);
        });

        assertThat(outcome.isFail()).isTrue();
        ClassifiedFailure failure = outcome.failureIfPresent().orElseThrow();
        assertThat(failure.kind()).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(failure.operation()).isEqualTo("finnhub:AAPL");
        assertThat(reported).containsExactly(failure);
    }

    @Test
    void call_conflict_returnsExistsAndDoesNotReport() {
        Outcome<String> outcome = boundary.call("store:a@b.co", () -> {
            throw ProviderException.status("store", 409, "Subscriber already exists", null);
        });

        assertThat(outcome.isExists()).isTrue();
        assertThat(reported).isEmpty();
    }

    @Test
    void call_runtimeException_isContained() {
        Outcome<String> outcome = boundary.call("op", () -> {
            throw new IllegalStateException("bug");
        });

        assertThat(outcome.failureIfPresent()).hasValueSatisfying(f ->
                assertThat(f.kind()).isEqualTo(FailureKind.CLIENT_ERROR));
    }

    @Test
    void call_nullResult_isUnknownFailure() {
        Outcome<String> outcome = boundary.call("op", () -> null);

        assertThat(outcome.failureIfPresent()).hasValueSatisfying(f ->
                assertThat(f.kind()).isEqualTo(FailureKind.UNKNOWN));
        assertThat(reported).hasSize(1);
    }

    @Test
    void call_interrupted_restoresFlag() {
        try {
            Outcome<String> outcome = boundary.call("op", () -> {
                throw new InterruptedException();
            });

            assertThat(outcome.failureIfPresent()).hasValueSatisfying(f ->
                    assertThat(f.kind()).isEqualTo(FailureKind.UNKNOWN));
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
