package net.quantuminvestor.fetch.boundary;

import com.fasterxml.jackson.core.JsonParseException;
import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.FailureKind;
import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class HttpFailureClassifierTest {

    private final HttpFailureClassifier classifier = new HttpFailureClassifier();

    private FailureKind kindOf(Throwable t) {
        return classifier.classify("provider:KEY", t).kind();
    }

    @Test
    void statusCodes_mapToKinds() {
        assertThat(HttpFailureClassifier.kindForStatus(409)).isEqualTo(FailureKind.ALREADY_EXISTS);
        assertThat(HttpFailureClassifier.kindForStatus(404)).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(HttpFailureClassifier.kindForStatus(429)).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(HttpFailureClassifier.kindForStatus(500)).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(HttpFailureClassifier.kindForStatus(503)).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(HttpFailureClassifier.kindForStatus(400)).isEqualTo(FailureKind.CLIENT_ERROR);
        assertThat(HttpFailureClassifier.kindForStatus(401)).isEqualTo(FailureKind.CLIENT_ERROR);
        assertThat(HttpFailureClassifier.kindForStatus(403)).isEqualTo(FailureKind.CLIENT_ERROR);
    }

    @Test
    void providerStatus_isCarriedOnFailure() {
        ClassifiedFailure failure = classifier.classify("finnhub:AAPL",
                ProviderException.status("finnhub", 503, "HTTP 503 for AAPL", null));

        assertThat(failure.kind()).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(failure.statusCode()).isEqualTo(503);
        assertThat(failure.operation()).isEqualTo("finnhub:AAPL");
        assertThat(failure.message()).isEqualTo("finnhub: HTTP 503 for AAPL");
        assertThat(failure.isRetryable()).isTrue();
    }

    @Test
    void explicitKind_winsOverStatus() {
        ProviderException e = new ProviderException("alphavantage", "quota", 200, FailureKind.RATE_LIMITED, null, null);

        assertThat(kindOf(e)).isEqualTo(FailureKind.RATE_LIMITED);
    }

    @Test
    void retryAfterHint_isKept() {
        ClassifiedFailure failure = classifier.classify("op",
                ProviderException.status("finnhub", 429, "slow down", Duration.ofSeconds(7)));

        assertThat(failure.kind()).isEqualTo(FailureKind.RATE_LIMITED);
        assertThat(failure.retryAfter()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void networkErrors_areTransient() {
        assertThat(kindOf(new ConnectException("refused"))).isEqualTo(FailureKind.TRANSIENT_NETWORK);
        assertThat(kindOf(new HttpTimeoutException("timed out"))).isEqualTo(FailureKind.TRANSIENT_NETWORK);
        assertThat(kindOf(new UnknownHostException("no.such.host"))).isEqualTo(FailureKind.TRANSIENT_NETWORK);
        assertThat(kindOf(new IOException("reset"))).isEqualTo(FailureKind.TRANSIENT_NETWORK);
    }

    @Test
    void ioAndTimeoutExceptionsAnywhereInChain_areTransient() {
        assertThat(kindOf(new TimeoutException("future timed out"))).isEqualTo(FailureKind.TRANSIENT_NETWORK);
        assertThat(kindOf(new IllegalStateException("wrapped", new EOFException("stream closed"))))
                .isEqualTo(FailureKind.TRANSIENT_NETWORK);
    }

    @Test
    void wrappedNetworkError_isTransient() {
        ProviderException e = new ProviderException("finnhub", "Request for AAPL failed", new ConnectException("refused"));

        ClassifiedFailure failure = classifier.classify("finnhub:AAPL", e);

        assertThat(failure.kind()).isEqualTo(FailureKind.TRANSIENT_NETWORK);
        assertThat(failure.message()).startsWith("finnhub: Request for AAPL failed");
        assertThat(failure.exception()).isSameAs(e);
    }

    @Test
    void parseError_isClientErrorEvenThoughItIsAnIOException() {
        ProviderException e = new ProviderException("finnhub", "Unparsable response",
                new JsonParseException(null, "Unexpected character"));

        assertThat(kindOf(e)).isEqualTo(FailureKind.CLIENT_ERROR);
    }

    @Test
    void programmingErrors_areClientErrors() {
        assertThat(kindOf(new IllegalArgumentException("bad"))).isEqualTo(FailureKind.CLIENT_ERROR);
        assertThat(kindOf(new NullPointerException())).isEqualTo(FailureKind.CLIENT_ERROR);
    }

    @Test
    void bareProviderException_isClientError() {
        assertThat(kindOf(new ProviderException("x", "odd", null))).isEqualTo(FailureKind.CLIENT_ERROR);
    }
}
