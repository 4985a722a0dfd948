package net.quantuminvestor.fetch.boundary;

import com.fasterxml.jackson.core.JsonProcessingException;
import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.FailureKind;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Default classifier for provider calls made over HTTP.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>an explicit kind on a {@link ProviderException} is taken as-is;</li>
 *   <li>409 is a benign duplicate ({@code ALREADY_EXISTS});</li>
 *   <li>404 is {@code NOT_FOUND};</li>
 *   <li>429 is {@code RATE_LIMITED}, 5xx is {@code SERVER_ERROR};</li>
 *   <li>any other status is {@code CLIENT_ERROR};</li>
 *   <li>Jackson parse errors anywhere in the cause chain are {@code CLIENT_ERROR};</li>
 *   <li>any other {@link IOException} or {@link TimeoutException} in the cause chain is
 *       {@code TRANSIENT_NETWORK}. This covers refused connections, DNS failures, request
 *       timeouts and connection resets;</li>
 *   <li>everything else, parse errors and programming errors included, is {@code CLIENT_ERROR}.</li>
 * </ol>
 */
public class HttpFailureClassifier implements FailureClassifier {

    @Override
    public ClassifiedFailure classify(String operation, Throwable t) {
        if (t instanceof ProviderException pe) {
            ClassifiedFailure failure = classifyProviderException(operation, pe);
            return pe.retryAfter() != null ? failure.withRetryAfter(pe.retryAfter()) : failure;
        }
        return classifyCause(operation, t, null, t);
    }

    private ClassifiedFailure classifyProviderException(String operation, ProviderException pe) {
        Integer status = pe.statusCode();
        if (pe.kind() != null) {
            return ClassifiedFailure.of(pe.kind(), messageFor(pe), status, operation, pe);
        }
        if (status != null) {
            return ClassifiedFailure.of(kindForStatus(status), messageFor(pe), status, operation, pe);
        }
        if (pe.getCause() != null) {
            return classifyCause(operation, pe.getCause(), messageFor(pe), pe);
        }
        return ClassifiedFailure.of(FailureKind.CLIENT_ERROR, messageFor(pe), null, operation, pe);
    }

    static FailureKind kindForStatus(int status) {
        if (status == 409) {
            return FailureKind.ALREADY_EXISTS;
        }
        if (status == 404) {
            return FailureKind.NOT_FOUND;
        }
        if (status == 429) {
            return FailureKind.RATE_LIMITED;
        }
        if (status >= 500) {
            return FailureKind.SERVER_ERROR;
        }
        return FailureKind.CLIENT_ERROR;
    }

    private ClassifiedFailure classifyCause(String operation, Throwable cause, String prefix, Throwable original) {
        // Jackson parse errors are IOExceptions; check them before the network rules
        for (Throwable c = cause; c != null; c = c.getCause()) {
            if (c instanceof JsonProcessingException) {
                return ClassifiedFailure.of(FailureKind.CLIENT_ERROR,
                        join(prefix, "Unparsable response: " + c.getMessage()), null, operation, original);
            }
            if (isNetworkError(c)) {
                return ClassifiedFailure.of(FailureKind.TRANSIENT_NETWORK,
                        join(prefix, c.getClass().getSimpleName() + ": " + c.getMessage()), null, operation, original);
            }
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return ClassifiedFailure.of(FailureKind.CLIENT_ERROR, join(prefix, message), null, operation, original);
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof IOException || t instanceof TimeoutException;
    }

    private static String messageFor(ProviderException pe) {
        String message = pe.getMessage() != null ? pe.getMessage() : "provider call failed";
        return pe.provider() != null ? pe.provider() + ": " + message : message;
    }

    private static String join(String prefix, String detail) {
        return prefix == null ? detail : prefix + " (" + detail + ")";
    }
}
