package net.quantuminvestor.fetch.subscriber;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of sending one email to many recipients.
 *
 * @param total recipients attempted
 * @param sent emails accepted by the provider
 * @param failed emails that could not be sent
 * @param failedEmails recipient to failure description, in send order
 */
public record BulkSendReport(int total, int sent, int failed, Map<String, String> failedEmails) {

    public static final BulkSendReport EMPTY = new BulkSendReport(0, 0, 0, Map.of());

    public BulkSendReport {
        failedEmails = Collections.unmodifiableMap(new LinkedHashMap<>(failedEmails));
    }
}
