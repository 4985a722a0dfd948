package net.quantuminvestor.fetch.subscriber;

import net.quantuminvestor.fetch.core.FetchResult;
import net.quantuminvestor.fetch.core.ProviderAdapter;
import net.quantuminvestor.fetch.core.ResilientFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends the newsletter to every active subscriber.
 *
 * <p>Each recipient is one entity of a fetch batch: sends are retried on transient errors,
 * one failed recipient never stops the rest.
 */
public final class NewsletterDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NewsletterDispatcher.class);

    private final ResilientFetcher fetcher;
    private final EmailSender sender;
    private final Duration delayBetweenSends;

    public NewsletterDispatcher(ResilientFetcher fetcher, EmailSender sender, Duration delayBetweenSends) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.delayBetweenSends = delayBetweenSends == null ? Duration.ZERO : delayBetweenSends;
    }

    public BulkSendReport send(List<String> recipients, String subject, String htmlBody) {
        if (recipients.isEmpty()) {
            log.info("No recipients, nothing sent");
            return BulkSendReport.EMPTY;
        }
        ProviderAdapter<String> delivery = ProviderAdapter.of(sender.id(), Duration.ZERO,
                to -> sender.send(to, subject, htmlBody));

        List<FetchResult<String>> results = fetcher.fetchAll(recipients, delivery, null, delayBetweenSends, true);

        int sent = 0;
        Map<String, String> failed = new LinkedHashMap<>();
        for (FetchResult<String> result : results) {
            if (result.isFailure()) {
                failed.put(result.entityKey(), result.lastFailure().describe());
            } else {
                sent++;
            }
        }
        log.info("Newsletter sent: {}/{} successful", sent, results.size());
        return new BulkSendReport(results.size(), sent, failed.size(), failed);
    }

    /**
     * Sends to the active subscribers of {@code subscriptions}.
     *
     * @return empty if the subscriber list could not be read
     */
    public Optional<BulkSendReport> sendToSubscribers(SubscriptionService subscriptions, String subject,
                                                      String htmlBody) {
        Optional<List<String>> recipients = subscriptions.activeSubscribers();
        if (recipients.isEmpty()) {
            log.error("Could not load active subscribers, newsletter not sent");
            return Optional.empty();
        }
        return Optional.of(send(recipients.get(), subject, htmlBody));
    }
}
