package net.quantuminvestor.fetch.subscriber;

import net.quantuminvestor.fetch.ClassifiedFailure;
import net.quantuminvestor.fetch.FailureKind;
import net.quantuminvestor.fetch.core.FetchRequest;
import net.quantuminvestor.fetch.core.FetchResult;
import net.quantuminvestor.fetch.core.ProviderAdapter;
import net.quantuminvestor.fetch.core.ResilientFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Subscribes and unsubscribes blog readers.
 *
 * <p>Store calls go through the {@link ResilientFetcher}, so transient storage errors are
 * retried. A duplicate subscribe is not an error: it resolves to {@code EXISTS} without retrying.
 */
public final class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final SubscriberStore store;
    private final ResilientFetcher fetcher;
    private final ProviderAdapter<Subscriber> create;
    private final ProviderAdapter<Subscriber> deactivate;
    private final ProviderAdapter<List<String>> listActive;

    public SubscriptionService(SubscriberStore store, ResilientFetcher fetcher) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.create = ProviderAdapter.of(store.id(), Duration.ZERO, this.store::create);
        this.deactivate = ProviderAdapter.of(store.id(), Duration.ZERO, this.store::deactivate);
        this.listActive = ProviderAdapter.of(store.id(), Duration.ZERO, key -> this.store.activeEmails());
    }

    public SubscriptionResult subscribe(String rawEmail) {
        Optional<String> invalid = EmailAddresses.validate(rawEmail);
        if (invalid.isPresent()) {
            return new SubscriptionResult(SubscriptionResult.Status.INVALID, rawEmail, invalid.get());
        }
        String email = EmailAddresses.normalize(rawEmail);

        FetchResult<Subscriber> result = fetcher.fetch(FetchRequest.of(email, create));
        switch (result.source()) {
            case PRIMARY:
            case FALLBACK:
                log.info("New subscriber: {}", email);
                return new SubscriptionResult(SubscriptionResult.Status.CREATED, email,
                        "Successfully subscribed!");
            case EXISTING:
                return new SubscriptionResult(SubscriptionResult.Status.EXISTS, email,
                        "You're already subscribed!");
            default:
                return new SubscriptionResult(SubscriptionResult.Status.FAILED, email,
                        "Subscription failed: " + result.lastFailure().message());
        }
    }

    public SubscriptionResult unsubscribe(String rawEmail) {
        Optional<String> invalid = EmailAddresses.validate(rawEmail);
        if (invalid.isPresent()) {
            return new SubscriptionResult(SubscriptionResult.Status.INVALID, rawEmail, invalid.get());
        }
        String email = EmailAddresses.normalize(rawEmail);

        FetchResult<Subscriber> result = fetcher.fetch(FetchRequest.of(email, deactivate));
        if (result.isSuccess()) {
            log.info("Unsubscribed: {}", email);
            return new SubscriptionResult(SubscriptionResult.Status.UNSUBSCRIBED, email,
                    "Successfully unsubscribed");
        }
        ClassifiedFailure failure = result.lastFailure();
        if (failure != null && failure.kind() == FailureKind.NOT_FOUND) {
            return new SubscriptionResult(SubscriptionResult.Status.NOT_FOUND, email, "Email not found: " + email);
        }
        String detail = failure != null ? failure.message() : "unexpected result " + result.source();
        return new SubscriptionResult(SubscriptionResult.Status.FAILED, email, "Failed to unsubscribe: " + detail);
    }

    /**
     * Active subscriber addresses, or empty if the store could not be read.
     */
    public Optional<List<String>> activeSubscribers() {
        return fetcher.fetchWithRetry("active-subscribers", listActive);
    }
}
