package net.quantuminvestor.fetch.subscriber;

import net.quantuminvestor.fetch.boundary.ProviderException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps subscribers in memory, in subscription order. For local runs and tests.
 */
public final class InMemorySubscriberStore implements SubscriberStore {

    private final Map<String, Subscriber> subscribers = new LinkedHashMap<>();
    private final Clock clock;

    public InMemorySubscriberStore() {
        this(Clock.systemUTC());
    }

    public InMemorySubscriberStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public synchronized Subscriber create(String email) throws ProviderException {
        if (subscribers.containsKey(email)) {
            throw ProviderException.status(id(), 409, "Subscriber already exists: " + email, null);
        }
        Subscriber subscriber = new Subscriber(email, clock.instant(), true);
        subscribers.put(email, subscriber);
        return subscriber;
    }

    @Override
    public synchronized Subscriber deactivate(String email) throws ProviderException {
        Subscriber existing = subscribers.get(email);
        if (existing == null) {
            throw ProviderException.status(id(), 404, "Email not found: " + email, null);
        }
        Subscriber updated = existing.deactivated();
        subscribers.put(email, updated);
        return updated;
    }

    @Override
    public synchronized List<String> activeEmails() {
        return subscribers.values().stream()
                .filter(Subscriber::active)
                .map(Subscriber::email)
                .collect(Collectors.toList());
    }

    public synchronized Optional<Subscriber> find(String email) {
        return Optional.ofNullable(subscribers.get(email));
    }
}
