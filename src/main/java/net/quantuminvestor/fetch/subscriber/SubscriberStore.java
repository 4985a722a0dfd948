package net.quantuminvestor.fetch.subscriber;

import net.quantuminvestor.fetch.boundary.ProviderException;

import java.util.List;

/**
 * Storage backend for subscribers, keyed by normalised email address.
 *
 * <p>Implementations report problems as {@link ProviderException}s with HTTP-style statuses so
 * the fetch layer can classify them: 409 for a duplicate create, 404 for an unknown address.
 */
public interface SubscriberStore {

    /**
     * Provider identity, used for rate limiting and operation names.
     */
    default String id() {
        return "subscriber-store";
    }

    /**
     * Stores a new active subscriber.
     *
     * @throws ProviderException with status 409 if the address is already stored
     */
    Subscriber create(String email) throws ProviderException;

    /**
     * Marks a subscriber inactive.
     *
     * @throws ProviderException with status 404 if the address is not stored
     */
    Subscriber deactivate(String email) throws ProviderException;

    /**
     * Addresses of all active subscribers.
     */
    List<String> activeEmails() throws ProviderException;
}
