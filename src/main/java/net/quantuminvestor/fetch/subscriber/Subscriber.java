package net.quantuminvestor.fetch.subscriber;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored subscriber. Unsubscribing keeps the record and clears {@code active}.
 */
public record Subscriber(String email, Instant subscribedAt, boolean active) {

    public Subscriber {
        Objects.requireNonNull(email, "email must not be null");
        Objects.requireNonNull(subscribedAt, "subscribedAt must not be null");
    }

    public Subscriber deactivated() {
        return new Subscriber(email, subscribedAt, false);
    }
}
