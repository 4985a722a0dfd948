package net.quantuminvestor.fetch.subscriber;

/**
 * What happened to a subscribe or unsubscribe request.
 *
 * @param status the result
 * @param email the normalised address, or the raw input when it was invalid
 * @param message a message fit to show the subscriber
 */
public record SubscriptionResult(Status status, String email, String message) {

    public enum Status {
        CREATED,
        EXISTS,
        UNSUBSCRIBED,
        NOT_FOUND,
        INVALID,
        FAILED
    }

    public boolean isSuccess() {
        return status == Status.CREATED || status == Status.EXISTS || status == Status.UNSUBSCRIBED;
    }
}
