package net.quantuminvestor.fetch.subscriber;

import net.quantuminvestor.fetch.boundary.ProviderException;

/**
 * Transactional email delivery.
 */
public interface EmailSender {

    /**
     * Provider identity, used for rate limiting.
     */
    String id();

    /**
     * Sends one HTML email.
     *
     * @return the provider's message id
     * @throws ProviderException if the provider rejected or did not accept the message
     */
    String send(String to, String subject, String htmlBody) throws ProviderException;
}
