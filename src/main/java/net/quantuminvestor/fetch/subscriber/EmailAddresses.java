package net.quantuminvestor.fetch.subscriber;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validation and normalisation of subscriber email addresses.
 */
public final class EmailAddresses {

    public static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    public static final int MIN_LENGTH = 6;
    public static final int MAX_LENGTH = 254;

    private EmailAddresses() {
        // Utility class
    }

    /**
     * Validates an address after trimming surrounding whitespace.
     *
     * @return the reason the address is rejected, or empty if it is acceptable
     */
    public static Optional<String> validate(String email) {
        String trimmed = email == null ? "" : email.trim();
        if (trimmed.isEmpty()) {
            return Optional.of("Email is required");
        }
        if (trimmed.length() < MIN_LENGTH) {
            return Optional.of("Email address is too short");
        }
        if (trimmed.length() > MAX_LENGTH) {
            return Optional.of("Email address is too long");
        }
        if (!EMAIL_PATTERN.matcher(trimmed).matches()) {
            return Optional.of("Invalid email format");
        }
        return Optional.empty();
    }

    public static boolean isValid(String email) {
        return validate(email).isEmpty();
    }

    /**
     * Trimmed and lower-cased, the form used as the storage key.
     */
    public static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
