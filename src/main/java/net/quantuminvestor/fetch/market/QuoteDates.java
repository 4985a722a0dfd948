package net.quantuminvestor.fetch.market;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

final class QuoteDates {

    private QuoteDates() {
    }

    /**
     * Parses the leading {@code yyyy-MM-dd} of a provider date or timestamp; null if absent
     * or malformed.
     */
    static LocalDate parseDate(String text) {
        if (text == null || text.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(text.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
