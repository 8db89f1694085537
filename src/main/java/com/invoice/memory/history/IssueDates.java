package com.invoice.memory.history;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Lenient parser for invoice issue dates.
 * Accepts {@code YYYY-MM-DD} (optionally followed by a time part) and {@code DD.MM.YYYY}.
 */
final class IssueDates {

    private static final DateTimeFormatter GERMAN = DateTimeFormatter.ofPattern("dd.MM.uuuu");

    private IssueDates() {
    }

    static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() >= 10 && trimmed.charAt(4) == '-') {
                return Optional.of(LocalDate.parse(trimmed.substring(0, 10)));
            }
            return Optional.of(LocalDate.parse(trimmed, GERMAN));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
