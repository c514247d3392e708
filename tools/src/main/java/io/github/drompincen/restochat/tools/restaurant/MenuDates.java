package io.github.drompincen.restochat.tools.restaurant;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

final class MenuDates {

    private MenuDates() {}

    /** {@code YYYY-MM-DD}, or today when absent. */
    static LocalDate resolve(String raw, Clock clock) {
        if (raw == null) return LocalDate.now(clock);
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date format '" + raw + "'. Use YYYY-MM-DD");
        }
    }
}
