package dev.bomcompare.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive calendar date range.
 */
public record DateRange(LocalDate from, LocalDate to) {

    public DateRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from))
            throw new IllegalArgumentException("range end " + to + " is before start " + from);
    }

    public static DateRange of(LocalDate day) {
        return new DateRange(day, day);
    }
}
