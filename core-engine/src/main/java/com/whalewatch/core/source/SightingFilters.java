package com.whalewatch.core.source;

import com.whalewatch.core.error.InvalidArgumentException;
import com.whalewatch.core.model.BoundingBox;
import com.whalewatch.core.model.SightingEvent;

import java.time.LocalDate;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Period and area predicates for {@link SightingSource#load(Predicate)}.
 */
public final class SightingFilters {

    private SightingFilters() {
        // utility class: not instantiable
    }

    public static Predicate<SightingEvent> all() {
        return event -> true;
    }

    /**
     * @param month calendar month, 1 to 12
     * @return predicate matching sightings in that month of any year
     * @throws InvalidArgumentException if {@code month} is out of range
     */
    public static Predicate<SightingEvent> inMonth(int month) {
        if (month < 1 || month > 12) {
            throw new InvalidArgumentException("Month must be within [1, 12], got: " + month);
        }
        return event -> event.getTimestamp().getMonthValue() == month;
    }

    /**
     * @param from        first day, inclusive
     * @param toInclusive last day, inclusive
     * @return predicate matching sightings on any day in the range
     */
    public static Predicate<SightingEvent> between(LocalDate from, LocalDate toInclusive) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(toInclusive, "toInclusive must not be null");
        if (toInclusive.isBefore(from)) {
            throw new InvalidArgumentException("Date range ends before it starts: " + from + " > " + toInclusive);
        }
        return event -> {
            LocalDate day = event.getTimestamp().toLocalDate();
            return !day.isBefore(from) && !day.isAfter(toInclusive);
        };
    }

    /**
     * @param bounds area of interest
     * @return predicate matching sightings strictly inside {@code bounds}
     */
    public static Predicate<SightingEvent> within(BoundingBox bounds) {
        Objects.requireNonNull(bounds, "bounds must not be null");
        return event -> bounds.containsStrictly(event.getLocation());
    }
}
