package com.p14n.eventbroker.util;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;

/**
 * Date and time normalization helpers.
 */
public final class Dates {

    private Dates() {
    }

    /**
     * Converts a date to a date-time at the start of that day. A
     * {@link LocalDateTime} is returned unchanged.
     *
     * @param dateval a {@link LocalDate} or {@link LocalDateTime}
     * @return the date-time
     * @throws IllegalArgumentException for any other type
     */
    public static LocalDateTime convertToDateTime(Temporal dateval) {
        if (dateval instanceof LocalDateTime) {
            return (LocalDateTime) dateval;
        }
        if (dateval instanceof LocalDate) {
            return ((LocalDate) dateval).atStartOfDay();
        }
        throw new IllegalArgumentException("Expected date, got "
                + (dateval == null ? "null" : dateval.getClass().getName()) + " instead");
    }

    /**
     * Converts a duration to fractional seconds, with microsecond precision.
     *
     * @param delta the duration
     * @return the duration in seconds
     */
    public static double timedeltaSeconds(Duration delta) {
        return delta.getSeconds() + (delta.getNano() / 1000) / 1_000_000.0;
    }

    /**
     * Returns the difference {@code later - earlier} in whole seconds, ignoring
     * sub-second parts of either value.
     *
     * @param later   the later date-time
     * @param earlier the earlier date-time
     * @return the difference in seconds
     */
    public static long timeDifference(LocalDateTime later, LocalDateTime earlier) {
        return ChronoUnit.SECONDS.between(earlier.truncatedTo(ChronoUnit.SECONDS),
                later.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Rounds a date-time up to the next whole second if it has a sub-second
     * part.
     *
     * @param dateval the date-time
     * @return the rounded date-time
     */
    public static LocalDateTime datetimeCeil(LocalDateTime dateval) {
        if (dateval.getNano() > 0) {
            return dateval.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        }
        return dateval;
    }
}
