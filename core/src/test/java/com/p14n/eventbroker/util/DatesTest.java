package com.p14n.eventbroker.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

class DatesTest {

    @Test
    void convertToDateTimeShouldStartDateAtMidnight() {
        assertEquals(LocalDateTime.of(2024, 3, 1, 0, 0), Dates.convertToDateTime(LocalDate.of(2024, 3, 1)));

        LocalDateTime dateTime = LocalDateTime.of(2024, 3, 1, 12, 30, 5);
        assertSame(dateTime, Dates.convertToDateTime(dateTime));
    }

    @Test
    void convertToDateTimeShouldRejectOtherTypes() {
        assertThrows(IllegalArgumentException.class, () -> Dates.convertToDateTime(Instant.EPOCH));
        assertThrows(IllegalArgumentException.class, () -> Dates.convertToDateTime(null));
    }

    @Test
    void timedeltaSecondsShouldIncludeMicroseconds() {
        Duration delta = Duration.ofDays(1).plusSeconds(5).plusNanos(250_000_000);

        assertEquals(86_405.25, Dates.timedeltaSeconds(delta), 1e-9);
    }

    @Test
    void timeDifferenceShouldIgnoreSubSecondParts() {
        LocalDateTime earlier = LocalDateTime.of(2024, 3, 1, 12, 0, 0, 900_000_000);
        LocalDateTime later = LocalDateTime.of(2024, 3, 1, 12, 1, 0, 100_000_000);

        assertEquals(60, Dates.timeDifference(later, earlier));
        assertEquals(-60, Dates.timeDifference(earlier, later));
    }

    @Test
    void datetimeCeilShouldRoundUpToWholeSecond() {
        assertEquals(LocalDateTime.of(2024, 3, 1, 12, 0, 1),
                Dates.datetimeCeil(LocalDateTime.of(2024, 3, 1, 12, 0, 0, 1_000)));

        LocalDateTime whole = LocalDateTime.of(2024, 3, 1, 12, 0, 0);
        assertEquals(whole, Dates.datetimeCeil(whole));
    }
}
