package com.id.chrono.modules.frequency.model;

import com.id.chrono.exceptions.InvalidFrequencyException;
import com.id.chrono.modules.frequency.model.enums.FrequencyUnit;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyTest {

    private static final long DAY = 86_400_000L;
    // Monday
    private static final long MON = Instant.parse("2024-01-01T00:00:00Z").toEpochMilli();

    @Test
    void dayFrequencyAdvancesByWholeDays() {
        Frequency f = Frequency.days(1);
        assertEquals(MON + 3 * DAY, f.advance(MON, 3));
        assertEquals(MON - DAY, f.advance(MON, -1));
        assertEquals(MON, f.advance(MON, 0));
    }

    @Test
    void stepMultipliesTheUnit() {
        Frequency f = Frequency.hours(6);
        assertEquals(MON + 12 * 3_600_000L, f.advance(MON, 2));
        assertEquals(Instant.parse("2024-01-01T18:00:00Z"), f.advance(Instant.ofEpochMilli(MON), 3));
    }

    @Test
    void advanceIsAdditiveForFixedUnits() {
        for (FrequencyUnit unit : FrequencyUnit.values()) {
            Frequency f = Frequency.of(unit, 3);
            for (int n = 0; n < 12; n++) {
                for (int m = 0; m < 12; m++) {
                    assertEquals(f.advance(MON + 12345L, n + m), f.advance(f.advance(MON + 12345L, n), m),
                            unit + " n=" + n + " m=" + m);
                }
            }
        }
    }

    @Test
    void advanceIsAdditiveFromEveryDayOfTheWeek() {
        Frequency f = Frequency.businessDays(1);
        for (int d = 0; d < 7; d++) {
            long start = MON + d * DAY + 3_600_000L;
            for (int n = 0; n < 15; n++) {
                for (int m = 0; m < 15; m++) {
                    assertEquals(f.advance(start, n + m), f.advance(f.advance(start, n), m),
                            "day=" + d + " n=" + n + " m=" + m);
                }
            }
        }
    }

    @Test
    void businessDaysSkipWeekends() {
        Frequency f = Frequency.businessDays(1);
        long fri = MON + 4 * DAY;
        long sat = MON + 5 * DAY;
        long nextMon = MON + 7 * DAY;
        assertEquals(nextMon, f.advance(fri, 1));
        assertEquals(nextMon, f.advance(sat, 1));
        assertEquals(MON + 8 * DAY, f.advance(sat, 2));
        assertEquals(nextMon, f.advance(MON, 5));
        assertEquals(fri - 7 * DAY, f.advance(MON, -1));
        assertEquals(sat, f.advance(sat, 0));
    }

    @Test
    void businessDayKeepsTimeOfDay() {
        long friNoon = Instant.parse("2024-01-05T12:30:00Z").toEpochMilli();
        assertEquals(Instant.parse("2024-01-08T12:30:00Z").toEpochMilli(), Frequency.businessDays(1).advance(friNoon, 1));
    }

    @Test
    void differenceInvertsAdvance() {
        Frequency days = Frequency.days(2);
        assertEquals(5, days.difference(MON, days.advance(MON, 5)));
        assertEquals(5, days.difference(MON, days.advance(MON, 5) + DAY));
        assertEquals(0, days.difference(MON, MON));

        Frequency bd = Frequency.businessDays(1);
        for (int n = 0; n < 20; n++) {
            assertEquals(n, bd.difference(MON, bd.advance(MON, n)));
        }
        // Saturday sits between Friday (4) and Monday (5)
        assertEquals(4, bd.difference(MON, MON + 5 * DAY));
    }

    @Test
    void nonPositiveStepIsRejected() {
        InvalidFrequencyException ex = assertThrows(InvalidFrequencyException.class, () -> Frequency.days(0));
        assertEquals(0, ex.getStep());
        assertThrows(InvalidFrequencyException.class, () -> Frequency.of(FrequencyUnit.MINUTE, -2));
        assertThrows(IllegalArgumentException.class, () -> Frequency.of(null, 1));
    }

    @Test
    void equalityFollowsUnitAndStep() {
        assertEquals(Frequency.days(1), Frequency.of(FrequencyUnit.DAY, 1));
        assertEquals(Frequency.days(1).hashCode(), Frequency.of(FrequencyUnit.DAY, 1).hashCode());
        assertNotEquals(Frequency.days(1), Frequency.days(2));
        assertNotEquals(Frequency.days(1), Frequency.businessDays(1));
    }
}
