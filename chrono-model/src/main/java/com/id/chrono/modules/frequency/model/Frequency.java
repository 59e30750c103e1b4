package com.id.chrono.modules.frequency.model;

import com.id.chrono.exceptions.InvalidFrequencyException;
import com.id.chrono.modules.frequency.model.enums.FrequencyUnit;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;

/**
 * A rule for advancing a timestamp by a number of logical steps, each step being {@code step}
 * units of {@link FrequencyUnit}. Immutable and freely shared.
 * <p>
 * For n, m >= 0: {@code advance(advance(t, n), m) == advance(t, n + m)}.
 */
@Getter
@EqualsAndHashCode
public final class Frequency {

    private final FrequencyUnit unit;
    private final int step;

    private Frequency(FrequencyUnit unit, int step) {
        if (unit == null) {
            throw new IllegalArgumentException("Frequency unit cannot be null");
        }
        if (step < 1) {
            throw new InvalidFrequencyException(unit.name(), step);
        }
        this.unit = unit;
        this.step = step;
    }

    public static Frequency of(FrequencyUnit unit, int step) {
        return new Frequency(unit, step);
    }

    public static Frequency days(int days) {
        return new Frequency(FrequencyUnit.DAY, days);
    }

    public static Frequency businessDays(int days) {
        return new Frequency(FrequencyUnit.BUSINESS_DAY, days);
    }

    public static Frequency hours(int hours) {
        return new Frequency(FrequencyUnit.HOUR, hours);
    }

    public static Frequency minutes(int minutes) {
        return new Frequency(FrequencyUnit.MINUTE, minutes);
    }

    public static Frequency seconds(int seconds) {
        return new Frequency(FrequencyUnit.SECOND, seconds);
    }

    /**
     * Applies this frequency n times to the given timestamp.
     *
     * @param tms - Epoch millis to start from
     * @param n   - Number of steps, negative steps go backwards
     * @return the advanced timestamp
     */
    public long advance(long tms, long n) {
        return unit.advance(tms, Math.multiplyExact(n, (long) step));
    }

    public Instant advance(Instant instant, long n) {
        return Instant.ofEpochMilli(advance(instant.toEpochMilli(), n));
    }

    /**
     * The largest number of steps n such that {@code advance(fromTms, n) <= toTms}.
     */
    public long difference(long fromTms, long toTms) {
        return Math.floorDiv(unit.unitsBetween(fromTms, toTms), (long) step);
    }

    @Override
    public String toString() {
        return "Frequency[" + step + " " + unit + "]";
    }
}
