package com.id.chrono.modules.frequency.model.enums;

/**
 * Calendar units a {@link com.id.chrono.modules.frequency.model.Frequency} can step by.
 * Timestamps are epoch milliseconds in UTC.
 */
public enum FrequencyUnit {
    MILLISECOND(1L),
    SECOND(1_000L),
    MINUTE(60_000L),
    HOUR(3_600_000L),
    DAY(86_400_000L),
    WEEK(604_800_000L),

    /**
     * Monday to Friday. Advancing a Saturday or Sunday by k > 0 lands on the k-th weekday after
     * it; time of day is kept.
     */
    BUSINESS_DAY(86_400_000L) {
        @Override
        public long advance(long tms, long units) {
            if (units == 0) {
                return tms;
            }
            long day = Math.floorDiv(tms, DAY_MILLIS);
            long timeOfDay = Math.floorMod(tms, DAY_MILLIS);
            int dow = dayOfWeek(day);
            long weeks = units / 5;
            int rem = (int) (units % 5);

            if (units > 0) {
                if (dow >= 5) {
                    // treat the weekend as the preceding Friday
                    day -= dow - 4;
                    dow = 4;
                }
                day += weeks * 7 + rem + (dow + rem >= 5 ? 2 : 0);
            } else {
                if (dow >= 5) {
                    // treat the weekend as the following Monday
                    day += 7 - dow;
                    dow = 0;
                }
                day += weeks * 7 + rem + (dow + rem < 0 ? -2 : 0);
            }
            return Math.addExact(Math.multiplyExact(day, DAY_MILLIS), timeOfDay);
        }

        @Override
        public long unitsBetween(long fromTms, long toTms) {
            long fromDay = Math.floorDiv(fromTms, DAY_MILLIS);
            long toDay = Math.floorDiv(toTms, DAY_MILLIS);
            long units = weekdaysUpTo(toDay) - weekdaysUpTo(fromDay);
            // the weekday count is off by at most a couple of units around weekends and time of day
            while (advance(fromTms, units) > toTms) {
                units--;
            }
            while (advance(fromTms, units + 1) <= toTms) {
                units++;
            }
            return units;
        }
    };

    private static final long DAY_MILLIS = 86_400_000L;

    // 1970-01-01 was a Thursday
    private static final int EPOCH_DAY_OF_WEEK = 3;

    private final long millis;

    FrequencyUnit(long millis) {
        this.millis = millis;
    }

    /**
     * Nominal length of one unit in milliseconds.
     */
    public long getMillis() {
        return millis;
    }

    public long advance(long tms, long units) {
        return Math.addExact(tms, Math.multiplyExact(units, millis));
    }

    /**
     * The largest number of units n such that {@code advance(fromTms, n) <= toTms}.
     */
    public long unitsBetween(long fromTms, long toTms) {
        return Math.floorDiv(Math.subtractExact(toTms, fromTms), millis);
    }

    // Monday = 0 ... Sunday = 6
    private static int dayOfWeek(long epochDay) {
        return (int) Math.floorMod(epochDay + EPOCH_DAY_OF_WEEK, 7L);
    }

    // Number of weekdays in [epoch origin, day], shifted so that differences count weekdays in (a, b]
    private static long weekdaysUpTo(long epochDay) {
        long shifted = epochDay + EPOCH_DAY_OF_WEEK;
        return Math.floorDiv(shifted, 7L) * 5 + Math.min(Math.floorMod(shifted, 7L) + 1, 5);
    }
}
