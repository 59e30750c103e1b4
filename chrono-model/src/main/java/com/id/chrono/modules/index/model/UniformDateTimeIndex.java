package com.id.chrono.modules.index.model;

import com.id.chrono.modules.frequency.model.Frequency;
import lombok.Getter;

/**
 * Index whose timestamps are computed on demand as {@code start + i * frequency}. Lookups use
 * the inverse arithmetic of the frequency and never materialize the sequence.
 */
@Getter
public final class UniformDateTimeIndex extends DateTimeIndex {

    private final long startTms;
    private final int periods;
    private final Frequency frequency;
    private final long lastTms;

    // throws ArithmeticException when the last element does not fit in a long
    UniformDateTimeIndex(long startTms, int periods, Frequency frequency) {
        this.startTms = startTms;
        this.periods = periods;
        this.frequency = frequency;
        this.lastTms = periods == 0 ? startTms : frequency.advance(startTms, periods - 1);
    }

    @Override
    public int size() {
        return periods;
    }

    @Override
    long tmsAt(int loc) {
        return frequency.advance(startTms, loc);
    }

    @Override
    public int locate(long tms) {
        if (periods == 0 || tms < startTms || tms > lastTms) {
            return NOT_FOUND;
        }
        if (tms == lastTms) {
            return periods - 1;
        }
        long n = frequency.difference(startTms, tms);
        return frequency.advance(startTms, n) == tms ? (int) n : NOT_FOUND;
    }

    @Override
    public int insertionLoc(long tms) {
        if (tms < startTms) {
            return 0;
        }
        if (tms >= lastTms) {
            return periods;
        }
        long n = frequency.difference(startTms, tms);
        return (int) Math.min(n + 1, periods);
    }

    @Override
    public DateTimeIndex slice(int fromPos, int toPos) {
        checkSlice(fromPos, toPos);
        return new UniformDateTimeIndex(tmsAt(fromPos), toPos - fromPos, frequency);
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof UniformDateTimeIndex other
                && startTms == other.startTms
                && periods == other.periods
                && frequency.equals(other.frequency)) {
            return true;
        }
        return super.equals(o);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }

    @Override
    public String toString() {
        return "UniformDateTimeIndex[start=%d, periods=%d, %s]".formatted(startTms, periods, frequency);
    }
}
