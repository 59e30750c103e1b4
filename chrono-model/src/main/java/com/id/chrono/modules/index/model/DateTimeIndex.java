package com.id.chrono.modules.index.model;

import com.id.chrono.exceptions.DuplicateTimestampException;
import com.id.chrono.exceptions.IndexOutOfRangeException;
import com.id.chrono.exceptions.InvalidRangeException;
import com.id.chrono.exceptions.UnsortedIndexException;
import com.id.chrono.modules.frequency.model.Frequency;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, strictly increasing sequence of epoch-millis timestamps shared by aligned series.
 * <p>
 * Two indexes are equal when they hold the same timestamps in the same order, whichever variant
 * produced them.
 */
public abstract class DateTimeIndex {

    public static final int NOT_FOUND = -1;

    DateTimeIndex() {
    }

    /**
     * Builds a uniform index of {@code periods} timestamps, element i being
     * {@code frequency.advance(startTms, i)}.
     *
     * @throws InvalidRangeException if periods is negative or the last element overflows
     */
    public static DateTimeIndex uniform(long startTms, int periods, Frequency frequency) {
        if (frequency == null) {
            throw new IllegalArgumentException("Frequency cannot be null");
        }
        if (periods < 0) {
            throw new InvalidRangeException("Periods must be >= 0, got: " + periods);
        }
        try {
            return new UniformDateTimeIndex(startTms, periods, frequency);
        } catch (ArithmeticException e) {
            throw new InvalidRangeException("%d periods of %s from %d run past the representable range"
                    .formatted(periods, frequency, startTms), e);
        }
    }

    public static DateTimeIndex uniform(Instant start, int periods, Frequency frequency) {
        if (start == null) {
            throw new IllegalArgumentException("Start cannot be null");
        }
        return uniform(start.toEpochMilli(), periods, frequency);
    }

    /**
     * Builds an irregular index from explicit timestamps. The array is copied.
     *
     * @throws DuplicateTimestampException if two adjacent timestamps are equal
     * @throws UnsortedIndexException      if the timestamps are not increasing
     */
    public static DateTimeIndex irregular(long[] timestamps) {
        if (timestamps == null) {
            throw new IllegalArgumentException("Timestamps cannot be null");
        }
        long[] copy = timestamps.clone();
        for (int i = 1; i < copy.length; i++) {
            if (copy[i] == copy[i - 1]) {
                throw new DuplicateTimestampException(copy[i], i - 1, i);
            }
            if (copy[i] < copy[i - 1]) {
                throw new UnsortedIndexException(i, copy[i - 1], copy[i]);
            }
        }
        return new IrregularDateTimeIndex(copy);
    }

    public static DateTimeIndex irregular(List<Instant> timestamps) {
        if (timestamps == null) {
            throw new IllegalArgumentException("Timestamps cannot be null");
        }
        return irregular(timestamps.stream().mapToLong(Instant::toEpochMilli).toArray());
    }

    public abstract int size();

    /**
     * Position of the given timestamp, or {@link #NOT_FOUND}.
     */
    public abstract int locate(long tms);

    /**
     * Position of the first element strictly greater than {@code tms}; {@link #size()} if none.
     */
    public abstract int insertionLoc(long tms);

    /**
     * Sub-index covering positions [fromPos, toPos).
     */
    public abstract DateTimeIndex slice(int fromPos, int toPos);

    abstract long tmsAt(int loc);

    public boolean isEmpty() {
        return size() == 0;
    }

    public long dateTimeAtLoc(int loc) {
        if (loc < 0 || loc >= size()) {
            throw new IndexOutOfRangeException(loc, size());
        }
        return tmsAt(loc);
    }

    public Instant instantAtLoc(int loc) {
        return Instant.ofEpochMilli(dateTimeAtLoc(loc));
    }

    public long first() {
        return dateTimeAtLoc(0);
    }

    public long last() {
        return dateTimeAtLoc(size() - 1);
    }

    public int locate(Instant instant) {
        return locate(instant.toEpochMilli());
    }

    /**
     * Position of the first element greater than or equal to {@code tms}; {@link #size()} if none.
     */
    public int ceilingLoc(long tms) {
        return tms == Long.MIN_VALUE ? 0 : insertionLoc(tms - 1);
    }

    /**
     * Sub-index of the timestamps falling within [fromTms, toTms], both inclusive.
     */
    public DateTimeIndex sliceByTime(long fromTms, long toTms) {
        if (fromTms > toTms) {
            throw new InvalidRangeException("Slice start %d is after end %d".formatted(fromTms, toTms));
        }
        return slice(ceilingLoc(fromTms), insertionLoc(toTms));
    }

    public long[] toMillisArray() {
        long[] out = new long[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = tmsAt(i);
        }
        return out;
    }

    public List<Instant> toInstants() {
        List<Instant> out = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            out.add(Instant.ofEpochMilli(tmsAt(i)));
        }
        return Collections.unmodifiableList(out);
    }

    void checkSlice(int fromPos, int toPos) {
        if (fromPos < 0 || toPos > size() || fromPos > toPos) {
            throw new IndexOutOfRangeException(fromPos, toPos, size());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DateTimeIndex other)) {
            return false;
        }
        int size = size();
        if (size != other.size()) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            if (tmsAt(i) != other.tmsAt(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (int i = 0; i < size(); i++) {
            h = 31 * h + Long.hashCode(tmsAt(i));
        }
        return h;
    }
}
