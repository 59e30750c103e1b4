package com.id.chrono.modules.series.model;

import com.id.chrono.exceptions.IndexOutOfRangeException;
import com.id.chrono.exceptions.LengthMismatchException;
import com.id.chrono.modules.index.model.DateTimeIndex;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * A named vector of values aligned 1:1 with a shared {@link DateTimeIndex}. Position i of the
 * values corresponds to timestamp i of the index.
 */
public final class Series {

    /**
     * Marker for a timestamp that has no value.
     */
    public static final double MISSING = Double.NaN;

    @Getter
    private final String key;
    @Getter
    private final DateTimeIndex index;
    private final double[] values;

    public Series(String key, DateTimeIndex index, double[] values) {
        if (key == null) {
            throw new IllegalArgumentException("Series key cannot be null");
        }
        if (index == null || values == null) {
            throw new IllegalArgumentException("Index and values cannot be null for key: " + key);
        }
        if (values.length != index.size()) {
            throw new LengthMismatchException(key, index.size(), values.length);
        }
        this.key = key;
        this.index = index;
        this.values = values.clone();
    }

    public int size() {
        return values.length;
    }

    public double at(int position) {
        if (position < 0 || position >= values.length) {
            throw new IndexOutOfRangeException(position, values.length);
        }
        return values[position];
    }

    /**
     * Value at the given timestamp, {@link #MISSING} when the index does not hold it.
     */
    public double valueAt(long tms) {
        int loc = index.locate(tms);
        return loc == DateTimeIndex.NOT_FOUND ? MISSING : values[loc];
    }

    /**
     * Reindexes this series onto another index. Timestamps the current index does not hold
     * become {@link #MISSING}.
     */
    public Series alignTo(DateTimeIndex other) {
        if (other == null) {
            throw new IllegalArgumentException("Target index cannot be null");
        }
        if (other == index || other.equals(index)) {
            return new Series(key, other, values);
        }
        double[] aligned = new double[other.size()];
        for (int i = 0; i < aligned.length; i++) {
            aligned[i] = valueAt(other.dateTimeAtLoc(i));
        }
        return new Series(key, other, aligned);
    }

    public Series withKey(String newKey) {
        return new Series(newKey, index, values);
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Series other)) {
            return false;
        }
        return key.equals(other.key) && Arrays.equals(values, other.values) && index.equals(other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, Arrays.hashCode(values));
    }

    @Override
    public String toString() {
        return "Series[key=%s, size=%d]".formatted(key, values.length);
    }
}
