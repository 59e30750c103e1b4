package com.id.chrono.modules.series.model;

import com.id.chrono.exceptions.InvalidRangeException;
import com.id.chrono.exceptions.LengthMismatchException;
import com.id.chrono.modules.index.model.DateTimeIndex;
import com.id.chrono.utils.TimeSeriesTableBuilder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An in-memory table of named series sharing one index, as produced by collecting a partitioned
 * collection. Iteration order of the keys carries no meaning.
 */
public final class TimeSeriesTable {

    @Getter
    private final DateTimeIndex index;
    private final Map<String, Series> series;

    public TimeSeriesTable(DateTimeIndex index, Map<String, Series> series) {
        if (index == null || series == null) {
            throw new IllegalArgumentException("Index and series cannot be null");
        }
        for (Series s : series.values()) {
            if (s.getIndex() != index && !s.getIndex().equals(index)) {
                throw new IllegalArgumentException("Series '%s' is not aligned to the table index".formatted(s.getKey()));
            }
        }
        this.index = index;
        this.series = Collections.unmodifiableMap(new LinkedHashMap<>(series));
    }

    public static TimeSeriesTableBuilder builder(DateTimeIndex index) {
        return new TimeSeriesTableBuilder(index);
    }

    /**
     * Builds a table from row-oriented observations on a known index: row i holds the values of
     * every key at timestamp i.
     */
    public static TimeSeriesTable fromUniformSamples(List<double[]> rows, DateTimeIndex index, List<String> keys) {
        if (rows == null || index == null || keys == null) {
            throw new IllegalArgumentException("Rows, index and keys cannot be null");
        }
        if (rows.size() != index.size()) {
            throw new LengthMismatchException("rows", index.size(), rows.size());
        }
        double[][] columns = new double[keys.size()][rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            double[] row = rows.get(r);
            if (row.length != keys.size()) {
                throw new LengthMismatchException("row " + r, keys.size(), row.length);
            }
            for (int c = 0; c < row.length; c++) {
                columns[c][r] = row[c];
            }
        }
        TimeSeriesTableBuilder builder = builder(index);
        for (int c = 0; c < keys.size(); c++) {
            builder.add(keys.get(c), columns[c]);
        }
        return builder.build();
    }

    /**
     * Builds a table over an irregular index from timestamped rows. Timestamps must be strictly
     * increasing.
     */
    public static TimeSeriesTable fromIrregularSamples(long[] timestamps, List<double[]> rows, List<String> keys) {
        if (timestamps == null) {
            throw new IllegalArgumentException("Timestamps cannot be null");
        }
        return fromUniformSamples(rows, DateTimeIndex.irregular(timestamps), keys);
    }

    public int size() {
        return series.size();
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }

    public Set<String> keys() {
        return series.keySet();
    }

    public Optional<Series> get(String key) {
        return Optional.ofNullable(series.get(key));
    }

    public Map<String, Series> series() {
        return series;
    }

    /**
     * Some series of the table; which one is unspecified.
     */
    public Series head() {
        return series.values().stream()
                .findFirst()
                .orElseThrow(() -> new InvalidRangeException("Table has no series"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSeriesTable other)) {
            return false;
        }
        return index.equals(other.index) && series.equals(other.series);
    }

    @Override
    public int hashCode() {
        return series.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSeriesTable[keys=%s, %s]".formatted(series.keySet(), index);
    }
}
