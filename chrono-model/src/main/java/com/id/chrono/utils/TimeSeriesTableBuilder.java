package com.id.chrono.utils;

import com.id.chrono.exceptions.DuplicateKeyException;
import com.id.chrono.modules.index.model.DateTimeIndex;
import com.id.chrono.modules.series.model.Series;
import com.id.chrono.modules.series.model.SeriesEntry;
import com.id.chrono.modules.series.model.TimeSeriesTable;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TimeSeriesTableBuilder {

    private static final int NO_PARTITION = -1;

    private final DateTimeIndex index;
    private final Map<String, Series> series = new LinkedHashMap<>();
    private final Map<String, Integer> origins = new HashMap<>();

    public TimeSeriesTableBuilder(DateTimeIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("Index cannot be null");
        }
        this.index = index;
    }

    /**
     * Adds a series. This method is synchronized so partition results can be merged from
     * several threads.
     *
     * @param key    - Series key, unique within the table
     * @param values - Values aligned to the builder's index
     */
    public synchronized TimeSeriesTableBuilder add(String key, double[] values) {
        return add(new Series(key, index, values), NO_PARTITION);
    }

    /**
     * Adds an already built series coming from the given partition.
     *
     * @throws DuplicateKeyException if the key was already added
     */
    public synchronized TimeSeriesTableBuilder add(Series s, int partition) {
        Integer firstPartition = origins.putIfAbsent(s.getKey(), partition);
        if (firstPartition != null) {
            if (firstPartition == NO_PARTITION && partition == NO_PARTITION) {
                throw new DuplicateKeyException(s.getKey());
            }
            throw new DuplicateKeyException(s.getKey(), firstPartition, partition);
        }
        if (s.getIndex() != index && !s.getIndex().equals(index)) {
            origins.remove(s.getKey());
            throw new IllegalArgumentException("Series '%s' is not aligned to the table index".formatted(s.getKey()));
        }
        series.put(s.getKey(), s);
        return this;
    }

    /**
     * Adds every entry of a partition.
     */
    public synchronized TimeSeriesTableBuilder addEntries(List<SeriesEntry> entries, int partition) {
        if (entries == null) {
            return this;
        }
        for (SeriesEntry entry : entries) {
            add(new Series(entry.key(), index, entry.values()), partition);
        }
        return this;
    }

    /**
     * Adds every series of another table sharing the same index.
     */
    public synchronized TimeSeriesTableBuilder addTable(TimeSeriesTable table) {
        if (table == null) {
            return this;
        }
        table.series().values().forEach(s -> add(s, NO_PARTITION));
        return this;
    }

    public synchronized TimeSeriesTable build() {
        return new TimeSeriesTable(index, series);
    }
}
