package com.id.chrono.modules.collection.model;

import com.id.chrono.modules.series.model.SeriesEntry;
import lombok.Getter;

import java.util.List;

/**
 * One partition of a {@link DistributedSeriesCollection}: an immutable list of entries.
 */
@Getter
public final class SeriesPartition {

    private final int id;
    private final List<SeriesEntry> entries;

    public SeriesPartition(int id, List<SeriesEntry> entries) {
        if (entries == null) {
            throw new IllegalArgumentException("Entries cannot be null for partition " + id);
        }
        this.id = id;
        this.entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "SeriesPartition[id=%d, entries=%d]".formatted(id, entries.size());
    }
}
