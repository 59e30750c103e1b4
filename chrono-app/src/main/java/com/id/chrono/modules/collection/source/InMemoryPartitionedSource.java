package com.id.chrono.modules.collection.source;

import com.id.chrono.modules.series.model.SeriesEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class InMemoryPartitionedSource implements PartitionedSeriesSource {

    private final List<List<SeriesEntry>> partitions;

    public InMemoryPartitionedSource(List<List<SeriesEntry>> partitions) {
        if (partitions == null) {
            throw new IllegalArgumentException("Partitions cannot be null");
        }
        this.partitions = partitions.stream().map(List::copyOf).toList();
    }

    /**
     * One partition per map, keys becoming series keys.
     */
    public static InMemoryPartitionedSource ofMaps(List<Map<String, double[]>> partitions) {
        if (partitions == null) {
            throw new IllegalArgumentException("Partitions cannot be null");
        }
        List<List<SeriesEntry>> converted = new ArrayList<>(partitions.size());
        for (Map<String, double[]> partition : partitions) {
            List<SeriesEntry> entries = new ArrayList<>(partition.size());
            partition.forEach((key, values) -> entries.add(new SeriesEntry(key, values)));
            converted.add(entries);
        }
        return new InMemoryPartitionedSource(converted);
    }

    @Override
    public int partitionCount() {
        return partitions.size();
    }

    @Override
    public List<SeriesEntry> readPartition(int partition) {
        if (partition < 0 || partition >= partitions.size()) {
            throw new IllegalArgumentException("No partition " + partition + ", count is " + partitions.size());
        }
        return partitions.get(partition);
    }
}
