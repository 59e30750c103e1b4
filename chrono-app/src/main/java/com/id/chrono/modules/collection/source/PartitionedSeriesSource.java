package com.id.chrono.modules.collection.source;

import com.id.chrono.modules.series.model.SeriesEntry;

import java.io.IOException;
import java.util.List;

/**
 * Externally supplied, partitioned (key, values) data. Partitions are read independently and
 * possibly concurrently, so implementations must not share mutable state between reads.
 */
public interface PartitionedSeriesSource {

    int partitionCount();

    List<SeriesEntry> readPartition(int partition) throws IOException;
}
