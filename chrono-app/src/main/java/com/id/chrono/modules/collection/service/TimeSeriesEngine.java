package com.id.chrono.modules.collection.service;

import com.id.chrono.modules.collection.model.DistributedSeriesCollection;
import com.id.chrono.modules.collection.source.InMemoryPartitionedSource;
import com.id.chrono.modules.collection.source.PartitionedSeriesSource;
import com.id.chrono.modules.collection.substrate.CollectionSubstrate;
import com.id.chrono.modules.frequency.model.Frequency;
import com.id.chrono.modules.frequency.model.enums.FrequencyUnit;
import com.id.chrono.modules.index.model.DateTimeIndex;
import com.id.chrono.modules.series.model.TimeSeriesTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Entry point for building frequencies, indexes and partitioned collections bound to the
 * configured {@link CollectionSubstrate}.
 */
@Service
@Slf4j
public class TimeSeriesEngine {

    private final CollectionSubstrate substrate;

    public TimeSeriesEngine(CollectionSubstrate substrate) {
        this.substrate = substrate;
    }

    public Frequency frequency(FrequencyUnit unit, int step) {
        return Frequency.of(unit, step);
    }

    public Frequency dayFrequency(int days) {
        return Frequency.days(days);
    }

    public DateTimeIndex uniform(Instant start, int periods, Frequency frequency) {
        return DateTimeIndex.uniform(start, periods, frequency);
    }

    public DateTimeIndex uniform(long startTms, int periods, Frequency frequency) {
        return DateTimeIndex.uniform(startTms, periods, frequency);
    }

    public DateTimeIndex irregular(long[] timestamps) {
        return DateTimeIndex.irregular(timestamps);
    }

    public DateTimeIndex irregular(List<Instant> timestamps) {
        return DateTimeIndex.irregular(timestamps);
    }

    /**
     * Binds an externally supplied partitioned source to the index.
     */
    public DistributedSeriesCollection timeSeriesCollection(DateTimeIndex index, PartitionedSeriesSource source) {
        log.debug("Building collection over {} partitions", source == null ? 0 : source.partitionCount());
        return DistributedSeriesCollection.fromSource(index, source, substrate);
    }

    public DistributedSeriesCollection timeSeriesCollection(DateTimeIndex index, List<Map<String, double[]>> partitions) {
        return timeSeriesCollection(index, InMemoryPartitionedSource.ofMaps(partitions));
    }

    public TimeSeriesTable collectAsTimeSeries(DistributedSeriesCollection collection) {
        if (collection == null) {
            throw new IllegalArgumentException("Collection cannot be null");
        }
        return collection.collect();
    }
}
