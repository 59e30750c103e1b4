package com.id.chrono.modules.collection.model;

import com.id.chrono.exceptions.DuplicateKeyException;
import com.id.chrono.exceptions.LengthMismatchException;
import com.id.chrono.modules.collection.source.PartitionedSeriesSource;
import com.id.chrono.modules.collection.substrate.CollectionSubstrate;
import com.id.chrono.modules.index.model.DateTimeIndex;
import com.id.chrono.modules.series.model.Series;
import com.id.chrono.modules.series.model.SeriesEntry;
import com.id.chrono.modules.series.model.TimeSeriesTable;
import com.id.chrono.utils.SeriesMath;
import com.id.chrono.utils.TimeSeriesTableBuilder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.IntStream;

/**
 * A partitioned set of named vectors, all aligned to one shared {@link DateTimeIndex}.
 * <p>
 * Instances are immutable: every transformation runs once per partition on the
 * {@link CollectionSubstrate} and returns a new collection, leaving this one untouched.
 * {@link #collect()} is the barrier that gathers every partition into one local table.
 */
@Slf4j
public final class DistributedSeriesCollection {

    @Getter
    private final DateTimeIndex index;
    private final List<SeriesPartition> partitions;
    private final CollectionSubstrate substrate;

    private DistributedSeriesCollection(DateTimeIndex index,
                                        List<SeriesPartition> partitions,
                                        CollectionSubstrate substrate) {
        this.index = index;
        this.partitions = List.copyOf(partitions);
        this.substrate = substrate;
    }

    /**
     * Builds a collection from in-memory partitions, checking every vector against the index.
     *
     * @throws LengthMismatchException if a vector's length differs from the index size
     */
    public static DistributedSeriesCollection of(DateTimeIndex index,
                                                 List<List<SeriesEntry>> partitions,
                                                 CollectionSubstrate substrate) {
        requireContext(index, substrate);
        if (partitions == null) {
            throw new IllegalArgumentException("Partitions cannot be null");
        }
        List<SeriesPartition> validated = substrate.runPerPartition(partitions, (id, entries) -> {
            checkLengths(entries, index.size());
            return new SeriesPartition(id, entries);
        });
        return new DistributedSeriesCollection(index, validated, substrate);
    }

    /**
     * Reads every partition of the source through the substrate.
     *
     * @throws LengthMismatchException if a vector's length differs from the index size
     */
    public static DistributedSeriesCollection fromSource(DateTimeIndex index,
                                                         PartitionedSeriesSource source,
                                                         CollectionSubstrate substrate) {
        requireContext(index, substrate);
        if (source == null) {
            throw new IllegalArgumentException("Source cannot be null");
        }
        List<Integer> partitionIds = IntStream.range(0, source.partitionCount()).boxed().toList();
        List<SeriesPartition> loaded = substrate.runPerPartition(partitionIds, (id, partition) -> {
            List<SeriesEntry> entries = source.readPartition(partition);
            checkLengths(entries, index.size());
            return new SeriesPartition(id, entries);
        });
        log.debug("Loaded {} partitions, index size {}", loaded.size(), index.size());
        return new DistributedSeriesCollection(index, loaded, substrate);
    }

    public int partitionCount() {
        return partitions.size();
    }

    public List<SeriesPartition> getPartitions() {
        return Collections.unmodifiableList(partitions);
    }

    /**
     * Gathers every partition into one table keyed by series key. Waits for all partitions; the
     * first failing partition aborts the call and no partial table is returned.
     *
     * @throws DuplicateKeyException if a key occurs more than once across the collection
     */
    public TimeSeriesTable collect() {
        List<List<Series>> perPartition = substrate.runPerPartition(partitions, (id, partition) -> {
            List<Series> series = new ArrayList<>(partition.size());
            for (SeriesEntry entry : partition.getEntries()) {
                series.add(new Series(entry.key(), index, entry.values()));
            }
            return series;
        });

        TimeSeriesTableBuilder builder = TimeSeriesTable.builder(index);
        for (int i = 0; i < perPartition.size(); i++) {
            int partitionId = partitions.get(i).getId();
            for (Series s : perPartition.get(i)) {
                builder.add(s, partitionId);
            }
        }
        TimeSeriesTable table = builder.build();
        log.debug("Collected {} series from {} partitions", table.size(), partitions.size());
        return table;
    }

    /**
     * Keeps only the entries whose key satisfies the predicate. The index is unchanged.
     */
    public DistributedSeriesCollection filter(Predicate<String> keyPredicate) {
        if (keyPredicate == null) {
            throw new IllegalArgumentException("Predicate cannot be null");
        }
        List<SeriesPartition> filtered = substrate.runPerPartition(partitions, (id, partition) ->
                new SeriesPartition(partition.getId(), partition.getEntries().stream()
                        .filter(entry -> keyPredicate.test(entry.key()))
                        .toList()));
        return new DistributedSeriesCollection(index, filtered, substrate);
    }

    /**
     * Applies {@code fn} to every vector. The function receives a copy and must return a vector of
     * the index length.
     *
     * @throws LengthMismatchException if {@code fn} changes the length of a vector
     */
    public DistributedSeriesCollection mapSeries(UnaryOperator<double[]> fn) {
        if (fn == null) {
            throw new IllegalArgumentException("Function cannot be null");
        }
        return mapSeriesWithKey(index, (key, values) -> fn.apply(values));
    }

    public DistributedSeriesCollection mapSeriesWithKey(BiFunction<String, double[], double[]> fn) {
        return mapSeriesWithKey(index, fn);
    }

    /**
     * Applies {@code fn} to every vector so that the results align with {@code newIndex}.
     */
    public DistributedSeriesCollection mapSeries(DateTimeIndex newIndex, UnaryOperator<double[]> fn) {
        if (fn == null) {
            throw new IllegalArgumentException("Function cannot be null");
        }
        return mapSeriesWithKey(newIndex, (key, values) -> fn.apply(values));
    }

    /**
     * Keeps the timestamps within [fromTms, toTms], both inclusive, in the index and every vector.
     */
    public DistributedSeriesCollection slice(long fromTms, long toTms) {
        DateTimeIndex sliced = index.sliceByTime(fromTms, toTms);
        int from = index.ceilingLoc(fromTms);
        int to = from + sliced.size();
        return mapSeries(sliced, values -> Arrays.copyOfRange(values, from, to));
    }

    /**
     * Differences each vector with the given lag; the first {@code lag} timestamps are dropped.
     */
    public DistributedSeriesCollection differences(int lag) {
        SeriesMath.checkLag(index.size(), lag);
        return mapSeries(index.slice(lag, index.size()), values -> SeriesMath.differences(values, lag));
    }

    /**
     * Quotients each vector with the given lag; the first {@code lag} timestamps are dropped.
     */
    public DistributedSeriesCollection quotients(int lag) {
        SeriesMath.checkLag(index.size(), lag);
        return mapSeries(index.slice(lag, index.size()), values -> SeriesMath.quotients(values, lag));
    }

    public long count() {
        return substrate.runPerPartition(partitions, (id, partition) -> (long) partition.size())
                .stream()
                .mapToLong(Long::longValue)
                .sum();
    }

    /**
     * Every key of the collection.
     *
     * @throws DuplicateKeyException if a key occurs more than once
     */
    public Set<String> keys() {
        List<List<String>> perPartition = substrate.runPerPartition(partitions, (id, partition) ->
                partition.getEntries().stream().map(SeriesEntry::key).toList());

        Map<String, Integer> origins = new HashMap<>();
        Set<String> keys = new LinkedHashSet<>();
        for (int i = 0; i < perPartition.size(); i++) {
            int partitionId = partitions.get(i).getId();
            for (String key : perPartition.get(i)) {
                Integer first = origins.putIfAbsent(key, partitionId);
                if (first != null) {
                    throw new DuplicateKeyException(key, first, partitionId);
                }
                keys.add(key);
            }
        }
        return Collections.unmodifiableSet(keys);
    }

    /**
     * Looks a series up by key without collecting the whole collection.
     */
    public Optional<Series> findSeries(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        List<List<SeriesEntry>> perPartition = substrate.runPerPartition(partitions, (id, partition) ->
                partition.getEntries().stream().filter(entry -> entry.key().equals(key)).toList());

        Series found = null;
        int foundIn = -1;
        for (int i = 0; i < perPartition.size(); i++) {
            int partitionId = partitions.get(i).getId();
            for (SeriesEntry entry : perPartition.get(i)) {
                if (found != null) {
                    throw new DuplicateKeyException(key, foundIn, partitionId);
                }
                found = new Series(key, index, entry.values());
                foundIn = partitionId;
            }
        }
        return Optional.ofNullable(found);
    }

    private DistributedSeriesCollection mapSeriesWithKey(DateTimeIndex newIndex,
                                                         BiFunction<String, double[], double[]> fn) {
        if (newIndex == null || fn == null) {
            throw new IllegalArgumentException("Index and function cannot be null");
        }
        int expected = newIndex.size();
        List<SeriesPartition> mapped = substrate.runPerPartition(partitions, (id, partition) -> {
            List<SeriesEntry> out = new ArrayList<>(partition.size());
            for (SeriesEntry entry : partition.getEntries()) {
                double[] result = fn.apply(entry.key(), entry.values());
                if (result == null) {
                    throw new LengthMismatchException(entry.key(), expected, 0);
                }
                if (result.length != expected) {
                    throw new LengthMismatchException(entry.key(), expected, result.length);
                }
                out.add(new SeriesEntry(entry.key(), result));
            }
            return new SeriesPartition(partition.getId(), out);
        });
        return new DistributedSeriesCollection(newIndex, mapped, substrate);
    }

    private static void checkLengths(List<SeriesEntry> entries, int expected) {
        if (entries == null) {
            throw new IllegalArgumentException("Partition entries cannot be null");
        }
        for (SeriesEntry entry : entries) {
            if (entry.size() != expected) {
                throw new LengthMismatchException(entry.key(), expected, entry.size());
            }
        }
    }

    private static void requireContext(DateTimeIndex index, CollectionSubstrate substrate) {
        if (index == null) {
            throw new IllegalArgumentException("Index cannot be null");
        }
        if (substrate == null) {
            throw new IllegalArgumentException("Substrate cannot be null");
        }
    }

    @Override
    public String toString() {
        return "DistributedSeriesCollection[partitions=%d, %s]".formatted(partitions.size(), index);
    }
}
