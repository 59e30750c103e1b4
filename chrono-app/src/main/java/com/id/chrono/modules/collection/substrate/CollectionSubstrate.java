package com.id.chrono.modules.collection.substrate;

import java.util.List;

/**
 * Execution seam for partitioned work. Implementations decide where partition tasks run; the
 * engine only relies on the contract below.
 * <ul>
 *     <li>the task runs exactly once per partition, partitions share no mutable state</li>
 *     <li>the call returns only once every partition has completed, results in partition order</li>
 *     <li>on the first failure the remaining work is abandoned and that failure is thrown;
 *     {@link com.id.chrono.exceptions.ChronoException}s pass through unchanged, anything else is
 *     wrapped in a {@link com.id.chrono.exceptions.PartitionFailureException}</li>
 * </ul>
 */
public interface CollectionSubstrate extends AutoCloseable {

    <T, R> List<R> runPerPartition(List<T> partitions, PartitionTask<T, R> task);

    @Override
    default void close() {
    }
}
