package com.id.chrono.modules.collection.substrate;

/**
 * Work run once per partition by a {@link CollectionSubstrate}.
 *
 * @param <T> partition type
 * @param <R> per-partition result type
 */
@FunctionalInterface
public interface PartitionTask<T, R> {

    R apply(int partitionId, T partition) throws Exception;
}
