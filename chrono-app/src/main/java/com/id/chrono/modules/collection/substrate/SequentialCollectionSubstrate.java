package com.id.chrono.modules.collection.substrate;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every partition in the calling thread, in partition order.
 */
@Slf4j
public class SequentialCollectionSubstrate implements CollectionSubstrate {

    @Override
    public <T, R> List<R> runPerPartition(List<T> partitions, PartitionTask<T, R> task) {
        if (partitions == null || task == null) {
            throw new IllegalArgumentException("Partitions and task cannot be null");
        }
        List<R> results = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
            results.add(PartitionTasks.run(task, i, partitions.get(i)));
        }
        log.trace("Ran {} partitions sequentially", partitions.size());
        return results;
    }
}
