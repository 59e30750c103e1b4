package com.id.chrono.modules.collection.substrate;

import com.id.chrono.exceptions.PartitionFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one task per partition on a fixed thread pool and joins them. The first partition to fail
 * aborts the whole call: pending tasks are cancelled and no partial result is returned.
 */
@Slf4j
public class ExecutorCollectionSubstrate implements CollectionSubstrate {

    private final ExecutorService executor;
    private final long timeoutMs;

    public ExecutorCollectionSubstrate(int workerThreads, long timeoutMs) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("Worker threads must be >= 1, got: " + workerThreads);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Timeout must be > 0, got: " + timeoutMs);
        }
        this.executor = Executors.newFixedThreadPool(workerThreads, namedThreads());
        this.timeoutMs = timeoutMs;
        log.info("Collection substrate started. workerThreads={}, timeoutMs={}", workerThreads, timeoutMs);
    }

    @Override
    public <T, R> List<R> runPerPartition(List<T> partitions, PartitionTask<T, R> task) {
        if (partitions == null || task == null) {
            throw new IllegalArgumentException("Partitions and task cannot be null");
        }
        if (partitions.isEmpty()) {
            return List.of();
        }

        // Completes exceptionally with whichever partition fails first
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();
        List<CompletableFuture<R>> tasks = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
            int partitionId = i;
            T partition = partitions.get(i);
            CompletableFuture<R> future = CompletableFuture.supplyAsync(
                    () -> PartitionTasks.run(task, partitionId, partition), executor);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    firstFailure.completeExceptionally(ex);
                }
            });
            tasks.add(future);
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));
        try {
            CompletableFuture.anyOf(all, firstFailure).get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            cancel(tasks);
            RuntimeException failure = PartitionTasks.unwrap(e);
            log.error("Partition processing failed: {}", failure.getMessage());
            throw failure;
        } catch (TimeoutException e) {
            cancel(tasks);
            log.error("Partition processing did not complete within {} ms", timeoutMs);
            throw new PartitionFailureException(-1, "Partitions did not complete within %d ms".formatted(timeoutMs), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(tasks);
            throw new PartitionFailureException(-1, "Interrupted while waiting for partitions", e);
        }

        return tasks.stream().map(CompletableFuture::join).toList();
    }

    @Override
    public void close() {
        log.info("Shutting down collection substrate");
        executor.shutdownNow();
    }

    private static void cancel(List<? extends CompletableFuture<?>> tasks) {
        tasks.forEach(t -> t.cancel(true));
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "chrono-collect-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
