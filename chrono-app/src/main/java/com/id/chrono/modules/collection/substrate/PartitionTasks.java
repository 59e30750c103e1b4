package com.id.chrono.modules.collection.substrate;

import com.id.chrono.exceptions.ChronoException;
import com.id.chrono.exceptions.PartitionFailureException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class PartitionTasks {

    private PartitionTasks() {
    }

    static <T, R> R run(PartitionTask<T, R> task, int partitionId, T partition) {
        try {
            return task.apply(partitionId, partition);
        } catch (ChronoException e) {
            throw e;
        } catch (Exception e) {
            throw new PartitionFailureException(partitionId,
                    "Partition %d failed: %s".formatted(partitionId, e.getMessage()), e);
        }
    }

    /**
     * Strips the wrappers added by futures and returns the exception to rethrow.
     */
    static RuntimeException unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ChronoException chronoException) {
            return chronoException;
        }
        return new PartitionFailureException(-1, "Partition task failed: " + cause.getMessage(), cause);
    }
}
