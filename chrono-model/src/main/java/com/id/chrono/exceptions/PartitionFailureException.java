package com.id.chrono.exceptions;

import lombok.Getter;

/**
 * Wraps a failure of one partition task. The partition id is -1 when the failure is not tied to
 * a single partition (timeout, interruption).
 */
@Getter
public class PartitionFailureException extends ChronoException {

    private final int partition;

    public PartitionFailureException(int partition, String message, Throwable cause) {
        super(message, cause);
        this.partition = partition;
    }
}
