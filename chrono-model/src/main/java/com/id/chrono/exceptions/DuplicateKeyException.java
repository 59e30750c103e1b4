package com.id.chrono.exceptions;

import lombok.Getter;

/**
 * Raised when a series key occurs more than once across a collection. Partition ids are -1 when
 * the key did not come from a partition.
 */
@Getter
public class DuplicateKeyException extends ChronoException {

    private final String key;
    private final int firstPartition;
    private final int secondPartition;

    public DuplicateKeyException(String key, int firstPartition, int secondPartition) {
        super("Series key '%s' found in partition %d and partition %d".formatted(key, firstPartition, secondPartition));
        this.key = key;
        this.firstPartition = firstPartition;
        this.secondPartition = secondPartition;
    }

    public DuplicateKeyException(String key) {
        super("Series key '%s' is already present".formatted(key));
        this.key = key;
        this.firstPartition = -1;
        this.secondPartition = -1;
    }
}
