package com.id.chrono.exceptions;

import lombok.Getter;

@Getter
public class UnsortedIndexException extends ChronoException {

    private final int position;
    private final long previousTms;
    private final long tms;

    public UnsortedIndexException(int position, long previousTms, long tms) {
        super("Timestamps must be strictly increasing: position %d holds %d after %d"
                .formatted(position, tms, previousTms));
        this.position = position;
        this.previousTms = previousTms;
        this.tms = tms;
    }
}
