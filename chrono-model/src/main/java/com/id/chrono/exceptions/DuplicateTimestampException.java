package com.id.chrono.exceptions;

import lombok.Getter;

@Getter
public class DuplicateTimestampException extends ChronoException {

    private final long tms;
    private final int firstPosition;
    private final int secondPosition;

    public DuplicateTimestampException(long tms, int firstPosition, int secondPosition) {
        super("Timestamp %d appears at positions %d and %d".formatted(tms, firstPosition, secondPosition));
        this.tms = tms;
        this.firstPosition = firstPosition;
        this.secondPosition = secondPosition;
    }
}
