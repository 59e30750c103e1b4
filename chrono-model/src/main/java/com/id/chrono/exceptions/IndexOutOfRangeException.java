package com.id.chrono.exceptions;

import lombok.Getter;

@Getter
public class IndexOutOfRangeException extends ChronoException {

    private final int position;
    private final int size;

    public IndexOutOfRangeException(int position, int size) {
        super("Position %d is outside [0, %d)".formatted(position, size));
        this.position = position;
        this.size = size;
    }

    public IndexOutOfRangeException(int fromPosition, int toPosition, int size) {
        super("Range [%d, %d) is outside [0, %d]".formatted(fromPosition, toPosition, size));
        this.position = fromPosition < 0 || fromPosition > size ? fromPosition : toPosition;
        this.size = size;
    }
}
