package com.id.chrono.exceptions;

public class InvalidRangeException extends ChronoException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
