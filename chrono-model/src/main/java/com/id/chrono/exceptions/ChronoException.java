package com.id.chrono.exceptions;

/**
 * Base type of every failure raised by the indexing and collection engine.
 */
public class ChronoException extends RuntimeException {

    public ChronoException(String message) {
        super(message);
    }

    public ChronoException(String message, Throwable cause) {
        super(message, cause);
    }
}
