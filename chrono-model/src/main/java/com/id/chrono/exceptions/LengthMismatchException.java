package com.id.chrono.exceptions;

import lombok.Getter;

@Getter
public class LengthMismatchException extends ChronoException {

    private final String subject;
    private final int expected;
    private final int actual;

    public LengthMismatchException(String subject, int expected, int actual) {
        super("Length mismatch for '%s': expected %d, got %d".formatted(subject, expected, actual));
        this.subject = subject;
        this.expected = expected;
        this.actual = actual;
    }
}
