package com.id.chrono.exceptions;

import lombok.Getter;

@Getter
public class InvalidFrequencyException extends ChronoException {

    private final int step;

    public InvalidFrequencyException(String unit, int step) {
        super("Frequency step must be >= 1, got %d for unit %s".formatted(step, unit));
        this.step = step;
    }
}
