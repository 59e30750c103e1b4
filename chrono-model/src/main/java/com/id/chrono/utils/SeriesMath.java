package com.id.chrono.utils;

import com.id.chrono.exceptions.InvalidRangeException;

import java.util.Arrays;

/**
 * Vector arithmetic shared by tables and collections. Results of {@code differences},
 * {@code quotients} and {@code price2ret} are shorter than the input by {@code lag}.
 */
public final class SeriesMath {

    private SeriesMath() {
    }

    public static double[] differences(double[] values, int lag) {
        checkLag(values.length, lag);
        double[] out = new double[values.length - lag];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i + lag] - values[i];
        }
        return out;
    }

    public static double[] quotients(double[] values, int lag) {
        checkLag(values.length, lag);
        double[] out = new double[values.length - lag];
        for (int i = 0; i < out.length; i++) {
            out[i] = values[i + lag] / values[i];
        }
        return out;
    }

    /**
     * Periodic (not continuously compounded) returns.
     */
    public static double[] price2ret(double[] values, int lag) {
        double[] out = quotients(values, lag);
        for (int i = 0; i < out.length; i++) {
            out[i] -= 1.0;
        }
        return out;
    }

    /**
     * The values trimmed so that position i of the result holds the value {@code lag} steps
     * before position {@code i + maxLag} of the input.
     */
    public static double[] lagTrimmed(double[] values, int lag, int maxLag) {
        return Arrays.copyOfRange(values, maxLag - lag, values.length - lag);
    }

    public static void checkLag(int size, int lag) {
        if (lag < 1) {
            throw new InvalidRangeException("Lag must be >= 1, got: " + lag);
        }
        if (lag > size) {
            throw new InvalidRangeException("Lag %d exceeds series length %d".formatted(lag, size));
        }
    }
}
