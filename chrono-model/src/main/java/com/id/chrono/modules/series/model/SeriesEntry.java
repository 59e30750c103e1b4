package com.id.chrono.modules.series.model;

/**
 * A raw (key, values) pair as held by a partition, before it is bound to an index.
 */
public record SeriesEntry(String key, double[] values) {

    public SeriesEntry {
        if (key == null) {
            throw new IllegalArgumentException("Series key cannot be null");
        }
        if (values == null) {
            throw new IllegalArgumentException("Values cannot be null for key: " + key);
        }
        values = values.clone();
    }

    /**
     * A copy of the values; the entry itself never changes.
     */
    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }
}
