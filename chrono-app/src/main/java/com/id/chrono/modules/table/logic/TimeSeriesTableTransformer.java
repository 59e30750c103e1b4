package com.id.chrono.modules.table.logic;

import com.id.chrono.exceptions.InvalidRangeException;
import com.id.chrono.exceptions.LengthMismatchException;
import com.id.chrono.modules.index.model.DateTimeIndex;
import com.id.chrono.modules.series.model.Series;
import com.id.chrono.modules.series.model.TimeSeriesTable;
import com.id.chrono.utils.SeriesMath;
import com.id.chrono.utils.TimeSeriesTableBuilder;

import java.util.Arrays;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Local transformations over a collected {@link TimeSeriesTable}. Every operation returns a new
 * table.
 */
public class TimeSeriesTableTransformer {

    private final TimeSeriesTable table;

    private TimeSeriesTableTransformer(TimeSeriesTable table) {
        this.table = table;
    }

    public static TimeSeriesTableTransformer from(TimeSeriesTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Table cannot be null");
        }
        return new TimeSeriesTableTransformer(table);
    }

    /**
     * Lags every series by 1..maxLag steps. The first {@code maxLag} timestamps are dropped.
     * <p>
     * With maxLag 2, series {@code a = [1, 2, 3, 4, 5]} gives {@code a = [3, 4, 5]} (when
     * originals are kept), {@code lag1(a) = [2, 3, 4]} and {@code lag2(a) = [1, 2, 3]}.
     *
     * @param maxLag           - Largest lag to produce
     * @param includeOriginals - Whether to keep the unlagged series
     */
    public TimeSeriesTable lags(int maxLag, boolean includeOriginals) {
        DateTimeIndex index = table.getIndex();
        if (maxLag < 0 || maxLag > index.size()) {
            throw new InvalidRangeException("Max lag must be within [0, %d], got: %d".formatted(index.size(), maxLag));
        }
        DateTimeIndex lagged = index.slice(maxLag, index.size());
        TimeSeriesTableBuilder builder = TimeSeriesTable.builder(lagged);
        for (Series s : table.series().values()) {
            double[] values = s.toArray();
            if (includeOriginals) {
                builder.add(s.getKey(), Arrays.copyOfRange(values, maxLag, values.length));
            }
            for (int lag = 1; lag <= maxLag; lag++) {
                builder.add("lag%d(%s)".formatted(lag, s.getKey()), SeriesMath.lagTrimmed(values, lag, maxLag));
            }
        }
        return builder.build();
    }

    /**
     * Positions [fromPos, toPos) of the index and every series.
     */
    public TimeSeriesTable slice(int fromPos, int toPos) {
        DateTimeIndex sliced = table.getIndex().slice(fromPos, toPos);
        return mapSeries(sliced, values -> Arrays.copyOfRange(values, fromPos, toPos));
    }

    /**
     * Adds one more series on the same index.
     *
     * @throws com.id.chrono.exceptions.DuplicateKeyException if the key is already present
     */
    public TimeSeriesTable union(String key, double[] values) {
        return TimeSeriesTable.builder(table.getIndex())
                .addTable(table)
                .add(key, values)
                .build();
    }

    public TimeSeriesTable differences(int lag) {
        DateTimeIndex index = table.getIndex();
        SeriesMath.checkLag(index.size(), lag);
        return mapSeries(index.slice(lag, index.size()), values -> SeriesMath.differences(values, lag));
    }

    public TimeSeriesTable differences() {
        return differences(1);
    }

    public TimeSeriesTable quotients(int lag) {
        DateTimeIndex index = table.getIndex();
        SeriesMath.checkLag(index.size(), lag);
        return mapSeries(index.slice(lag, index.size()), values -> SeriesMath.quotients(values, lag));
    }

    public TimeSeriesTable quotients() {
        return quotients(1);
    }

    /**
     * Periodic returns of every series; the first timestamp is dropped.
     */
    public TimeSeriesTable price2ret() {
        DateTimeIndex index = table.getIndex();
        SeriesMath.checkLag(index.size(), 1);
        return mapSeries(index.slice(1, index.size()), values -> SeriesMath.price2ret(values, 1));
    }

    public TimeSeriesTable mapSeries(UnaryOperator<double[]> fn) {
        return mapSeries(table.getIndex(), fn);
    }

    /**
     * Applies {@code fn} to every series so that the results align with {@code newIndex}.
     *
     * @throws LengthMismatchException if a result does not match the new index length
     */
    public TimeSeriesTable mapSeries(DateTimeIndex newIndex, UnaryOperator<double[]> fn) {
        if (fn == null) {
            throw new IllegalArgumentException("Function cannot be null");
        }
        return mapSeriesWithKey(newIndex, (key, values) -> fn.apply(values));
    }

    public TimeSeriesTable mapSeriesWithKey(BiFunction<String, double[], double[]> fn) {
        return mapSeriesWithKey(table.getIndex(), fn);
    }

    private TimeSeriesTable mapSeriesWithKey(DateTimeIndex newIndex, BiFunction<String, double[], double[]> fn) {
        if (newIndex == null || fn == null) {
            throw new IllegalArgumentException("Index and function cannot be null");
        }
        TimeSeriesTableBuilder builder = TimeSeriesTable.builder(newIndex);
        for (Map.Entry<String, Series> entry : table.series().entrySet()) {
            double[] result = fn.apply(entry.getKey(), entry.getValue().toArray());
            if (result == null) {
                throw new LengthMismatchException(entry.getKey(), newIndex.size(), 0);
            }
            builder.add(entry.getKey(), result);
        }
        return builder.build();
    }
}
