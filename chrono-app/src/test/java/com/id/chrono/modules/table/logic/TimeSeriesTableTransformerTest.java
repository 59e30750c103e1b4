package com.id.chrono.modules.table.logic;

import com.id.chrono.exceptions.DuplicateKeyException;
import com.id.chrono.exceptions.IndexOutOfRangeException;
import com.id.chrono.exceptions.InvalidRangeException;
import com.id.chrono.exceptions.LengthMismatchException;
import com.id.chrono.modules.frequency.model.Frequency;
import com.id.chrono.modules.index.model.DateTimeIndex;
import com.id.chrono.modules.series.model.TimeSeriesTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TimeSeriesTableTransformerTest {

    private static final long DAY = 86_400_000L;
    private static final long T0 = 1_704_067_200_000L;

    private TimeSeriesTable table;
    private TimeSeriesTableTransformer transformer;

    @BeforeEach
    void setup() {
        DateTimeIndex index = DateTimeIndex.uniform(T0, 5, Frequency.days(1));
        table = TimeSeriesTable.builder(index)
                .add("a", new double[]{1, 2, 3, 4, 5})
                .add("b", new double[]{2, 4, 8, 16, 32})
                .build();
        transformer = TimeSeriesTableTransformer.from(table);
    }

    @Test
    void lagsWithOriginals() {
        TimeSeriesTable lagged = transformer.lags(2, true);

        assertEquals(Set.of("a", "lag1(a)", "lag2(a)", "b", "lag1(b)", "lag2(b)"), lagged.keys());
        assertEquals(3, lagged.getIndex().size());
        assertEquals(T0 + 2 * DAY, lagged.getIndex().first());
        assertArrayEquals(new double[]{3, 4, 5}, lagged.get("a").orElseThrow().toArray());
        assertArrayEquals(new double[]{2, 3, 4}, lagged.get("lag1(a)").orElseThrow().toArray());
        assertArrayEquals(new double[]{1, 2, 3}, lagged.get("lag2(a)").orElseThrow().toArray());
    }

    @Test
    void lagsWithoutOriginals() {
        TimeSeriesTable lagged = transformer.lags(1, false);
        assertEquals(Set.of("lag1(a)", "lag1(b)"), lagged.keys());
        assertArrayEquals(new double[]{2, 4, 8, 16}, lagged.get("lag1(b)").orElseThrow().toArray());
        assertThrows(InvalidRangeException.class, () -> transformer.lags(6, true));
    }

    @Test
    void sliceByPosition() {
        TimeSeriesTable sliced = transformer.slice(1, 3);
        assertEquals(2, sliced.getIndex().size());
        assertArrayEquals(new double[]{4, 8}, sliced.get("b").orElseThrow().toArray());
        assertThrows(IndexOutOfRangeException.class, () -> transformer.slice(2, 9));
    }

    @Test
    void unionAddsSeries() {
        TimeSeriesTable extended = transformer.union("c", new double[]{0, 0, 0, 0, 1});
        assertEquals(3, extended.size());
        assertEquals(2, table.size());

        assertThrows(DuplicateKeyException.class, () -> transformer.union("a", new double[5]));
        assertThrows(LengthMismatchException.class, () -> transformer.union("d", new double[4]));
    }

    @Test
    void differencesQuotientsAndReturns() {
        assertArrayEquals(new double[]{1, 1, 1, 1}, transformer.differences().get("a").orElseThrow().toArray());
        assertArrayEquals(new double[]{2, 2, 2}, transformer.differences(2).get("a").orElseThrow().toArray());
        assertArrayEquals(new double[]{2, 2, 2, 2}, transformer.quotients().get("b").orElseThrow().toArray());
        assertArrayEquals(new double[]{4, 4, 4}, transformer.quotients(2).get("b").orElseThrow().toArray());
        assertArrayEquals(new double[]{1, 1, 1, 1}, transformer.price2ret().get("b").orElseThrow().toArray());
        assertEquals(T0 + DAY, transformer.price2ret().getIndex().first());
    }

    @Test
    void mapSeriesKeepsIndex() {
        TimeSeriesTable negated = transformer.mapSeries(values -> {
            for (int i = 0; i < values.length; i++) {
                values[i] = -values[i];
            }
            return values;
        });
        assertArrayEquals(new double[]{-1, -2, -3, -4, -5}, negated.get("a").orElseThrow().toArray());
        assertArrayEquals(new double[]{1, 2, 3, 4, 5}, table.get("a").orElseThrow().toArray());

        assertThrows(LengthMismatchException.class, () -> transformer.mapSeries(values -> new double[1]));
    }

    @Test
    void mapSeriesWithKey() {
        TimeSeriesTable mapped = transformer.mapSeriesWithKey((key, values) ->
                key.equals("a") ? new double[]{0, 0, 0, 0, 0} : values);
        assertArrayEquals(new double[]{0, 0, 0, 0, 0}, mapped.get("a").orElseThrow().toArray());
        assertArrayEquals(new double[]{2, 4, 8, 16, 32}, mapped.get("b").orElseThrow().toArray());
    }

    @Test
    void nullTableIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TimeSeriesTableTransformer.from(null));
    }
}
