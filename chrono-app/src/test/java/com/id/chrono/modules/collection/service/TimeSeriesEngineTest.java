package com.id.chrono.modules.collection.service;

import com.id.chrono.modules.collection.model.DistributedSeriesCollection;
import com.id.chrono.modules.frequency.model.Frequency;
import com.id.chrono.modules.frequency.model.enums.FrequencyUnit;
import com.id.chrono.modules.index.model.DateTimeIndex;
import com.id.chrono.modules.series.model.TimeSeriesTable;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class TimeSeriesEngineTest {

    @Autowired
    private TimeSeriesEngine engine;

    @Test
    void buildsFrequenciesAndIndexes() {
        assertEquals(Frequency.days(2), engine.dayFrequency(2));
        assertEquals(Frequency.of(FrequencyUnit.HOUR, 1), engine.frequency(FrequencyUnit.HOUR, 1));

        Instant start = Instant.parse("2024-03-01T00:00:00Z");
        DateTimeIndex uniform = engine.uniform(start, 4, engine.dayFrequency(1));
        DateTimeIndex irregular = engine.irregular(List.of(start, start.plusSeconds(86_400)));
        assertEquals(4, uniform.size());
        assertEquals(uniform.slice(0, 2), irregular);
    }

    @Test
    void collectsThroughTheConfiguredSubstrate() {
        DateTimeIndex index = engine.uniform(Instant.parse("2024-01-01T00:00:00Z"), 3, engine.dayFrequency(1));
        DistributedSeriesCollection collection = engine.timeSeriesCollection(index, List.of(
                Map.of("x", new double[]{1, 2, 3}),
                Map.of("y", new double[]{4, 5, 6})));

        TimeSeriesTable table = engine.collectAsTimeSeries(collection);
        assertEquals(Set.of("x", "y"), table.keys());
        assertArrayEquals(new double[]{4, 5, 6}, table.get("y").orElseThrow().toArray());
    }

    @Test
    void nullCollectionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> engine.collectAsTimeSeries(null));
    }
}
