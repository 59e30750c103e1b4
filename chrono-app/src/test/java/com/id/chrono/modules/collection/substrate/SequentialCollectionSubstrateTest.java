package com.id.chrono.modules.collection.substrate;

import com.id.chrono.exceptions.PartitionFailureException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequentialCollectionSubstrateTest {

    private final SequentialCollectionSubstrate substrate = new SequentialCollectionSubstrate();

    @Test
    void runsInCallingThreadInOrder() {
        String caller = Thread.currentThread().getName();
        List<String> results = substrate.runPerPartition(List.of("a", "b", "c"), (id, p) -> {
            assertEquals(caller, Thread.currentThread().getName());
            return p + id;
        });
        assertEquals(List.of("a0", "b1", "c2"), results);
    }

    @Test
    void stopsAtFirstFailure() {
        List<Integer> seen = new ArrayList<>();
        PartitionFailureException ex = assertThrows(PartitionFailureException.class, () ->
                substrate.runPerPartition(List.of(0, 1, 2), (id, p) -> {
                    seen.add(p);
                    if (p == 1) {
                        throw new IllegalStateException("boom");
                    }
                    return p;
                }));
        assertEquals(1, ex.getPartition());
        assertEquals(List.of(0, 1), seen);
    }

    @Test
    void nullArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> substrate.runPerPartition(null, (id, p) -> p));
    }
}
