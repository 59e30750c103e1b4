package com.id.chrono.modules.collection.substrate;

import com.id.chrono.exceptions.InvalidRangeException;
import com.id.chrono.exceptions.PartitionFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorCollectionSubstrateTest {

    private ExecutorCollectionSubstrate substrate;

    @BeforeEach
    void setUp() {
        substrate = new ExecutorCollectionSubstrate(4, 2_000L);
    }

    @AfterEach
    void tearDown() {
        substrate.close();
    }

    @Test
    void resultsComeBackInPartitionOrder() {
        List<Integer> partitions = IntStream.range(0, 50).boxed().toList();
        List<String> results = substrate.runPerPartition(partitions, (id, p) -> {
            Thread.sleep((50 - p) % 7);
            return id + ":" + p;
        });
        assertEquals(50, results.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(i + ":" + i, results.get(i));
        }
    }

    @Test
    void partitionsRunInParallel() throws Exception {
        CountDownLatch allStarted = new CountDownLatch(4);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        List<Boolean> results = substrate.runPerPartition(List.of(1, 2, 3, 4), (id, p) -> {
            threads.add(Thread.currentThread().getName());
            allStarted.countDown();
            return allStarted.await(1, TimeUnit.SECONDS);
        });
        assertEquals(List.of(true, true, true, true), results);
        assertEquals(4, threads.size());
        assertTrue(threads.stream().allMatch(name -> name.startsWith("chrono-collect-")));
    }

    @Test
    void emptyPartitionListGivesEmptyResult() {
        assertTrue(substrate.runPerPartition(List.<Integer>of(), (id, p) -> p).isEmpty());
    }

    @Test
    void firstFailureAbortsWithoutWaitingForSlowPartitions() {
        long start = System.currentTimeMillis();
        PartitionFailureException ex = assertThrows(PartitionFailureException.class, () ->
                substrate.runPerPartition(List.of(0, 1, 2), (id, p) -> {
                    if (p == 1) {
                        throw new IOException("disk gone");
                    }
                    Thread.sleep(1_500L);
                    return p;
                }));
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(1, ex.getPartition());
        assertInstanceOf(IOException.class, ex.getCause());
        assertTrue(ex.getMessage().contains("disk gone"));
        assertTrue(elapsed < 1_000L, "Expected fail-fast, took " + elapsed + " ms");
    }

    @Test
    void chronoExceptionsPassThroughUnchanged() {
        InvalidRangeException original = new InvalidRangeException("bad range");
        InvalidRangeException thrown = assertThrows(InvalidRangeException.class, () ->
                substrate.runPerPartition(List.of(0, 1), (id, p) -> {
                    if (p == 0) {
                        throw original;
                    }
                    return p;
                }));
        assertSame(original, thrown);
    }

    @Test
    void slowPartitionsTimeOut() {
        try (ExecutorCollectionSubstrate quick = new ExecutorCollectionSubstrate(2, 100L)) {
            PartitionFailureException ex = assertThrows(PartitionFailureException.class, () ->
                    quick.runPerPartition(List.of(0, 1), (id, p) -> {
                        Thread.sleep(5_000L);
                        return p;
                    }));
            assertEquals(-1, ex.getPartition());
        }
    }

    @Test
    void invalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutorCollectionSubstrate(0, 100L));
        assertThrows(IllegalArgumentException.class, () -> new ExecutorCollectionSubstrate(1, 0L));
    }
}
