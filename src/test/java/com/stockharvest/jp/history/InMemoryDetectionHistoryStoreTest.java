package com.stockharvest.jp.history;

import com.stockharvest.jp.model.DetectionType;
import com.stockharvest.jp.model.HistoryRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryDetectionHistoryStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-01T06:00:00Z");

    private static HistoryRecord record(String symbol, DetectionType type, int minutes) {
        return new HistoryRecord(symbol, type, T0.plusSeconds(minutes * 60L), 1000.0, 5.0, 1_000_000L, "n" + minutes);
    }

    @Test
    void record_shouldEvictOldestBeyondCapacity() {
        InMemoryDetectionHistoryStore store = new InMemoryDetectionHistoryStore();
        for (int i = 0; i < 55; i++) {
            store.record("7203", record("7203", DetectionType.STOP_HIGH, i));
        }

        List<HistoryRecord> all = store.query("7203", null, null);

        assertEquals(50, store.size("7203"));
        assertEquals(50, all.size());
        assertEquals("n5", all.get(0).summary);
        assertEquals("n54", all.get(49).summary);
    }

    @Test
    void query_shouldFilterBySinceAndType() {
        InMemoryDetectionHistoryStore store = new InMemoryDetectionHistoryStore(10);
        store.record("6758", record("6758", DetectionType.STOP_HIGH, 0));
        store.record("6758", record("6758", DetectionType.PATTERN_A, 10));
        store.record("6758", record("6758", DetectionType.STOP_HIGH, 20));

        assertEquals(2, store.query("6758", null, DetectionType.STOP_HIGH).size());
        assertEquals(1, store.query("6758", T0.plusSeconds(600), DetectionType.STOP_HIGH).size());
        assertEquals(2, store.query("6758", T0.plusSeconds(600), null).size());
        assertTrue(store.contains("6758", DetectionType.PATTERN_A));
        assertFalse(store.contains("6758", DetectionType.PATTERN_B));
        assertTrue(store.query("0000", null, null).isEmpty());
    }

    @Test
    void record_shouldKeepSymbolsApart() {
        InMemoryDetectionHistoryStore store = new InMemoryDetectionHistoryStore(2);
        store.record("A", record("A", DetectionType.STOP_HIGH, 0));
        store.record("B", record("B", DetectionType.STOP_HIGH, 0));
        store.record("B", record("B", DetectionType.STOP_HIGH, 1));
        store.record("B", record("B", DetectionType.STOP_HIGH, 2));

        assertEquals(1, store.size("A"));
        assertEquals(2, store.size("B"));
    }

    @Test
    void constructor_shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryDetectionHistoryStore(0));
    }

    @Test
    void record_shouldStayConsistentUnderConcurrentWriters() throws Exception {
        InMemoryDetectionHistoryStore store = new InMemoryDetectionHistoryStore(1_000);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 100; i++) {
                        store.record("9984", record("9984", DetectionType.STOP_HIGH, i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(800, store.size("9984"));
    }
}
