package com.stockharvest.jp.history;

import com.stockharvest.jp.model.DetectionType;
import com.stockharvest.jp.model.HistoryRecord;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-capacity ring per symbol; the oldest record is evicted once the ring is full.
 * All access goes through one lock.
 */
public final class InMemoryDetectionHistoryStore implements DetectionHistoryStore {
    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Object lock = new Object();
    private final Map<String, Deque<HistoryRecord>> bySymbol = new HashMap<>();

    public InMemoryDetectionHistoryStore() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryDetectionHistoryStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public List<HistoryRecord> query(String symbol, Instant since, DetectionType type) {
        if (symbol == null) {
            return List.of();
        }
        synchronized (lock) {
            Deque<HistoryRecord> ring = bySymbol.get(symbol);
            if (ring == null || ring.isEmpty()) {
                return List.of();
            }
            List<HistoryRecord> out = new ArrayList<>();
            for (HistoryRecord record : ring) {
                if (type != null && record.detectionType != type) {
                    continue;
                }
                if (since != null && record.timestamp != null && record.timestamp.isBefore(since)) {
                    continue;
                }
                out.add(record);
            }
            return out;
        }
    }

    @Override
    public void record(String symbol, HistoryRecord record) {
        if (symbol == null || record == null) {
            throw new IllegalArgumentException("symbol and record are required");
        }
        synchronized (lock) {
            Deque<HistoryRecord> ring = bySymbol.computeIfAbsent(symbol, key -> new ArrayDeque<>(capacity));
            while (ring.size() >= capacity) {
                ring.pollFirst();
            }
            ring.addLast(record);
        }
    }

    public int size(String symbol) {
        synchronized (lock) {
            Deque<HistoryRecord> ring = bySymbol.get(symbol);
            return ring == null ? 0 : ring.size();
        }
    }
}
