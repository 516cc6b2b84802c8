package com.stockharvest.jp.history;

import com.stockharvest.jp.model.DetectionType;
import com.stockharvest.jp.model.HistoryRecord;

import java.time.Instant;
import java.util.List;

/**
 * Per-symbol append-only detection history used for deduplication.
 */
public interface DetectionHistoryStore {

    /**
     * Records for {@code symbol} at or after {@code since}, oldest first.
     *
     * @param since lower bound, or null for the whole retained history
     * @param type  detection type to keep, or null for every type
     */
    List<HistoryRecord> query(String symbol, Instant since, DetectionType type);

    void record(String symbol, HistoryRecord record);

    default boolean contains(String symbol, DetectionType type) {
        return !query(symbol, null, type).isEmpty();
    }
}
