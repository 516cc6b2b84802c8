package com.stockharvest.jp.model;

import java.time.Instant;

/**
 * Append-only detection history entry with a digest of the snapshot that produced it.
 */
public final class HistoryRecord {
    public final String symbol;
    public final DetectionType detectionType;
    public final Instant timestamp;
    public final double price;
    public final double changeRate;
    public final long volume;
    public final String summary;

    public HistoryRecord(
            String symbol,
            DetectionType detectionType,
            Instant timestamp,
            double price,
            double changeRate,
            long volume,
            String summary
    ) {
        this.symbol = symbol;
        this.detectionType = detectionType;
        this.timestamp = timestamp;
        this.price = price;
        this.changeRate = changeRate;
        this.volume = volume;
        this.summary = summary == null ? "" : summary;
    }

    public static HistoryRecord of(StockSnapshot snapshot, DetectionType type, Instant timestamp, String summary) {
        return new HistoryRecord(snapshot.symbol, type, timestamp, snapshot.price, snapshot.changeRate, snapshot.volume, summary);
    }
}
