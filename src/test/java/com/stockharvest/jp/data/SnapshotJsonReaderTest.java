package com.stockharvest.jp.data;

import com.stockharvest.jp.model.SnapshotFixtures;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TrendDirection;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotJsonReaderTest {
    private final SnapshotJsonReader reader = new SnapshotJsonReader();

    @Test
    void readAll_shouldParseFeedArray() {
        String json = "[{\"code\":\"4480\",\"name\":\"Medley\",\"price\":1500,\"change\":250,\"changeRate\":20.0,"
                + "\"volume\":25000000,\"lowerShadowRatio\":0.03,\"newlyListed\":true,\"withinEarningsWindow\":true,"
                + "\"listingDate\":\"2025-06-01\","
                + "\"signals\":{\"rsi\":65,\"macd\":1.2,\"bollingerPosition\":0.8,\"volumeRatio\":1.8,\"trendDirection\":\"up\"}},"
                + "{\"symbol\":\"3692\",\"name\":\"FFRI\",\"price\":890,\"changeRate\":2.8,\"volume\":12000000,"
                + "\"earnings\":[{\"quarterEnd\":\"2025-12-31\",\"operatingIncome\":5e7},{\"quarterEnd\":\"2025-09-30\",\"operatingIncome\":-3e7}],"
                + "\"bars\":[{\"date\":\"2026-03-09\",\"open\":860,\"high\":870,\"low\":855,\"close\":865.76,\"volume\":9000000}],"
                + "\"observedAt\":\"2026-03-10T05:00:00Z\"}]";

        List<StockSnapshot> snapshots = reader.readAll(json, SnapshotFixtures.NOW);

        assertEquals(2, snapshots.size());
        StockSnapshot medley = snapshots.get(0);
        assertEquals("4480", medley.symbol);
        assertEquals(0.03, medley.lowerShadowRatio, 1e-9);
        assertEquals(LocalDate.of(2025, 6, 1), medley.listingDate);
        assertEquals(TrendDirection.UP, medley.indicators.trendDirection);
        assertEquals(65.0, medley.indicators.rsi, 1e-9);
        assertEquals(SnapshotFixtures.NOW, medley.observedAt);
        assertNull(medley.open);

        StockSnapshot ffri = snapshots.get(1);
        assertNull(ffri.indicators);
        assertEquals(2, ffri.earnings.size());
        assertEquals(-3e7, ffri.earnings.get(1).operatingIncome, 1e-3);
        assertEquals(865.76, ffri.bars.get(0).close, 1e-9);
        assertEquals(Instant.parse("2026-03-10T05:00:00Z"), ffri.observedAt);
    }

    @Test
    void readAll_shouldAcceptSingleObjectAndBlankInput() {
        assertEquals(1, reader.readAll("{\"symbol\":\"9999\",\"name\":\"Quiet\",\"price\":1000}", SnapshotFixtures.NOW).size());
        assertTrue(reader.readAll("  ", SnapshotFixtures.NOW).isEmpty());
    }

    @Test
    void readAll_shouldRejectMalformedJson() {
        assertThrows(IllegalArgumentException.class, () -> reader.readAll("[{\"symbol\":", SnapshotFixtures.NOW));
    }

    @Test
    void read_shouldRejectBadDates() {
        assertThrows(IllegalArgumentException.class,
                () -> reader.readAll("{\"symbol\":\"1\",\"listingDate\":\"June 2025\"}", SnapshotFixtures.NOW));
    }
}
