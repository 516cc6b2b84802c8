package com.stockharvest.jp.history;

import com.stockharvest.jp.model.DetectionType;
import com.stockharvest.jp.model.HistoryRecord;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonLinesDetectionHistoryStoreTest {
    private static final Instant TS = Instant.parse("2026-03-10T06:00:00Z");

    @Test
    void record_shouldSurviveReopen(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("state").resolve("history.jsonl");
        JsonLinesDetectionHistoryStore store = JsonLinesDetectionHistoryStore.open(file, 50);
        store.record("4480", new HistoryRecord("4480", DetectionType.PATTERN_A, TS, 1500.0, 20.0, 25_000_000L, "sticking"));

        JsonLinesDetectionHistoryStore reopened = JsonLinesDetectionHistoryStore.open(file, 50);
        List<HistoryRecord> records = reopened.query("4480", null, DetectionType.PATTERN_A);

        assertEquals(1, records.size());
        assertEquals(TS, records.get(0).timestamp);
        assertEquals(25_000_000L, records.get(0).volume);
        assertEquals("sticking", records.get(0).summary);
        assertEquals(1, Files.readAllLines(file, StandardCharsets.UTF_8).size());
    }

    @Test
    void open_shouldSkipMalformedLines(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("history.jsonl");
        String good = JsonLinesDetectionHistoryStore.toJson("3692",
                new HistoryRecord("3692", DetectionType.PATTERN_B, TS, 890.0, 2.8, 12_000_000L, "turnaround")).toString();
        Files.writeString(file, "not json\n\n" + good + "\n{\"symbol\":\"3692\",\"type\":\"UNKNOWN\"}\n", StandardCharsets.UTF_8);

        JsonLinesDetectionHistoryStore store = JsonLinesDetectionHistoryStore.open(file, 50);

        assertEquals(1, store.query("3692", null, null).size());
        assertTrue(store.contains("3692", DetectionType.PATTERN_B));
    }

    @Test
    void toJson_shouldUseSnakeCaseKeys() {
        JSONObject json = JsonLinesDetectionHistoryStore.toJson("4480",
                new HistoryRecord("4480", DetectionType.STOP_HIGH, TS, 1500.0, 20.0, 25_000_000L, "session"));

        assertEquals("STOP_HIGH", json.getString("type"));
        assertEquals(20.0, json.getDouble("change_rate"), 1e-9);
        assertEquals("2026-03-10T06:00:00Z", json.getString("timestamp"));
    }
}
