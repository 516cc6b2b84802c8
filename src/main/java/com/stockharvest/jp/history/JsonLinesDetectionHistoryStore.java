package com.stockharvest.jp.history;

import com.stockharvest.jp.model.DetectionType;
import com.stockharvest.jp.model.HistoryRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * File-backed history: one JSON object per line, replayed into an in-memory ring on open.
 * Retention matches {@link InMemoryDetectionHistoryStore}; the file itself keeps every line.
 */
public final class JsonLinesDetectionHistoryStore implements DetectionHistoryStore {
    private static final Logger LOG = LogManager.getLogger(JsonLinesDetectionHistoryStore.class);

    private final Path file;
    private final InMemoryDetectionHistoryStore delegate;
    private final Object writeLock = new Object();

    private JsonLinesDetectionHistoryStore(Path file, int capacity) {
        this.file = file;
        this.delegate = new InMemoryDetectionHistoryStore(capacity);
    }

    public static JsonLinesDetectionHistoryStore open(Path file, int capacity) throws IOException {
        JsonLinesDetectionHistoryStore store = new JsonLinesDetectionHistoryStore(file, capacity);
        store.replay();
        return store;
    }

    @Override
    public List<HistoryRecord> query(String symbol, Instant since, DetectionType type) {
        return delegate.query(symbol, since, type);
    }

    @Override
    public void record(String symbol, HistoryRecord record) {
        if (symbol == null || record == null) {
            throw new IllegalArgumentException("symbol and record are required");
        }
        String line = toJson(symbol, record).toString();
        synchronized (writeLock) {
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            } catch (IOException e) {
                throw new UncheckedIOException("failed to append history to " + file, e);
            }
            delegate.record(symbol, record);
        }
    }

    private void replay() throws IOException {
        if (!Files.exists(file)) {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return;
        }
        int lineNo = 0;
        int skipped = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                HistoryRecord record = fromJson(new JSONObject(line));
                delegate.record(record.symbol, record);
            } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
                skipped++;
                LOG.warn("history line {} in {} ignored: {}", lineNo, file, e.getMessage());
            }
        }
        LOG.info("history replayed from {}: lines={}, skipped={}", file, lineNo, skipped);
    }

    static JSONObject toJson(String symbol, HistoryRecord record) {
        JSONObject json = new JSONObject();
        json.put("symbol", symbol);
        json.put("type", record.detectionType.name());
        json.put("timestamp", record.timestamp.toString());
        json.put("price", record.price);
        json.put("change_rate", record.changeRate);
        json.put("volume", record.volume);
        json.put("summary", record.summary);
        return json;
    }

    static HistoryRecord fromJson(JSONObject json) {
        return new HistoryRecord(
                json.getString("symbol"),
                DetectionType.valueOf(json.getString("type")),
                Instant.parse(json.getString("timestamp")),
                json.optDouble("price", 0.0),
                json.optDouble("change_rate", 0.0),
                json.optLong("volume", 0L),
                json.optString("summary", "")
        );
    }
}
