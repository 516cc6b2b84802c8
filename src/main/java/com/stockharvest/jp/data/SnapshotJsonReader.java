package com.stockharvest.jp.data;

import com.stockharvest.jp.model.DailyBar;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.QuarterlyEarnings;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TrendDirection;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads snapshots from the JSON shape the scan feed publishes: camelCase quote fields, an
 * optional {@code signals} object of precomputed indicators, optional {@code bars} (oldest
 * first) and {@code earnings} (newest first).
 */
public final class SnapshotJsonReader {

    public List<StockSnapshot> readAll(String json, Instant observedAt) {
        String trimmed = json == null ? "" : json.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        List<StockSnapshot> out = new ArrayList<>();
        try {
            if (trimmed.startsWith("[")) {
                JSONArray array = new JSONArray(trimmed);
                for (int i = 0; i < array.length(); i++) {
                    out.add(read(array.getJSONObject(i), observedAt));
                }
            } else {
                out.add(read(new JSONObject(trimmed), observedAt));
            }
        } catch (JSONException e) {
            throw new IllegalArgumentException("malformed snapshot JSON: " + e.getMessage(), e);
        }
        return out;
    }

    /**
     * @throws IllegalArgumentException when a field has the wrong type or a date cannot be parsed
     */
    public StockSnapshot read(JSONObject json, Instant observedAt) {
        try {
            return StockSnapshot.builder()
                    .symbol(json.has("symbol") ? json.optString("symbol") : json.optString("code"))
                    .name(json.optString("name"))
                    .price(json.optDouble("price", 0.0))
                    .change(json.optDouble("change", 0.0))
                    .changeRate(json.optDouble("changeRate", 0.0))
                    .volume(json.optLong("volume", 0L))
                    .open(optBoxed(json, "open"))
                    .high(optBoxed(json, "high"))
                    .low(optBoxed(json, "low"))
                    .previousClose(optBoxed(json, "previousClose"))
                    .lowerShadowRatio(optBoxed(json, "lowerShadowRatio"))
                    .newlyListed(json.optBoolean("newlyListed", false))
                    .listingDate(optDate(json, "listingDate"))
                    .withinEarningsWindow(json.optBoolean("withinEarningsWindow", false))
                    .indicators(json.has("signals") ? indicators(json.getJSONObject("signals")) : null)
                    .bars(bars(json.optJSONArray("bars")))
                    .earnings(earnings(json.optJSONArray("earnings")))
                    .observedAt(json.has("observedAt") ? Instant.parse(json.getString("observedAt")) : observedAt)
                    .build();
        } catch (JSONException | DateTimeParseException e) {
            throw new IllegalArgumentException("malformed snapshot " + json.optString("symbol", json.optString("code")) + ": " + e.getMessage(), e);
        }
    }

    static IndicatorSet indicators(JSONObject signals) {
        return new IndicatorSet(
                signals.optDouble("rsi", IndicatorSet.NEUTRAL_RSI),
                signals.optDouble("macd", 0.0),
                signals.optDouble("bollingerPosition", 0.0),
                signals.optDouble("volumeRatio", IndicatorSet.NEUTRAL_VOLUME_RATIO),
                TrendDirection.parse(signals.optString("trendDirection", "sideways")),
                signals.optDouble("ma5", 0.0),
                signals.optDouble("ma5Previous", 0.0),
                signals.optDouble("ma20", 0.0),
                signals.optDouble("ma50", 0.0),
                signals.optDouble("roc", 0.0)
        );
    }

    static List<DailyBar> bars(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<DailyBar> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject bar = array.getJSONObject(i);
            out.add(new DailyBar(
                    optDate(bar, "date"),
                    bar.optDouble("open", 0.0),
                    bar.optDouble("high", 0.0),
                    bar.optDouble("low", 0.0),
                    bar.getDouble("close"),
                    bar.optDouble("volume", 0.0)
            ));
        }
        return out;
    }

    static List<QuarterlyEarnings> earnings(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<QuarterlyEarnings> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject quarter = array.getJSONObject(i);
            out.add(new QuarterlyEarnings(optDate(quarter, "quarterEnd"), quarter.getDouble("operatingIncome")));
        }
        return out;
    }

    private static Double optBoxed(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        return json.getDouble(key);
    }

    private static LocalDate optDate(JSONObject json, String key) {
        String raw = json.optString(key, "").trim();
        return raw.isEmpty() ? null : LocalDate.parse(raw);
    }
}
