package com.stockharvest.jp.data;

import com.stockharvest.jp.model.DailyBar;
import com.stockharvest.jp.model.QuarterlyEarnings;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Serves market data from {@code <dir>/<symbol>.json}, one file per symbol in the same shape
 * {@link SnapshotJsonReader} reads. Files are re-read on every call; wrap in
 * {@link CachingMarketDataProvider} to apply the usual TTLs.
 */
public final class JsonFileMarketDataProvider implements MarketDataProvider {
    private static final Pattern SYMBOL = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path dir;

    public JsonFileMarketDataProvider(Path dir) {
        this.dir = dir;
    }

    @Override
    public Quote quote(String symbol) throws MarketDataException {
        JSONObject json = load(symbol);
        return Quote.builder()
                .symbol(json.has("symbol") ? json.optString("symbol") : json.optString("code", symbol))
                .name(json.optString("name"))
                .price(json.optDouble("price", 0.0))
                .change(json.optDouble("change", 0.0))
                .changeRate(json.optDouble("changeRate", 0.0))
                .volume(json.optLong("volume", 0L))
                .open(optBoxed(json, "open"))
                .high(optBoxed(json, "high"))
                .low(optBoxed(json, "low"))
                .previousClose(optBoxed(json, "previousClose"))
                .build();
    }

    @Override
    public List<DailyBar> dailyBars(String symbol, int days) throws MarketDataException {
        JSONObject json = load(symbol);
        List<DailyBar> bars = parse(symbol, () -> SnapshotJsonReader.bars(json.optJSONArray("bars")));
        return bars.size() <= days ? bars : bars.subList(bars.size() - days, bars.size());
    }

    @Override
    public List<QuarterlyEarnings> quarterlyEarnings(String symbol) throws MarketDataException {
        JSONObject json = load(symbol);
        return parse(symbol, () -> SnapshotJsonReader.earnings(json.optJSONArray("earnings")));
    }

    @Override
    public ListingFacts listingFacts(String symbol) throws MarketDataException {
        JSONObject json = load(symbol);
        String listingDate = json.optString("listingDate", "").trim();
        return parse(symbol, () -> new ListingFacts(
                json.optBoolean("newlyListed", false),
                listingDate.isEmpty() ? null : LocalDate.parse(listingDate),
                json.optBoolean("withinEarningsWindow", false)));
    }

    private JSONObject load(String symbol) throws MarketDataException {
        if (symbol == null || !SYMBOL.matcher(symbol).matches()) {
            throw new MarketDataException(symbol, "invalid symbol: " + symbol);
        }
        Path file = dir.resolve(symbol + ".json");
        try {
            return new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            throw new MarketDataException(symbol, "no market data file " + file, e);
        } catch (IOException e) {
            throw new MarketDataException(symbol, "cannot read " + file + ": " + e.getMessage(), e);
        } catch (JSONException e) {
            throw new MarketDataException(symbol, "malformed market data in " + file + ": " + e.getMessage(), e);
        }
    }

    private static <T> T parse(String symbol, FieldParser<T> parser) throws MarketDataException {
        try {
            return parser.parse();
        } catch (JSONException | DateTimeParseException e) {
            throw new MarketDataException(symbol, "malformed market data for " + symbol + ": " + e.getMessage(), e);
        }
    }

    private static Double optBoxed(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        return json.optDouble(key);
    }

    @FunctionalInterface
    private interface FieldParser<T> {
        T parse();
    }
}
