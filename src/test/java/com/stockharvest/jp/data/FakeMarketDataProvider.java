package com.stockharvest.jp.data;

import com.stockharvest.jp.model.DailyBar;
import com.stockharvest.jp.model.QuarterlyEarnings;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provider with per-method call counters. Symbols added with {@link #failOn(String)}
 * throw {@link MarketDataException} from every method.
 */
public final class FakeMarketDataProvider implements MarketDataProvider {
    public final AtomicInteger quoteCalls = new AtomicInteger();
    public final AtomicInteger barCalls = new AtomicInteger();
    public final AtomicInteger earningsCalls = new AtomicInteger();
    public final AtomicInteger factsCalls = new AtomicInteger();

    private final Map<String, Quote> quotes = new HashMap<>();
    private final Map<String, List<DailyBar>> bars = new HashMap<>();
    private final Map<String, List<QuarterlyEarnings>> earnings = new HashMap<>();
    private final Map<String, ListingFacts> facts = new HashMap<>();
    private final Set<String> failing = new HashSet<>();

    public FakeMarketDataProvider withQuote(Quote quote) {
        quotes.put(quote.symbol, quote);
        return this;
    }

    public FakeMarketDataProvider withBars(String symbol, List<DailyBar> series) {
        bars.put(symbol, series);
        return this;
    }

    public FakeMarketDataProvider withEarnings(String symbol, List<QuarterlyEarnings> quarters) {
        earnings.put(symbol, quarters);
        return this;
    }

    public FakeMarketDataProvider withFacts(String symbol, ListingFacts listing) {
        facts.put(symbol, listing);
        return this;
    }

    public FakeMarketDataProvider failOn(String symbol) {
        failing.add(symbol);
        return this;
    }

    @Override
    public synchronized Quote quote(String symbol) throws MarketDataException {
        quoteCalls.incrementAndGet();
        check(symbol);
        return quotes.get(symbol);
    }

    @Override
    public synchronized List<DailyBar> dailyBars(String symbol, int days) throws MarketDataException {
        barCalls.incrementAndGet();
        check(symbol);
        List<DailyBar> series = bars.getOrDefault(symbol, List.of());
        return series.size() <= days ? series : series.subList(series.size() - days, series.size());
    }

    @Override
    public synchronized List<QuarterlyEarnings> quarterlyEarnings(String symbol) throws MarketDataException {
        earningsCalls.incrementAndGet();
        check(symbol);
        return earnings.getOrDefault(symbol, List.of());
    }

    @Override
    public synchronized ListingFacts listingFacts(String symbol) throws MarketDataException {
        factsCalls.incrementAndGet();
        check(symbol);
        return facts.get(symbol);
    }

    private void check(String symbol) throws MarketDataException {
        if (failing.contains(symbol)) {
            throw new MarketDataException(symbol, "feed unavailable for " + symbol);
        }
    }
}
