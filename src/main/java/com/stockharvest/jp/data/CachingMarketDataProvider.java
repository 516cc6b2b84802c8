package com.stockharvest.jp.data;

import com.stockharvest.jp.model.DailyBar;
import com.stockharvest.jp.model.QuarterlyEarnings;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Caches slow-moving data in front of another provider: bars for an hour, listing facts for a
 * day, earnings for a week. Quotes always go to the delegate.
 */
public final class CachingMarketDataProvider implements MarketDataProvider {
    public static final Duration BARS_TTL = Duration.ofHours(1);
    public static final Duration FACTS_TTL = Duration.ofDays(1);
    public static final Duration EARNINGS_TTL = Duration.ofDays(7);

    private final MarketDataProvider delegate;
    private final TtlCache<String, List<DailyBar>> bars;
    private final TtlCache<String, ListingFacts> facts;
    private final TtlCache<String, List<QuarterlyEarnings>> earnings;

    public CachingMarketDataProvider(MarketDataProvider delegate, Clock clock) {
        this.delegate = delegate;
        this.bars = new TtlCache<>(BARS_TTL, clock);
        this.facts = new TtlCache<>(FACTS_TTL, clock);
        this.earnings = new TtlCache<>(EARNINGS_TTL, clock);
    }

    @Override
    public Quote quote(String symbol) throws MarketDataException {
        return delegate.quote(symbol);
    }

    @Override
    public List<DailyBar> dailyBars(String symbol, int days) throws MarketDataException {
        String key = symbol + ":" + days;
        List<DailyBar> cached = bars.get(key);
        if (cached != null) {
            return cached;
        }
        List<DailyBar> loaded = List.copyOf(delegate.dailyBars(symbol, days));
        bars.put(key, loaded);
        return loaded;
    }

    @Override
    public List<QuarterlyEarnings> quarterlyEarnings(String symbol) throws MarketDataException {
        List<QuarterlyEarnings> cached = earnings.get(symbol);
        if (cached != null) {
            return cached;
        }
        List<QuarterlyEarnings> loaded = List.copyOf(delegate.quarterlyEarnings(symbol));
        earnings.put(symbol, loaded);
        return loaded;
    }

    @Override
    public ListingFacts listingFacts(String symbol) throws MarketDataException {
        ListingFacts cached = facts.get(symbol);
        if (cached != null) {
            return cached;
        }
        ListingFacts loaded = delegate.listingFacts(symbol);
        facts.put(symbol, loaded);
        return loaded;
    }

    /**
     * Drops every cached entry for the symbol, for example after an earnings release.
     */
    public void invalidate(String symbol) {
        earnings.invalidate(symbol);
        facts.invalidate(symbol);
        String prefix = symbol + ":";
        bars.invalidateIf(key -> key.startsWith(prefix));
    }
}
