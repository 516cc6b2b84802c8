package com.stockharvest.jp.data;

import com.stockharvest.jp.model.DailyBar;
import com.stockharvest.jp.model.QuarterlyEarnings;
import com.stockharvest.jp.model.StockSnapshot;

import java.time.Clock;
import java.util.List;

/**
 * Pulls everything the detectors need for one symbol into a {@link StockSnapshot}.
 */
public final class SnapshotAssembler {
    public static final int DEFAULT_BAR_DAYS = 120;

    private final MarketDataProvider provider;
    private final Clock clock;
    private final int barDays;

    public SnapshotAssembler(MarketDataProvider provider, Clock clock) {
        this(provider, clock, DEFAULT_BAR_DAYS);
    }

    public SnapshotAssembler(MarketDataProvider provider, Clock clock, int barDays) {
        this.provider = provider;
        this.clock = clock;
        this.barDays = Math.max(1, barDays);
    }

    public StockSnapshot assemble(String symbol) throws MarketDataException {
        Quote quote = provider.quote(symbol);
        if (quote == null) {
            throw new MarketDataException(symbol, "no quote for " + symbol);
        }
        List<DailyBar> bars = provider.dailyBars(symbol, barDays);
        List<QuarterlyEarnings> earnings = provider.quarterlyEarnings(symbol);
        ListingFacts facts = provider.listingFacts(symbol);
        if (facts == null) {
            facts = ListingFacts.unknown();
        }
        return StockSnapshot.builder()
                .symbol(quote.symbol == null ? symbol : quote.symbol)
                .name(quote.name)
                .price(quote.price)
                .change(quote.change)
                .changeRate(quote.changeRate)
                .volume(quote.volume)
                .open(quote.open)
                .high(quote.high)
                .low(quote.low)
                .previousClose(quote.previousClose)
                .bars(bars == null ? List.of() : bars)
                .earnings(earnings == null ? List.of() : earnings)
                .newlyListed(facts.newlyListed)
                .listingDate(facts.listingDate)
                .withinEarningsWindow(facts.withinEarningsWindow)
                .observedAt(clock.instant())
                .build();
    }
}
