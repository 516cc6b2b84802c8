package com.stockharvest.jp.data;

import com.stockharvest.jp.model.DailyBar;
import com.stockharvest.jp.model.QuarterlyEarnings;

import java.util.List;

/**
 * Source of quotes, bars, earnings and listing facts. Implementations may return empty
 * lists when a symbol has no data.
 */
public interface MarketDataProvider {

    Quote quote(String symbol) throws MarketDataException;

    /**
     * Up to {@code days} daily bars, oldest first.
     */
    List<DailyBar> dailyBars(String symbol, int days) throws MarketDataException;

    /**
     * Quarterly operating results, newest quarter first.
     */
    List<QuarterlyEarnings> quarterlyEarnings(String symbol) throws MarketDataException;

    ListingFacts listingFacts(String symbol) throws MarketDataException;
}
