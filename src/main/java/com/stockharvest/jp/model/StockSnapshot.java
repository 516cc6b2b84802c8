package com.stockharvest.jp.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * One scan tick for one symbol. Boxed fields are optional facts; a null means the data feed
 * did not provide them.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class StockSnapshot {
    public final String symbol;
    public final String name;
    public final double price;
    public final double change;
    public final double changeRate;
    public final long volume;
    public final List<DailyBar> bars;
    public final IndicatorSet indicators;
    public final Double open;
    public final Double high;
    public final Double low;
    public final Double previousClose;
    public final Double lowerShadowRatio;
    public final boolean newlyListed;
    public final LocalDate listingDate;
    public final boolean withinEarningsWindow;
    public final List<QuarterlyEarnings> earnings;
    public final Instant observedAt;

    public List<DailyBar> series() {
        return bars == null ? List.of() : bars;
    }

    /**
     * Quarterly results, newest quarter first.
     */
    public List<QuarterlyEarnings> earningsNewestFirst() {
        return earnings == null ? List.of() : earnings;
    }

    public boolean hasSessionRange() {
        return isPositive(high) && isPositive(low) && high >= low;
    }

    public double resolvedPreviousClose() {
        if (isPositive(previousClose)) {
            return previousClose;
        }
        if (change != 0.0 && price - change > 0.0) {
            return price - change;
        }
        if (changeRate > -100.0) {
            return price / (1.0 + changeRate / 100.0);
        }
        return price;
    }

    private static boolean isPositive(Double value) {
        return value != null && Double.isFinite(value) && value > 0.0;
    }
}
