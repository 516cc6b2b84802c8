package com.stockharvest.jp.model;

/**
 * Derived indicator bundle for one snapshot. Values that could not be computed hold their
 * neutral defaults (see {@link #neutral()}); moving averages that could not be computed are 0.
 */
public final class IndicatorSet {
    public static final double NEUTRAL_RSI = 50.0;
    public static final double NEUTRAL_VOLUME_RATIO = 1.0;

    public final double rsi;
    public final double macd;
    public final double bollingerPosition;
    public final double volumeRatio;
    public final TrendDirection trendDirection;
    public final double ma5;
    public final double ma5Previous;
    public final double ma20;
    public final double ma50;
    public final double rateOfChange;

    public IndicatorSet(
            double rsi,
            double macd,
            double bollingerPosition,
            double volumeRatio,
            TrendDirection trendDirection,
            double ma5,
            double ma5Previous,
            double ma20,
            double ma50,
            double rateOfChange
    ) {
        this.rsi = rsi;
        this.macd = macd;
        this.bollingerPosition = bollingerPosition;
        this.volumeRatio = volumeRatio;
        this.trendDirection = trendDirection == null ? TrendDirection.SIDEWAYS : trendDirection;
        this.ma5 = ma5;
        this.ma5Previous = ma5Previous;
        this.ma20 = ma20;
        this.ma50 = ma50;
        this.rateOfChange = rateOfChange;
    }

    public static IndicatorSet neutral() {
        return new IndicatorSet(NEUTRAL_RSI, 0.0, 0.0, NEUTRAL_VOLUME_RATIO, TrendDirection.SIDEWAYS, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    /**
     * Precomputed oscillators as delivered by a data feed, without moving averages.
     */
    public static IndicatorSet of(double rsi, double macd, double bollingerPosition, double volumeRatio, TrendDirection trend) {
        return new IndicatorSet(rsi, macd, bollingerPosition, volumeRatio, trend, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public IndicatorSet withMovingAverage5(double ma5, double ma5Previous) {
        return new IndicatorSet(rsi, macd, bollingerPosition, volumeRatio, trendDirection, ma5, ma5Previous, ma20, ma50, rateOfChange);
    }

    public boolean hasMa5() {
        return ma5 > 0.0 && Double.isFinite(ma5);
    }

    public double ma5Slope() {
        if (!hasMa5() || !(ma5Previous > 0.0)) {
            return 0.0;
        }
        return (ma5 - ma5Previous) / ma5Previous;
    }
}
