package com.stockharvest.jp.model;

import java.time.LocalDate;

/**
 * One session of OHLCV data, oldest-first when held in a series.
 */
public final class DailyBar {
    public final LocalDate tradeDate;
    public final double open;
    public final double high;
    public final double low;
    public final double close;
    public final double volume;

    public DailyBar(LocalDate tradeDate, double open, double high, double low, double close, double volume) {
        this.tradeDate = tradeDate;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }
}
