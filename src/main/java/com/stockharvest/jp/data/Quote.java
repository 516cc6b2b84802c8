package com.stockharvest.jp.data;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Current session quote. Day OHLC values are null when the source does not publish them.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Quote {
    public final String symbol;
    public final String name;
    public final double price;
    public final double change;
    public final double changeRate;
    public final long volume;
    public final Double open;
    public final Double high;
    public final Double low;
    public final Double previousClose;
}
