package com.stockharvest.jp.signal;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class TechnicalScores {
    public final double momentum;
    public final double trend;
    public final double volume;
    public final double supportResistance;
    public final double volatility;

    public double overall() {
        return (momentum + trend + volume + supportResistance + volatility) / 5.0;
    }
}
