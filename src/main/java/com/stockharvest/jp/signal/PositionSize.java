package com.stockharvest.jp.signal;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PositionSize {
    public final long shares;
    public final double positionValue;
    public final double portfolioExposure;
    public final double maxRiskAmount;
    public final double riskPerShare;
    public final boolean withinExposureLimit;

    public static PositionSize none(double maxRiskAmount) {
        return new PositionSize(0L, 0.0, 0.0, maxRiskAmount, 0.0, true);
    }
}
