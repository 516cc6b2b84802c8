package com.stockharvest.jp.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Trade plan synthesized by a pattern detector once every gate has passed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class PatternSignal {
    public final double signalStrength;
    public final double entryPrice;
    public final double profitTarget;
    public final double stopLoss;
    public final int maxHoldingDays;
    public final double expectedReturnPct;
    public final double maxLossPct;
    public final RiskAssessment riskAssessment;
}
