package com.stockharvest.jp.signal;

import com.stockharvest.jp.config.ScreeningConfig;

/**
 * Fixed-fractional sizing: risk a fixed share of the portfolio between entry and stop, never
 * exceed the exposure cap, and trade in whole lots.
 */
public final class PositionSizer {
    private final ScreeningConfig config;

    public PositionSizer(ScreeningConfig config) {
        this.config = config;
    }

    public PositionSize size(double entryPrice, double stopLoss) {
        double maxRiskAmount = config.portfolioSize * config.maxRiskPerTrade;
        double riskPerShare = entryPrice - stopLoss;
        if (!(entryPrice > 0.0) || !(riskPerShare > 0.0)) {
            return PositionSize.none(maxRiskAmount);
        }
        long byRisk = (long) Math.floor(maxRiskAmount / riskPerShare);
        long byExposure = (long) Math.floor(config.portfolioSize * config.maxPortfolioExposure / entryPrice);
        long shares = Math.min(byRisk, byExposure);
        shares = shares / config.lotSize * config.lotSize;

        double positionValue = shares * entryPrice;
        double exposure = positionValue / config.portfolioSize;
        return PositionSize.builder()
                .shares(shares)
                .positionValue(Math.round(positionValue))
                .portfolioExposure(Math.round(exposure * 10_000.0) / 10_000.0)
                .maxRiskAmount(Math.round(maxRiskAmount))
                .riskPerShare(Math.round(riskPerShare * 100.0) / 100.0)
                .withinExposureLimit(exposure <= config.maxPortfolioExposure + 1e-9)
                .build();
    }
}
