package com.stockharvest.jp.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable thresholds shared by the detectors, the integrator and the scanner.
 * Percentages named {@code *Pct} are in percent; {@code *Rate} and {@code *Ratio} values are fractions.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScreeningConfig {
    public final double patternAMinChangeRate;
    public final double patternAStopHighProximity;
    public final long patternAMinVolume;
    public final double patternAMaxLowerShadowRatio;
    public final double patternAEntryTriggerPct;
    public final double patternAProfitTargetPct;
    public final double patternAStopLossPct;
    public final double patternAStrengthFullScalePct;
    public final double patternAUnexplainedSpikePct;
    public final double patternAMaxListingYears;
    public final int patternAMaxHoldingDays;
    public final int patternAConsecutiveWindowDays;
    public final int patternAConsecutiveLimit;

    public final double patternBMa5CrossoverThreshold;
    public final int patternBMinLossQuarters;
    public final double patternBProfitTargetPct;
    public final double patternBStopLossPct;
    public final int patternBMaxHoldingDays;
    public final long patternBLiquidityFloor;
    public final double patternBMaxAbsChangeRate;
    public final double patternBEntryMinChangeRate;
    public final double patternBEntryMaxChangeRate;
    public final double patternBTaxLossCumulativeThreshold;
    public final int patternBTaxLossQuarterThreshold;
    public final int patternBDedupMonths;

    public final double maxRiskPerTrade;
    public final double minRiskReward;
    public final double maxPortfolioExposure;
    public final double portfolioSize;
    public final int lotSize;
    public final double profitTargetRate;
    public final double stopLossRate;
    public final double entrySpreadRate;

    public final int scanConcurrency;
    public final int historyCapacity;

    public static ScreeningConfig defaults() {
        return from(Config.of(Map.of()));
    }

    public static ScreeningConfig from(Config config) {
        ScreeningConfig out = ScreeningConfig.builder()
                .patternAMinChangeRate(config.getDouble("patternA.min_change_rate"))
                .patternAStopHighProximity(config.getDouble("patternA.stop_high_proximity"))
                .patternAMinVolume(config.getLong("patternA.min_volume"))
                .patternAMaxLowerShadowRatio(config.getDouble("patternA.max_lower_shadow_ratio"))
                .patternAEntryTriggerPct(config.getDouble("patternA.entry_trigger_pct"))
                .patternAProfitTargetPct(config.getDouble("patternA.profit_target_pct"))
                .patternAStopLossPct(config.getDouble("patternA.stop_loss_pct"))
                .patternAStrengthFullScalePct(config.getDouble("patternA.strength_full_scale_pct"))
                .patternAUnexplainedSpikePct(config.getDouble("patternA.unexplained_spike_pct"))
                .patternAMaxListingYears(config.getDouble("patternA.max_listing_years"))
                .patternAMaxHoldingDays(config.getInt("patternA.max_holding_days"))
                .patternAConsecutiveWindowDays(config.getInt("patternA.consecutive_window_days"))
                .patternAConsecutiveLimit(config.getInt("patternA.consecutive_limit"))
                .patternBMa5CrossoverThreshold(config.getDouble("patternB.ma5_crossover_threshold"))
                .patternBMinLossQuarters(config.getInt("patternB.min_loss_quarters"))
                .patternBProfitTargetPct(config.getDouble("patternB.profit_target_pct"))
                .patternBStopLossPct(config.getDouble("patternB.stop_loss_pct"))
                .patternBMaxHoldingDays(config.getInt("patternB.max_holding_days"))
                .patternBLiquidityFloor(config.getLong("patternB.liquidity_floor"))
                .patternBMaxAbsChangeRate(config.getDouble("patternB.max_abs_change_rate"))
                .patternBEntryMinChangeRate(config.getDouble("patternB.entry_min_change_rate"))
                .patternBEntryMaxChangeRate(config.getDouble("patternB.entry_max_change_rate"))
                .patternBTaxLossCumulativeThreshold(config.getDouble("patternB.tax_loss.cumulative_threshold"))
                .patternBTaxLossQuarterThreshold(config.getInt("patternB.tax_loss.quarter_threshold"))
                .patternBDedupMonths(config.getInt("patternB.dedup_months"))
                .maxRiskPerTrade(config.getDouble("signal.max_risk_per_trade"))
                .minRiskReward(config.getDouble("signal.min_risk_reward"))
                .maxPortfolioExposure(config.getDouble("signal.max_portfolio_exposure"))
                .portfolioSize(config.getDouble("signal.portfolio_size"))
                .lotSize(config.getInt("signal.lot_size"))
                .profitTargetRate(config.getDouble("signal.profit_target_rate"))
                .stopLossRate(config.getDouble("signal.stop_loss_rate"))
                .entrySpreadRate(config.getDouble("signal.entry_spread_rate"))
                .scanConcurrency(config.getInt("scan.concurrency"))
                .historyCapacity(config.getInt("history.capacity"))
                .build();
        out.validate();
        return out;
    }

    /**
     * @throws IllegalArgumentException when a threshold is outside its usable range
     */
    public void validate() {
        requireRange("patternA.stop_high_proximity", patternAStopHighProximity, 0.0, 1.0);
        requireRange("patternA.max_lower_shadow_ratio", patternAMaxLowerShadowRatio, 0.0, 1.0);
        requireRange("patternA.stop_loss_pct", patternAStopLossPct, 0.0, 100.0);
        requireRange("patternB.stop_loss_pct", patternBStopLossPct, 0.0, 100.0);
        requireRange("signal.stop_loss_rate", stopLossRate, 0.0, 1.0);
        requireRange("signal.max_risk_per_trade", maxRiskPerTrade, 0.0, 1.0);
        requireRange("signal.max_portfolio_exposure", maxPortfolioExposure, 0.0, 1.0);
        if (!(patternAEntryTriggerPct > 0.0)) {
            throw new IllegalArgumentException("patternA.entry_trigger_pct must be positive");
        }
        if (patternAMinChangeRate < patternAEntryTriggerPct) {
            throw new IllegalArgumentException("patternA.min_change_rate must not be below patternA.entry_trigger_pct");
        }
        if (patternAStrengthFullScalePct <= patternAEntryTriggerPct) {
            throw new IllegalArgumentException("patternA.strength_full_scale_pct must exceed patternA.entry_trigger_pct");
        }
        if (patternBEntryMinChangeRate >= patternBEntryMaxChangeRate) {
            throw new IllegalArgumentException("patternB.entry_min_change_rate must be below patternB.entry_max_change_rate");
        }
        if (portfolioSize <= 0.0) {
            throw new IllegalArgumentException("signal.portfolio_size must be positive");
        }
        if (lotSize <= 0 || scanConcurrency <= 0 || historyCapacity <= 0) {
            throw new IllegalArgumentException("signal.lot_size, scan.concurrency and history.capacity must be positive");
        }
        if (patternBMinLossQuarters < 1 || patternAConsecutiveLimit < 1 || patternAConsecutiveWindowDays < 1) {
            throw new IllegalArgumentException("loss-quarter and consecutive stop-high settings must be at least 1");
        }
    }

    private static void requireRange(String key, double value, double minExclusive, double maxInclusive) {
        if (!Double.isFinite(value) || value <= minExclusive || value > maxInclusive) {
            throw new IllegalArgumentException(String.format("%s out of range (%s, %s]: %s", key, minExclusive, maxInclusive, value));
        }
    }
}
