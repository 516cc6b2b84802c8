package com.stockharvest.jp.pattern;

import com.stockharvest.core.diagnostics.CauseCode;
import com.stockharvest.core.diagnostics.Outcome;
import com.stockharvest.jp.config.ScreeningConfig;
import com.stockharvest.jp.history.DetectionHistoryStore;
import com.stockharvest.jp.model.DetectionType;
import com.stockharvest.jp.model.DetectionVerdict;
import com.stockharvest.jp.model.HistoryRecord;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.PatternId;
import com.stockharvest.jp.model.PatternSignal;
import com.stockharvest.jp.model.QuarterlyEarnings;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.risk.TurnaroundRiskAssessor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pattern B: first profitable quarter after a run of losses, confirmed by price breaking above
 * a rising MA5.
 */
public final class ProfitabilityTurnaroundDetector implements PatternDetector {
    private static final Logger LOG = LogManager.getLogger(ProfitabilityTurnaroundDetector.class);
    private static final String OWNER = "pattern.b";

    static final double MIN_ENTRY_RSI = 40.0;
    static final double MAX_ENTRY_RSI = 75.0;
    static final double MIN_ENTRY_VOLUME_RATIO = 1.2;
    static final double MAX_ENTRY_VOLUME_RATIO = 3.0;

    private final ScreeningConfig config;
    private final DetectionHistoryStore history;
    private final Clock clock;
    private final TurnaroundRiskAssessor riskAssessor = new TurnaroundRiskAssessor();

    public ProfitabilityTurnaroundDetector(ScreeningConfig config, DetectionHistoryStore history, Clock clock) {
        this.config = config;
        this.history = history;
        this.clock = clock;
    }

    @Override
    public PatternId patternId() {
        return PatternId.B;
    }

    @Override
    public DetectionVerdict evaluate(StockSnapshot snapshot, IndicatorSet indicators) {
        try {
            return evaluateStages(snapshot, indicators == null ? IndicatorSet.neutral() : indicators);
        } catch (RuntimeException e) {
            LOG.warn("pattern B evaluation failed for {}: {}", snapshot == null ? "?" : snapshot.symbol, e.toString());
            return DetectionVerdict.error(PatternId.B, e);
        }
    }

    private DetectionVerdict evaluateStages(StockSnapshot snapshot, IndicatorSet indicators) {
        Instant now = clock.instant();
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("changeRate", snapshot.changeRate);
        evidence.put("volume", snapshot.volume);

        Outcome<Turnaround> turnaround = checkTurnaround(snapshot.earningsNewestFirst());
        if (!turnaround.success) {
            return reject(turnaround, evidence);
        }
        evidence.put("lossRun", turnaround.value.lossRun);
        evidence.put("improvement", round2(turnaround.value.improvement));
        evidence.put("turnaroundConfidence", round2(turnaround.value.confidence));

        Outcome<Double> crossover = checkMa5Crossover(snapshot.price, indicators);
        if (!crossover.success) {
            return reject(crossover, evidence);
        }
        evidence.put("ma5", round2(indicators.ma5));
        evidence.put("ma5Crossover", round4(crossover.value));

        Outcome<Boolean> entry = checkEntryConditions(snapshot.changeRate, indicators);
        if (!entry.success) {
            return reject(entry, evidence);
        }
        evidence.put("rsi", round2(indicators.rsi));
        evidence.put("volumeRatio", round2(indicators.volumeRatio));

        Outcome<Boolean> exclusions = checkExclusions(snapshot, now);
        if (!exclusions.success) {
            return reject(exclusions, evidence);
        }

        PatternSignal signal = synthesize(snapshot, indicators);
        String reason = String.format(Locale.US,
                "profitability turnaround after %d loss quarters, %.2f%% above MA5",
                turnaround.value.lossRun, crossover.value * 100.0);
        history.record(snapshot.symbol, HistoryRecord.of(snapshot, DetectionType.PATTERN_B, now, reason));
        LOG.info("pattern B detected: symbol={}, strength={}, lossRun={}", snapshot.symbol, signal.signalStrength, turnaround.value.lossRun);
        return DetectionVerdict.detected(PatternId.B, reason, signal.signalStrength, signal.signalStrength / 100.0, evidence, signal);
    }

    /**
     * Quarters are newest first: index 0 must be a profit, followed by at least the
     * configured number of consecutive loss quarters.
     */
    Outcome<Turnaround> checkTurnaround(List<QuarterlyEarnings> quarters) {
        if (quarters.isEmpty()) {
            return Outcome.failure(CauseCode.NO_EARNINGS_DATA, OWNER, "no quarterly earnings available");
        }
        QuarterlyEarnings latest = quarters.get(0);
        if (!latest.isProfit()) {
            return Outcome.failure(CauseCode.LATEST_QUARTER_NOT_PROFITABLE, OWNER, String.format(Locale.US,
                    "latest quarter not profitable (operating income %.0f)", latest.operatingIncome));
        }
        int lossRun = 0;
        double lossSum = 0.0;
        for (int i = 1; i < quarters.size() && !quarters.get(i).isProfit(); i++) {
            lossRun++;
            lossSum += quarters.get(i).operatingIncome;
        }
        if (lossRun < config.patternBMinLossQuarters) {
            return Outcome.failure(CauseCode.LOSS_RUN_TOO_SHORT, OWNER, String.format(Locale.US,
                    "only %d loss quarters before the profit (needs %d)", lossRun, config.patternBMinLossQuarters));
        }
        double avgLoss = lossSum / lossRun;
        double improvement = avgLoss == 0.0 ? 0.0 : clamp((latest.operatingIncome - avgLoss) / Math.abs(avgLoss), 0.0, 2.0);
        double confidence = Math.min(0.95, 0.6 + 0.1 * lossRun + 0.25 * improvement);
        return Outcome.success(new Turnaround(lossRun, improvement, confidence), OWNER);
    }

    Outcome<Double> checkMa5Crossover(double price, IndicatorSet indicators) {
        if (!indicators.hasMa5()) {
            return Outcome.failure(CauseCode.MA5_UNAVAILABLE, OWNER, "MA5 unavailable: not enough price history");
        }
        double ma5 = indicators.ma5;
        double crossover = (price - ma5) / ma5;
        List<String> failures = new ArrayList<>();
        if (price <= ma5) {
            failures.add(String.format(Locale.US, "price %.2f not above MA5 %.2f", price, ma5));
        }
        if (indicators.ma5Slope() <= 0.0) {
            failures.add("MA5 not rising");
        }
        if (crossover < config.patternBMa5CrossoverThreshold) {
            failures.add(String.format(Locale.US, "crossover %.2f%% below %.2f%%",
                    crossover * 100.0, config.patternBMa5CrossoverThreshold * 100.0));
        }
        if (!failures.isEmpty()) {
            return Outcome.failure(CauseCode.NO_MA5_CROSSOVER, OWNER, "no MA5 crossover: " + String.join("; ", failures));
        }
        return Outcome.success(crossover, OWNER);
    }

    Outcome<Boolean> checkEntryConditions(double changeRate, IndicatorSet indicators) {
        List<String> failures = new ArrayList<>();
        if (changeRate < config.patternBEntryMinChangeRate || changeRate > config.patternBEntryMaxChangeRate) {
            failures.add(String.format(Locale.US, "change rate %.2f%% outside %.0f-%.0f%%",
                    changeRate, config.patternBEntryMinChangeRate, config.patternBEntryMaxChangeRate));
        }
        if (indicators.rsi < MIN_ENTRY_RSI || indicators.rsi > MAX_ENTRY_RSI) {
            failures.add(String.format(Locale.US, "RSI %.1f outside %.0f-%.0f", indicators.rsi, MIN_ENTRY_RSI, MAX_ENTRY_RSI));
        }
        if (indicators.volumeRatio < MIN_ENTRY_VOLUME_RATIO || indicators.volumeRatio > MAX_ENTRY_VOLUME_RATIO) {
            failures.add(String.format(Locale.US, "volume ratio %.2f outside %.1f-%.1f",
                    indicators.volumeRatio, MIN_ENTRY_VOLUME_RATIO, MAX_ENTRY_VOLUME_RATIO));
        }
        if (!failures.isEmpty()) {
            return Outcome.failure(CauseCode.ENTRY_CONDITIONS_NOT_MET, OWNER, "entry conditions not met: " + String.join("; ", failures));
        }
        return Outcome.success(Boolean.TRUE, OWNER);
    }

    Outcome<Boolean> checkExclusions(StockSnapshot snapshot, Instant now) {
        double cumulativeLoss = 0.0;
        int lossQuarters = 0;
        for (QuarterlyEarnings quarter : snapshot.earningsNewestFirst()) {
            if (!quarter.isProfit()) {
                cumulativeLoss += Math.abs(quarter.operatingIncome);
                lossQuarters++;
            }
        }
        if (cumulativeLoss >= config.patternBTaxLossCumulativeThreshold && lossQuarters >= config.patternBTaxLossQuarterThreshold) {
            return Outcome.failure(CauseCode.TAX_LOSS_CARRYFORWARD, OWNER, String.format(Locale.US,
                    "excluded: profit likely from tax-loss carry-forward (%d loss quarters, cumulative loss %.0f)",
                    lossQuarters, cumulativeLoss));
        }
        if (Math.abs(snapshot.changeRate) > config.patternBMaxAbsChangeRate) {
            return Outcome.failure(CauseCode.EXCESSIVE_VOLATILITY, OWNER, String.format(Locale.US,
                    "excluded: change rate %.2f%% beyond +/-%.0f%%", snapshot.changeRate, config.patternBMaxAbsChangeRate));
        }
        if (snapshot.volume < config.patternBLiquidityFloor) {
            return Outcome.failure(CauseCode.LOW_LIQUIDITY, OWNER, String.format(Locale.US,
                    "excluded: volume %,d below %,d", snapshot.volume, config.patternBLiquidityFloor));
        }
        Instant since = now.atZone(StopHighStickingDetector.MARKET_ZONE).minusMonths(config.patternBDedupMonths).toInstant();
        List<HistoryRecord> recent = history.query(snapshot.symbol, since, DetectionType.PATTERN_B);
        if (!recent.isEmpty()) {
            return Outcome.failure(CauseCode.RECENTLY_DETECTED, OWNER, String.format(Locale.US,
                    "excluded: turnaround already detected on %s", recent.get(recent.size() - 1).timestamp));
        }
        return Outcome.success(Boolean.TRUE, OWNER);
    }

    PatternSignal synthesize(StockSnapshot snapshot, IndicatorSet indicators) {
        double entry = round2(snapshot.price);
        return PatternSignal.builder()
                .signalStrength(round2(clamp(50.0 + 8.0 * snapshot.changeRate, 50.0, 90.0)))
                .entryPrice(entry)
                .profitTarget(round2(entry * (1.0 + config.patternBProfitTargetPct / 100.0)))
                .stopLoss(round2(entry * (1.0 - config.patternBStopLossPct / 100.0)))
                .maxHoldingDays(config.patternBMaxHoldingDays)
                .expectedReturnPct(config.patternBProfitTargetPct)
                .maxLossPct(config.patternBStopLossPct)
                .riskAssessment(riskAssessor.assess(snapshot.changeRate, snapshot.volume, indicators))
                .build();
    }

    private static DetectionVerdict reject(Outcome<?> outcome, Map<String, Object> evidence) {
        return DetectionVerdict.rejected(PatternId.B, outcome.causeCode, outcome.message, evidence);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    static final class Turnaround {
        final int lossRun;
        final double improvement;
        final double confidence;

        Turnaround(int lossRun, double improvement, double confidence) {
            this.lossRun = lossRun;
            this.improvement = improvement;
            this.confidence = confidence;
        }
    }
}
