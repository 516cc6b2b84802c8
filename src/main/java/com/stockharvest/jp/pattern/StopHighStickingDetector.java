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
import com.stockharvest.jp.model.RiskAssessment;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.risk.StopHighRiskAssessor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pattern A: a newly listed stock pinned at its stop-high right after an earnings release.
 * Stages run in order and the first failing stage decides the rejection.
 */
public final class StopHighStickingDetector implements PatternDetector {
    private static final Logger LOG = LogManager.getLogger(StopHighStickingDetector.class);
    private static final String OWNER = "pattern.a";

    public static final ZoneId MARKET_ZONE = ZoneId.of("Asia/Tokyo");

    private final ScreeningConfig config;
    private final DetectionHistoryStore history;
    private final Clock clock;
    private final StopHighRiskAssessor riskAssessor = new StopHighRiskAssessor();

    public StopHighStickingDetector(ScreeningConfig config, DetectionHistoryStore history, Clock clock) {
        this.config = config;
        this.history = history;
        this.clock = clock;
    }

    @Override
    public PatternId patternId() {
        return PatternId.A;
    }

    @Override
    public DetectionVerdict evaluate(StockSnapshot snapshot, IndicatorSet indicators) {
        try {
            return evaluateStages(snapshot, indicators == null ? IndicatorSet.neutral() : indicators);
        } catch (RuntimeException e) {
            LOG.warn("pattern A evaluation failed for {}: {}", snapshot == null ? "?" : snapshot.symbol, e.toString());
            return DetectionVerdict.error(PatternId.A, e);
        }
    }

    private DetectionVerdict evaluateStages(StockSnapshot snapshot, IndicatorSet indicators) {
        Instant now = clock.instant();
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("changeRate", snapshot.changeRate);
        evidence.put("volume", snapshot.volume);

        Outcome<Double> listing = checkListing(snapshot, now);
        if (!listing.success) {
            return reject(listing, evidence);
        }
        if (listing.value != null) {
            evidence.put("listingAgeYears", round2(listing.value));
        }

        Outcome<Double> stopHigh = checkStopHigh(snapshot);
        evidence.putAll(stopHigh.details);
        if (!stopHigh.success) {
            return reject(stopHigh, evidence);
        }
        recordStopHighSession(snapshot, now);

        Outcome<Double> shadow = checkLowerShadow(snapshot);
        evidence.putAll(shadow.details);
        if (!shadow.success) {
            return reject(shadow, evidence);
        }

        if (!snapshot.withinEarningsWindow) {
            return DetectionVerdict.rejected(PatternId.A, CauseCode.OUTSIDE_EARNINGS_WINDOW,
                    "not the day after an earnings release", evidence);
        }

        Outcome<Integer> exclusions = checkExclusions(snapshot, now);
        if (!exclusions.success) {
            return reject(exclusions, evidence);
        }
        evidence.put("stopHighSessions", exclusions.value);

        if (history.contains(snapshot.symbol, DetectionType.PATTERN_A)) {
            return DetectionVerdict.rejected(PatternId.A, CauseCode.ALREADY_DETECTED,
                    "stop-high pattern already detected for " + snapshot.symbol, evidence);
        }

        PatternSignal signal = synthesize(snapshot, indicators);
        String reason = String.format(Locale.US,
                "stop-high sticking: +%.2f%% on %,d shares, lower shadow %.2f%%",
                snapshot.changeRate, snapshot.volume, shadow.value * 100.0);
        history.record(snapshot.symbol, HistoryRecord.of(snapshot, DetectionType.PATTERN_A, now, reason));
        LOG.info("pattern A detected: symbol={}, strength={}, entry={}", snapshot.symbol, signal.signalStrength, signal.entryPrice);
        return DetectionVerdict.detected(PatternId.A, reason, signal.signalStrength, signal.signalStrength / 100.0, evidence, signal);
    }

    Outcome<Double> checkListing(StockSnapshot snapshot, Instant now) {
        if (!snapshot.newlyListed) {
            return Outcome.failure(CauseCode.LISTING_NOT_ELIGIBLE, OWNER, "listing condition not met: not a newly listed stock");
        }
        if (snapshot.listingDate == null) {
            return Outcome.success(null, OWNER);
        }
        LocalDate today = now.atZone(MARKET_ZONE).toLocalDate();
        double ageYears = ChronoUnit.DAYS.between(snapshot.listingDate, today) / 365.25;
        if (ageYears > config.patternAMaxListingYears) {
            return Outcome.failure(CauseCode.LISTING_NOT_ELIGIBLE, OWNER, String.format(Locale.US,
                    "listing condition not met: listed %.1f years ago (max %.1f)", ageYears, config.patternAMaxListingYears));
        }
        return Outcome.success(ageYears, OWNER);
    }

    /**
     * Succeeds with the stop-high price implied by the previous close and the change rate.
     * The session high and the exchange limit are evidence only. Every shortfall is listed in the message.
     */
    Outcome<Double> checkStopHigh(StockSnapshot snapshot) {
        double previousClose = snapshot.resolvedPreviousClose();
        double stopHighPrice = previousClose * (1.0 + snapshot.changeRate / 100.0);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previousClose", round2(previousClose));
        details.put("stopHighPrice", round2(stopHighPrice));
        if (snapshot.high != null && snapshot.high > 0.0) {
            details.put("sessionHigh", round2(snapshot.high));
        }
        details.put("exchangePriceLimit", PriceLimitTable.limitFor(previousClose));
        details.put("stopHighProximity", stopHighPrice > 0.0 ? round4(snapshot.price / stopHighPrice) : 0.0);

        List<String> shortfalls = new ArrayList<>();
        if (snapshot.changeRate < config.patternAMinChangeRate) {
            shortfalls.add(String.format(Locale.US, "change rate %.2f%% below %.2f%%",
                    snapshot.changeRate, config.patternAMinChangeRate));
        }
        if (!(stopHighPrice > 0.0) || snapshot.price < stopHighPrice * config.patternAStopHighProximity) {
            shortfalls.add(String.format(Locale.US, "price %.2f under %.0f%% of stop-high %.2f",
                    snapshot.price, config.patternAStopHighProximity * 100.0, stopHighPrice));
        }
        if (snapshot.volume < config.patternAMinVolume) {
            shortfalls.add(String.format(Locale.US, "volume %,d below %,d", snapshot.volume, config.patternAMinVolume));
        }
        if (!shortfalls.isEmpty()) {
            return Outcome.failure(CauseCode.NOT_STOP_HIGH, OWNER, "not at stop-high: " + String.join("; ", shortfalls), details);
        }
        return Outcome.success(stopHighPrice, OWNER, details);
    }

    Outcome<Double> checkLowerShadow(StockSnapshot snapshot) {
        double ratio;
        String source;
        double previousClose = snapshot.resolvedPreviousClose();
        if (snapshot.lowerShadowRatio != null && Double.isFinite(snapshot.lowerShadowRatio)) {
            ratio = snapshot.lowerShadowRatio;
            source = "explicit";
        } else if (snapshot.open != null && snapshot.low != null && snapshot.low > 0.0 && previousClose > 0.0) {
            ratio = Math.max(0.0, (Math.min(snapshot.open, snapshot.price) - snapshot.low) / previousClose);
            source = "ohlc";
        } else {
            ratio = snapshot.changeRate >= 10.0 ? snapshot.changeRate * 0.0005 : 0.03;
            source = "estimate";
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lowerShadowRatio", round4(ratio));
        details.put("lowerShadowSource", source);
        if (ratio > config.patternAMaxLowerShadowRatio) {
            return Outcome.failure(CauseCode.LOWER_SHADOW_TOO_LONG, OWNER, String.format(Locale.US,
                    "lower shadow %.2f%% exceeds %.2f%%", ratio * 100.0, config.patternAMaxLowerShadowRatio * 100.0), details);
        }
        return Outcome.success(ratio, OWNER, details);
    }

    /**
     * Succeeds with the number of distinct stop-high sessions in the trailing window.
     */
    Outcome<Integer> checkExclusions(StockSnapshot snapshot, Instant now) {
        Instant since = now.minus(Duration.ofDays(config.patternAConsecutiveWindowDays));
        Set<LocalDate> sessions = new TreeSet<>();
        sessions.add(now.atZone(MARKET_ZONE).toLocalDate());
        for (HistoryRecord record : history.query(snapshot.symbol, since, DetectionType.STOP_HIGH)) {
            sessions.add(record.timestamp.atZone(MARKET_ZONE).toLocalDate());
        }
        if (sessions.size() >= config.patternAConsecutiveLimit) {
            return Outcome.failure(CauseCode.CONSECUTIVE_STOP_HIGH, OWNER, String.format(Locale.US,
                    "excluded: %d stop-high sessions within %d days %s",
                    sessions.size(), config.patternAConsecutiveWindowDays, sessions));
        }
        if (snapshot.changeRate >= config.patternAUnexplainedSpikePct && !snapshot.withinEarningsWindow) {
            return Outcome.failure(CauseCode.UNEXPLAINED_SPIKE, OWNER, String.format(Locale.US,
                    "excluded: +%.2f%% spike without an earnings catalyst", snapshot.changeRate));
        }
        return Outcome.success(sessions.size(), OWNER);
    }

    PatternSignal synthesize(StockSnapshot snapshot, IndicatorSet indicators) {
        double entry = round2(snapshot.price * (1.0 + config.patternAEntryTriggerPct / 100.0));
        double target = round2(entry * (1.0 + config.patternAProfitTargetPct / 100.0));
        double stop = round2(entry * (1.0 - config.patternAStopLossPct / 100.0));
        RiskAssessment risk = riskAssessor.assess(snapshot.changeRate, indicators);
        return PatternSignal.builder()
                .signalStrength(strength(snapshot.changeRate))
                .entryPrice(entry)
                .profitTarget(target)
                .stopLoss(stop)
                .maxHoldingDays(config.patternAMaxHoldingDays)
                .expectedReturnPct(config.patternAProfitTargetPct)
                .maxLossPct(config.patternAStopLossPct)
                .riskAssessment(risk)
                .build();
    }

    double strength(double changeRate) {
        double trigger = config.patternAEntryTriggerPct;
        double span = config.patternAStrengthFullScalePct - trigger;
        return round2(clamp(40.0 + 60.0 * (changeRate - trigger) / span, 40.0, 100.0));
    }

    private void recordStopHighSession(StockSnapshot snapshot, Instant now) {
        LocalDate today = now.atZone(MARKET_ZONE).toLocalDate();
        Instant startOfDay = today.atStartOfDay(MARKET_ZONE).toInstant();
        if (!history.query(snapshot.symbol, startOfDay, DetectionType.STOP_HIGH).isEmpty()) {
            return;
        }
        String summary = String.format(Locale.US, "stop-high session +%.2f%%", snapshot.changeRate);
        history.record(snapshot.symbol, HistoryRecord.of(snapshot, DetectionType.STOP_HIGH, now, summary));
    }

    private static DetectionVerdict reject(Outcome<?> outcome, Map<String, Object> evidence) {
        return DetectionVerdict.rejected(PatternId.A, outcome.causeCode, outcome.message, evidence);
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
}
