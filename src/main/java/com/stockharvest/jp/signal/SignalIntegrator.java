package com.stockharvest.jp.signal;

import com.stockharvest.jp.config.ScreeningConfig;
import com.stockharvest.jp.history.DetectionHistoryStore;
import com.stockharvest.jp.indicator.IndicatorEngine;
import com.stockharvest.jp.model.DetectionVerdict;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.PatternId;
import com.stockharvest.jp.model.RiskAssessment;
import com.stockharvest.jp.model.SignalAction;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TradingSignal;
import com.stockharvest.jp.pattern.LegacyStopHighDetector;
import com.stockharvest.jp.pattern.LegacyTurnaroundDetector;
import com.stockharvest.jp.pattern.PatternDetector;
import com.stockharvest.jp.pattern.ProfitabilityTurnaroundDetector;
import com.stockharvest.jp.pattern.StopHighStickingDetector;
import com.stockharvest.jp.risk.SignalRiskAssessor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Fuses the pattern verdicts with technical and multi-timeframe scores into one
 * {@link TradingSignal}. {@link #evaluate(StockSnapshot)} never throws.
 */
public final class SignalIntegrator {
    private static final Logger LOG = LogManager.getLogger(SignalIntegrator.class);

    static final double LOGIC_WEIGHT = 0.4;
    static final double TECHNICAL_WEIGHT = 0.3;
    static final double TIMEFRAME_WEIGHT = 0.2;
    static final double VOLUME_WEIGHT = 0.1;
    static final double STRONG_BUY_THRESHOLD = 80.0;
    static final double BUY_THRESHOLD = 60.0;
    static final double SELL_THRESHOLD = 20.0;
    static final double WATCH_THRESHOLD = 40.0;
    static final double WEAK_TECHNICAL_THRESHOLD = 30.0;

    private static final Map<PatternId, Double> PATTERN_WEIGHTS = buildPatternWeights();

    private final ScreeningConfig config;
    private final Function<ScreeningConfig, List<PatternDetector>> detectorFactory;
    private final Executor executor;
    private final Clock clock;
    private final IndicatorEngine indicatorEngine = new IndicatorEngine();
    private final TechnicalAnalyzer technicalAnalyzer = new TechnicalAnalyzer();
    private final TimeframeAnalyzer timeframeAnalyzer = new TimeframeAnalyzer();
    private final SignalRiskAssessor riskAssessor = new SignalRiskAssessor();

    public SignalIntegrator(
            ScreeningConfig config,
            Function<ScreeningConfig, List<PatternDetector>> detectorFactory,
            Executor executor,
            Clock clock
    ) {
        this.config = config;
        this.detectorFactory = detectorFactory;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Integrator running the standard detectors A, A_LEGACY, B and B_LEGACY against one
     * shared history store.
     */
    public static SignalIntegrator create(ScreeningConfig config, DetectionHistoryStore history, Executor executor, Clock clock) {
        return new SignalIntegrator(config, cfg -> standardDetectors(cfg, history, clock), executor, clock);
    }

    public static List<PatternDetector> standardDetectors(ScreeningConfig config, DetectionHistoryStore history, Clock clock) {
        return List.of(
                new StopHighStickingDetector(config, history, clock),
                new LegacyStopHighDetector(),
                new ProfitabilityTurnaroundDetector(config, history, clock),
                new LegacyTurnaroundDetector()
        );
    }

    public TradingSignal evaluate(StockSnapshot snapshot) {
        return evaluate(snapshot, config);
    }

    public TradingSignal evaluate(StockSnapshot snapshot, ScreeningConfig cfg) {
        if (snapshot == null) {
            return TradingSignal.error("", "", 0.0, "invalid snapshot: null", clock.instant());
        }
        try {
            String invalid = validate(snapshot);
            if (invalid != null) {
                return TradingSignal.error(snapshot.symbol, snapshot.name, snapshot.price, "invalid snapshot: " + invalid, clock.instant());
            }
            return integrate(snapshot, cfg == null ? config : cfg);
        } catch (RuntimeException e) {
            LOG.warn("signal generation failed for {}: {}", snapshot.symbol, e.toString());
            return TradingSignal.error(snapshot.symbol, snapshot.name, snapshot.price, "signal generation error: " + e.getMessage(), clock.instant());
        }
    }

    private TradingSignal integrate(StockSnapshot snapshot, ScreeningConfig cfg) {
        IndicatorSet indicators = indicatorEngine.resolve(snapshot);
        List<DetectionVerdict> verdicts = runDetectors(snapshot, indicators, detectorFactory.apply(cfg));

        double logicScore = logicScore(verdicts);
        TechnicalScores technical = technicalAnalyzer.analyze(snapshot, indicators);
        TimeframeConsistency timeframe = timeframeAnalyzer.analyze(snapshot, indicators);
        double strength = compositeStrength(logicScore, technical.overall(), timeframe.consistency, technical.volume);

        boolean patternADetected = false;
        boolean anyDetected = false;
        for (DetectionVerdict verdict : verdicts) {
            if (verdict.detected()) {
                anyDetected = true;
                patternADetected |= verdict.patternId == PatternId.A;
            }
        }
        SignalAction action = determineAction(strength, patternADetected, technical.overall());

        double entry;
        Double target = null;
        Double stop = null;
        double riskReward = 0.0;
        PositionSize position;
        if (action.isBuy()) {
            entry = round2(snapshot.price * (1.0 + cfg.entrySpreadRate));
            target = round2(entry * (1.0 + cfg.profitTargetRate));
            stop = round2(entry * (1.0 - cfg.stopLossRate));
            double potentialLoss = entry - stop;
            riskReward = potentialLoss > 0.0 ? round2((target - entry) / potentialLoss) : 0.0;
            position = new PositionSizer(cfg).size(entry, stop);
        } else {
            entry = snapshot.price;
            position = PositionSize.none(cfg.portfolioSize * cfg.maxRiskPerTrade);
        }

        boolean executable = action.isBuy()
                && riskReward >= cfg.minRiskReward
                && position.withinExposureLimit
                && position.portfolioExposure <= cfg.maxPortfolioExposure + 1e-9
                && position.shares > 0;

        RiskAssessment risk = riskAssessor.assess(strength, snapshot.changeRate, indicators);
        double confidence = Math.min(1.0, strength / 100.0 + (anyDetected ? 0.2 : 0.0));

        Map<String, Double> components = new LinkedHashMap<>();
        components.put("logic", round2(logicScore));
        components.put("technical", round2(technical.overall()));
        components.put("timeframe", round2(timeframe.consistency));
        components.put("volume", technical.volume);
        components.put("momentum", round2(technical.momentum));
        components.put("trend", technical.trend);
        components.put("supportResistance", technical.supportResistance);
        components.put("volatility", technical.volatility);

        TradingSignal signal = TradingSignal.builder()
                .symbol(snapshot.symbol)
                .name(snapshot.name)
                .action(action)
                .signalStrength(strength)
                .confidence(round2(confidence))
                .currentPrice(snapshot.price)
                .entryPrice(entry)
                .profitTarget(target)
                .stopLoss(stop)
                .riskRewardRatio(riskReward)
                .recommendedShares(position.shares)
                .positionValue(position.positionValue)
                .portfolioExposure(position.portfolioExposure)
                .riskAssessment(risk)
                .componentScores(Collections.unmodifiableMap(components))
                .detections(List.copyOf(verdicts))
                .executable(executable)
                .executionNotes(executionNotes(action, strength, riskReward, snapshot.changeRate))
                .generatedAt(clock.instant())
                .build();
        LOG.debug("signal {}: action={}, strength={}, logic={}, technical={}", snapshot.symbol, action, strength,
                logicScore, technical.overall());
        return signal;
    }

    private List<DetectionVerdict> runDetectors(StockSnapshot snapshot, IndicatorSet indicators, List<PatternDetector> detectors) {
        List<CompletableFuture<DetectionVerdict>> futures = new ArrayList<>(detectors.size());
        for (PatternDetector detector : detectors) {
            futures.add(CompletableFuture.supplyAsync(() -> detector.evaluate(snapshot, indicators), executor));
        }
        List<DetectionVerdict> out = new ArrayList<>(detectors.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.add(futures.get(i).join());
            } catch (CompletionException e) {
                PatternId id = detectors.get(i).patternId();
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.warn("detector {} failed for {}: {}", id, snapshot.symbol, cause.toString());
                out.add(DetectionVerdict.error(id, cause));
            }
        }
        return out;
    }

    static double logicScore(List<DetectionVerdict> verdicts) {
        double sum = 0.0;
        for (DetectionVerdict verdict : verdicts) {
            if (verdict.detected()) {
                sum += verdict.confidence * PATTERN_WEIGHTS.getOrDefault(verdict.patternId, 0.0);
            }
        }
        return sum * 100.0;
    }

    static double compositeStrength(double logic, double technical, double timeframe, double volume) {
        double raw = logic * LOGIC_WEIGHT + technical * TECHNICAL_WEIGHT + timeframe * TIMEFRAME_WEIGHT + volume * VOLUME_WEIGHT;
        return Math.round(Math.max(0.0, Math.min(100.0, raw)) * 10.0) / 10.0;
    }

    static SignalAction determineAction(double strength, boolean patternADetected, double technicalScore) {
        SignalAction action;
        if (strength >= STRONG_BUY_THRESHOLD) {
            action = SignalAction.STRONG_BUY;
        } else if (strength >= BUY_THRESHOLD) {
            action = SignalAction.BUY;
        } else if (strength <= SELL_THRESHOLD) {
            action = SignalAction.SELL;
        } else if (strength <= WATCH_THRESHOLD) {
            action = SignalAction.WATCH;
        } else {
            action = SignalAction.HOLD;
        }

        if (patternADetected && action == SignalAction.BUY) {
            action = SignalAction.STRONG_BUY;
        }
        if (technicalScore < WEAK_TECHNICAL_THRESHOLD) {
            if (action == SignalAction.STRONG_BUY) {
                action = SignalAction.BUY;
            } else if (action == SignalAction.BUY) {
                action = SignalAction.WATCH;
            }
        }
        return action;
    }

    static List<String> executionNotes(SignalAction action, double strength, double riskReward, double changeRate) {
        List<String> notes = new ArrayList<>();
        switch (action) {
            case STRONG_BUY:
                notes.add("Strong buy signal: act within the entry window");
                notes.add("Follow the profit-target and stop-loss rules strictly");
                break;
            case BUY:
                notes.add("Buy signal: enter at a suitable moment");
                notes.add("Keep risk management tight");
                break;
            case WATCH:
                notes.add("Keep watching until conditions improve");
                break;
            default:
                break;
        }
        if (strength < 70.0) {
            notes.add("Moderate signal strength; confirm before acting");
        }
        if (riskReward < 2.0) {
            notes.add("Risk/reward ratio below 2.0; decide carefully");
        }
        if (Math.abs(changeRate) > 15.0) {
            notes.add(String.format(Locale.US, "High volatility (%.1f%%); expect sharp price swings", changeRate));
        }
        return List.copyOf(notes);
    }

    static String validate(StockSnapshot snapshot) {
        if (snapshot.symbol == null || snapshot.symbol.isBlank()) {
            return "symbol missing";
        }
        if (snapshot.name == null || snapshot.name.isBlank()) {
            return "name missing";
        }
        if (!Double.isFinite(snapshot.price) || snapshot.price <= 0.0) {
            return "price must be positive";
        }
        if (!Double.isFinite(snapshot.changeRate)) {
            return "change rate not finite";
        }
        if (snapshot.volume < 0) {
            return "volume must not be negative";
        }
        return null;
    }

    private static Map<PatternId, Double> buildPatternWeights() {
        Map<PatternId, Double> weights = new EnumMap<>(PatternId.class);
        weights.put(PatternId.A_LEGACY, 0.20);
        weights.put(PatternId.A, 0.35);
        weights.put(PatternId.B_LEGACY, 0.15);
        weights.put(PatternId.B, 0.30);
        return Collections.unmodifiableMap(weights);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
