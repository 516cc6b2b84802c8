package com.stockharvest.jp.pattern;

import com.stockharvest.core.diagnostics.CauseCode;
import com.stockharvest.jp.model.DetectionVerdict;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.PatternId;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TrendDirection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Price-only variant of pattern B used before earnings data was wired in.
 */
public final class LegacyTurnaroundDetector implements PatternDetector {
    private static final Logger LOG = LogManager.getLogger(LegacyTurnaroundDetector.class);

    static final double MIN_RSI = 60.0;
    static final double MIN_CHANGE_RATE = 2.0;
    static final long MIN_VOLUME = 5_000_000L;
    static final double CONFIDENCE = 0.6;

    @Override
    public PatternId patternId() {
        return PatternId.B_LEGACY;
    }

    @Override
    public DetectionVerdict evaluate(StockSnapshot snapshot, IndicatorSet indicators) {
        try {
            IndicatorSet ind = indicators == null ? IndicatorSet.neutral() : indicators;
            boolean technicalSupport = ind.trendDirection != TrendDirection.DOWN
                    || ind.macd > 0.0
                    || ind.bollingerPosition > -0.5;

            List<String> missing = new ArrayList<>();
            if (ind.rsi < MIN_RSI) {
                missing.add(String.format(Locale.US, "RSI %.1f < %.0f", ind.rsi, MIN_RSI));
            }
            if (snapshot.changeRate <= MIN_CHANGE_RATE) {
                missing.add(String.format(Locale.US, "change rate %.2f%% <= %.0f%%", snapshot.changeRate, MIN_CHANGE_RATE));
            }
            if (snapshot.volume <= MIN_VOLUME) {
                missing.add(String.format(Locale.US, "volume %,d <= %,d", snapshot.volume, MIN_VOLUME));
            }
            if (!technicalSupport) {
                missing.add("downtrend without MACD or band support");
            }

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("rsi", ind.rsi);
            evidence.put("macd", ind.macd);
            evidence.put("bollingerPosition", ind.bollingerPosition);
            if (!missing.isEmpty()) {
                return DetectionVerdict.rejected(PatternId.B_LEGACY, CauseCode.LEGACY_CONDITIONS_NOT_MET,
                        "steady advance not met: " + String.join("; ", missing), evidence);
            }
            return DetectionVerdict.detected(PatternId.B_LEGACY,
                    String.format(Locale.US, "steady advance, RSI %.1f", ind.rsi),
                    CONFIDENCE * 100.0, CONFIDENCE, evidence, null);
        } catch (RuntimeException e) {
            LOG.warn("legacy pattern B evaluation failed: {}", e.toString());
            return DetectionVerdict.error(PatternId.B_LEGACY, e);
        }
    }
}
