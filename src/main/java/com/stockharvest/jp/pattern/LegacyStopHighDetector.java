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
 * Loose momentum variant of pattern A: a strong up day on heavy volume with at least one
 * confirming indicator. Keeps no history.
 */
public final class LegacyStopHighDetector implements PatternDetector {
    private static final Logger LOG = LogManager.getLogger(LegacyStopHighDetector.class);

    static final double MIN_CHANGE_RATE = 5.0;
    static final long MIN_VOLUME = 10_000_000L;
    static final double CONFIDENCE = 0.7;

    @Override
    public PatternId patternId() {
        return PatternId.A_LEGACY;
    }

    @Override
    public DetectionVerdict evaluate(StockSnapshot snapshot, IndicatorSet indicators) {
        try {
            IndicatorSet ind = indicators == null ? IndicatorSet.neutral() : indicators;
            boolean confirmed = ind.rsi >= 70.0 || ind.trendDirection == TrendDirection.UP || ind.volumeRatio > 1.5;

            List<String> missing = new ArrayList<>();
            if (snapshot.changeRate < MIN_CHANGE_RATE) {
                missing.add(String.format(Locale.US, "change rate %.2f%% < %.0f%%", snapshot.changeRate, MIN_CHANGE_RATE));
            }
            if (snapshot.volume <= MIN_VOLUME) {
                missing.add(String.format(Locale.US, "volume %,d <= %,d", snapshot.volume, MIN_VOLUME));
            }
            if (!confirmed) {
                missing.add("no RSI, trend or volume confirmation");
            }

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("rsi", ind.rsi);
            evidence.put("volumeRatio", ind.volumeRatio);
            evidence.put("trend", ind.trendDirection.name());
            if (!missing.isEmpty()) {
                return DetectionVerdict.rejected(PatternId.A_LEGACY, CauseCode.LEGACY_CONDITIONS_NOT_MET,
                        "momentum breakout not met: " + String.join("; ", missing), evidence);
            }
            return DetectionVerdict.detected(PatternId.A_LEGACY,
                    String.format(Locale.US, "momentum breakout +%.2f%%", snapshot.changeRate),
                    CONFIDENCE * 100.0, CONFIDENCE, evidence, null);
        } catch (RuntimeException e) {
            LOG.warn("legacy pattern A evaluation failed: {}", e.toString());
            return DetectionVerdict.error(PatternId.A_LEGACY, e);
        }
    }
}
