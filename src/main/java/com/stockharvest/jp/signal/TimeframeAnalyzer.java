package com.stockharvest.jp.signal;

import com.stockharvest.jp.indicator.IndicatorEngine;
import com.stockharvest.jp.model.DailyBar;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TrendDirection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agreement of the daily trend, a weekly trend built from 5-bar groups and the direction of
 * the current session. Consistency is the share of known timeframes trending up.
 */
public final class TimeframeAnalyzer {
    static final int BARS_PER_WEEK = 5;
    static final int MIN_DAILY_BARS = IndicatorEngine.TREND_RECENT + 10;

    private final IndicatorEngine weeklyEngine = new IndicatorEngine(3);

    public TimeframeConsistency analyze(StockSnapshot snapshot, IndicatorSet indicators) {
        Map<String, TrendDirection> trends = new LinkedHashMap<>();
        List<DailyBar> bars = snapshot.series();

        if (snapshot.indicators != null || bars.size() >= MIN_DAILY_BARS) {
            trends.put("daily", indicators == null ? TrendDirection.SIDEWAYS : indicators.trendDirection);
        }
        double[] weekly = weeklyCloses(bars);
        if (weekly.length >= IndicatorEngine.TREND_RECENT + 3) {
            trends.put("weekly", weeklyEngine.trend(weekly));
        }
        if (Double.isFinite(snapshot.changeRate)) {
            trends.put("session", sessionDirection(snapshot.changeRate));
        }
        return TimeframeConsistency.builder()
                .trends(Collections.unmodifiableMap(trends))
                .consistency(consistency(trends))
                .overallDirection(overallDirection(trends))
                .build();
    }

    /**
     * Close of the last bar of each complete 5-bar group, counted back from the newest bar.
     */
    static double[] weeklyCloses(List<DailyBar> bars) {
        int weeks = bars.size() / BARS_PER_WEEK;
        double[] out = new double[weeks];
        int offset = bars.size() - weeks * BARS_PER_WEEK;
        for (int w = 0; w < weeks; w++) {
            out[w] = bars.get(offset + (w + 1) * BARS_PER_WEEK - 1).close;
        }
        return out;
    }

    static TrendDirection sessionDirection(double changeRate) {
        if (changeRate > 0.0) {
            return TrendDirection.UP;
        }
        if (changeRate < 0.0) {
            return TrendDirection.DOWN;
        }
        return TrendDirection.SIDEWAYS;
    }

    static double consistency(Map<String, TrendDirection> trends) {
        if (trends.isEmpty()) {
            return 50.0;
        }
        long up = trends.values().stream().filter(t -> t == TrendDirection.UP).count();
        return up * 100.0 / trends.size();
    }

    static TrendDirection overallDirection(Map<String, TrendDirection> trends) {
        long up = trends.values().stream().filter(t -> t == TrendDirection.UP).count();
        long down = trends.values().stream().filter(t -> t == TrendDirection.DOWN).count();
        if (up > down) {
            return TrendDirection.UP;
        }
        if (down > up) {
            return TrendDirection.DOWN;
        }
        return TrendDirection.SIDEWAYS;
    }
}
