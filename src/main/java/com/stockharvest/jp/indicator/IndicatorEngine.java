package com.stockharvest.jp.indicator;

import com.stockharvest.jp.model.DailyBar;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TrendDirection;

import java.util.List;

/**
 * Derives an {@link IndicatorSet} from an oldest-first bar series. Never throws; any indicator
 * whose lookback is not covered by the series keeps its neutral value.
 */
public final class IndicatorEngine {
    public static final int RSI_PERIOD = 14;
    public static final int MACD_FAST = 12;
    public static final int MACD_SLOW = 26;
    public static final int BOLLINGER_PERIOD = 20;
    public static final double BOLLINGER_K = 2.0;
    public static final int VOLUME_PERIOD = 20;
    public static final int TREND_RECENT = 3;
    public static final double TREND_DEADBAND = 0.02;

    private final int trendWindow;

    public IndicatorEngine() {
        this(10);
    }

    public IndicatorEngine(int trendWindow) {
        this.trendWindow = Math.max(3, trendWindow);
    }

    /**
     * Precomputed indicators on the snapshot win; otherwise they are computed from its bars.
     * Precomputed sets without MA5 get it filled in from the bars when enough closes exist.
     */
    public IndicatorSet resolve(StockSnapshot snapshot) {
        if (snapshot == null) {
            return IndicatorSet.neutral();
        }
        IndicatorSet given = snapshot.indicators;
        if (given == null) {
            return compute(snapshot.series());
        }
        if (!given.hasMa5()) {
            double[] closes = closes(snapshot.series());
            double ma5 = sma(closes, 5);
            if (ma5 > 0.0) {
                return given.withMovingAverage5(ma5, smaAtOffset(closes, 5, 1));
            }
        }
        return given;
    }

    public IndicatorSet compute(List<DailyBar> bars) {
        if (bars == null || bars.isEmpty()) {
            return IndicatorSet.neutral();
        }
        double[] closes = closes(bars);
        double[] volumes = new double[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            volumes[i] = bars.get(i).volume;
        }

        double lastClose = closes[closes.length - 1];
        double avgVolume = sma(volumes, VOLUME_PERIOD);
        double volumeRatio = avgVolume <= 0.0 ? IndicatorSet.NEUTRAL_VOLUME_RATIO : volumes[volumes.length - 1] / avgVolume;

        return new IndicatorSet(
                rsi(closes, RSI_PERIOD),
                macd(closes),
                bollingerPosition(closes, lastClose),
                volumeRatio,
                trend(closes),
                sma(closes, 5),
                smaAtOffset(closes, 5, 1),
                sma(closes, 20),
                sma(closes, 50),
                returnPct(closes, 10)
        );
    }

    /**
     * Mean of the last three closes against the mean of the window before them, with a
     * two percent deadband.
     */
    public TrendDirection trend(double[] closes) {
        if (closes == null || closes.length < TREND_RECENT + trendWindow) {
            return TrendDirection.SIDEWAYS;
        }
        double recent = smaAtOffset(closes, TREND_RECENT, 0);
        double prior = smaAtOffset(closes, trendWindow, TREND_RECENT);
        if (prior <= 0.0) {
            return TrendDirection.SIDEWAYS;
        }
        double change = (recent - prior) / prior;
        if (change > TREND_DEADBAND) {
            return TrendDirection.UP;
        }
        if (change < -TREND_DEADBAND) {
            return TrendDirection.DOWN;
        }
        return TrendDirection.SIDEWAYS;
    }

    public static double[] closes(List<DailyBar> bars) {
        if (bars == null) {
            return new double[0];
        }
        double[] out = new double[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            out[i] = bars.get(i).close;
        }
        return out;
    }

    static double sma(double[] values, int period) {
        return smaAtOffset(values, period, 0);
    }

    static double smaAtOffset(double[] values, int period, int offset) {
        if (period <= 0 || offset < 0 || values.length < period + offset) {
            return 0.0;
        }
        int endExclusive = values.length - offset;
        double sum = 0.0;
        for (int i = endExclusive - period; i < endExclusive; i++) {
            sum += values[i];
        }
        return sum / period;
    }

    // Wilder smoothing seeded with the simple average of the first period.
    static double rsi(double[] closes, int period) {
        if (closes.length <= period) {
            return IndicatorSet.NEUTRAL_RSI;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double diff = closes[i] - closes[i - 1];
            if (diff >= 0) {
                gain += diff;
            } else {
                loss -= diff;
            }
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;

        for (int i = period + 1; i < closes.length; i++) {
            double diff = closes[i] - closes[i - 1];
            double currentGain = diff > 0 ? diff : 0.0;
            double currentLoss = diff < 0 ? -diff : 0.0;
            avgGain = (avgGain * (period - 1) + currentGain) / period;
            avgLoss = (avgLoss * (period - 1) + currentLoss) / period;
        }
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? IndicatorSet.NEUTRAL_RSI : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    static double macd(double[] closes) {
        if (closes.length < MACD_SLOW) {
            return 0.0;
        }
        return ema(closes, MACD_FAST) - ema(closes, MACD_SLOW);
    }

    static double ema(double[] values, int period) {
        if (period <= 0 || values.length < period) {
            return 0.0;
        }
        double alpha = 2.0 / (period + 1.0);
        double value = 0.0;
        for (int i = 0; i < period; i++) {
            value += values[i];
        }
        value /= period;
        for (int i = period; i < values.length; i++) {
            value = alpha * values[i] + (1.0 - alpha) * value;
        }
        return value;
    }

    static double bollingerPosition(double[] closes, double price) {
        if (closes.length < BOLLINGER_PERIOD) {
            return 0.0;
        }
        double mean = sma(closes, BOLLINGER_PERIOD);
        double sumSq = 0.0;
        for (int i = closes.length - BOLLINGER_PERIOD; i < closes.length; i++) {
            double d = closes[i] - mean;
            sumSq += d * d;
        }
        double halfWidth = BOLLINGER_K * Math.sqrt(sumSq / BOLLINGER_PERIOD);
        if (halfWidth <= 0.0) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, (price - mean) / halfWidth));
    }

    static double returnPct(double[] closes, int days) {
        if (closes.length <= days) {
            return 0.0;
        }
        double prev = closes[closes.length - 1 - days];
        if (prev == 0.0) {
            return 0.0;
        }
        return (closes[closes.length - 1] - prev) / prev * 100.0;
    }
}
