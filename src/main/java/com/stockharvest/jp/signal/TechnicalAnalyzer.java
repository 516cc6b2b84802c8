package com.stockharvest.jp.signal;

import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.StockSnapshot;

/**
 * Five 0-100 sub-scores describing the technical picture of one snapshot.
 */
public final class TechnicalAnalyzer {

    public TechnicalScores analyze(StockSnapshot snapshot, IndicatorSet indicators) {
        IndicatorSet ind = indicators == null ? IndicatorSet.neutral() : indicators;
        return TechnicalScores.builder()
                .momentum(momentum(ind))
                .trend(trend(ind))
                .volume(volume(ind.volumeRatio))
                .supportResistance(supportResistance(snapshot.changeRate))
                .volatility(volatility(snapshot.changeRate))
                .build();
    }

    static double momentum(IndicatorSet ind) {
        double rsiFactor;
        if (ind.rsi >= 30.0 && ind.rsi <= 70.0) {
            rsiFactor = 0.7;
        } else if (ind.rsi > 70.0) {
            rsiFactor = 0.9;
        } else {
            rsiFactor = 0.3;
        }
        double macdFactor = ind.macd > 0.0 ? 0.8 : 0.4;
        double rocFactor;
        if (ind.rateOfChange > 5.0) {
            rocFactor = 0.9;
        } else if (ind.rateOfChange > 0.0) {
            rocFactor = 0.7;
        } else {
            rocFactor = 0.3;
        }
        return (rsiFactor + macdFactor + rocFactor) / 3.0 * 100.0;
    }

    static double trend(IndicatorSet ind) {
        double score;
        switch (ind.trendDirection) {
            case UP:
                score = 80.0;
                break;
            case DOWN:
                score = 20.0;
                break;
            default:
                score = 50.0;
        }
        // the MA20/MA50 cross only counts when both averages could be computed
        if (ind.ma20 > 0.0 && ind.ma50 > 0.0) {
            score += ind.ma20 > ind.ma50 ? 10.0 : -10.0;
        }
        if (ind.bollingerPosition > 0.5) {
            score += 5.0;
        } else if (ind.bollingerPosition < -0.5) {
            score -= 5.0;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    static double volume(double volumeRatio) {
        if (volumeRatio >= 3.0) {
            return 95.0;
        }
        if (volumeRatio >= 2.0) {
            return 85.0;
        }
        if (volumeRatio >= 1.5) {
            return 75.0;
        }
        if (volumeRatio >= 1.0) {
            return 60.0;
        }
        if (volumeRatio >= 0.5) {
            return 40.0;
        }
        return 20.0;
    }

    static double supportResistance(double changeRate) {
        if (Math.abs(changeRate) < 1.0) {
            return 45.0;
        }
        if (changeRate > 5.0) {
            return 70.0;
        }
        if (changeRate < -5.0) {
            return 30.0;
        }
        return 50.0;
    }

    static double volatility(double changeRate) {
        double abs = Math.abs(changeRate);
        if (abs >= 20.0) {
            return 95.0;
        }
        if (abs >= 10.0) {
            return 80.0;
        }
        if (abs >= 5.0) {
            return 65.0;
        }
        if (abs >= 2.0) {
            return 50.0;
        }
        if (abs >= 1.0) {
            return 35.0;
        }
        return 20.0;
    }
}
