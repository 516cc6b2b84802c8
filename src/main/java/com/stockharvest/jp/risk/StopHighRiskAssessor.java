package com.stockharvest.jp.risk;

import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.RiskAssessment;
import com.stockharvest.jp.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Additive safety score for stop-high breakouts; higher means safer.
 */
public final class StopHighRiskAssessor {

    public RiskAssessment assess(double changeRate, IndicatorSet indicators) {
        IndicatorSet ind = indicators == null ? IndicatorSet.neutral() : indicators;
        List<String> factors = new ArrayList<>();
        double score = 0.0;

        if (ind.rsi > 80.0) {
            score += 20.0;
            factors.add("overheated");
        } else if (ind.rsi > 70.0) {
            score += 40.0;
            factors.add("RSI elevated");
        } else {
            score += 70.0;
        }

        if (ind.volumeRatio > 3.0) {
            score += 10.0;
            factors.add("abnormal volume");
        } else if (ind.volumeRatio > 2.0) {
            score += 20.0;
            factors.add("heavy volume");
        } else {
            score += 30.0;
        }

        double absRate = Math.abs(changeRate);
        if (absRate > 25.0) {
            factors.add("extreme move");
        } else if (absRate > 15.0) {
            score += 10.0;
            factors.add("large move");
        } else {
            score += 20.0;
        }

        score = Math.min(100.0, score);
        RiskLevel level = levelOf(score);
        return new RiskAssessment(level, score, List.copyOf(factors), recommendationOf(level));
    }

    static RiskLevel levelOf(double score) {
        if (score >= 80.0) {
            return RiskLevel.LOW;
        }
        if (score >= 60.0) {
            return RiskLevel.MEDIUM;
        }
        if (score >= 40.0) {
            return RiskLevel.HIGH;
        }
        return RiskLevel.VERY_HIGH;
    }

    static String recommendationOf(RiskLevel level) {
        switch (level) {
            case LOW:
                return "Normal position size; trail the stop once the target zone is reached";
            case MEDIUM:
                return "Reduce position size and keep the stop-loss tight";
            case HIGH:
                return "Small trial position only, exit on the first close below entry";
            default:
                return "Skip the entry; breakout is too stretched";
        }
    }
}
