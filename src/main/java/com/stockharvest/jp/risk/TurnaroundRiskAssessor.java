package com.stockharvest.jp.risk;

import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.RiskAssessment;
import com.stockharvest.jp.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Deduction table for earnings-turnaround entries, starting from 70.
 */
public final class TurnaroundRiskAssessor {
    static final double BASE_SCORE = 70.0;

    public RiskAssessment assess(double changeRate, long volume, IndicatorSet indicators) {
        IndicatorSet ind = indicators == null ? IndicatorSet.neutral() : indicators;
        List<String> factors = new ArrayList<>();
        double score = BASE_SCORE;

        if (Math.abs(changeRate) < 2.0) {
            score -= 10.0;
            factors.add("weak price reaction");
        }
        if (volume < 10_000_000L) {
            score -= 15.0;
            factors.add("thin liquidity");
        }
        if (ind.rsi > 75.0 || ind.rsi < 40.0) {
            score -= 10.0;
            factors.add("RSI outside 40-75");
        }

        score = Math.max(0.0, score);
        RiskLevel level = levelOf(score);
        return new RiskAssessment(level, score, List.copyOf(factors), recommendationOf(level));
    }

    static RiskLevel levelOf(double score) {
        if (score >= 85.0) {
            return RiskLevel.LOW;
        }
        if (score >= 70.0) {
            return RiskLevel.MEDIUM;
        }
        if (score >= 55.0) {
            return RiskLevel.MEDIUM_HIGH;
        }
        return RiskLevel.HIGH;
    }

    static String recommendationOf(RiskLevel level) {
        switch (level) {
            case LOW:
                return "Turnaround confirmed; standard position size";
            case MEDIUM:
                return "Enter in two tranches and confirm the next quarter";
            case MEDIUM_HIGH:
                return "Half position; review after the next earnings release";
            default:
                return "Watch only until liquidity and momentum improve";
        }
    }
}
