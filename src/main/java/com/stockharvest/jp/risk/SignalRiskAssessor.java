package com.stockharvest.jp.risk;

import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.RiskAssessment;
import com.stockharvest.jp.model.RiskLevel;

import java.util.ArrayList;
import java.util.List;

/**
 * Risk of the integrated trading signal: 100 minus penalties for weak strength, volatility,
 * thin volume and extreme RSI.
 */
public final class SignalRiskAssessor {

    public RiskAssessment assess(double signalStrength, double changeRate, IndicatorSet indicators) {
        IndicatorSet ind = indicators == null ? IndicatorSet.neutral() : indicators;
        List<String> factors = new ArrayList<>();
        double score = 100.0;

        if (signalStrength < 60.0) {
            score -= 30.0;
            factors.add("insufficient signal strength");
        }

        double absRate = Math.abs(changeRate);
        if (absRate > 20.0) {
            score -= 25.0;
            factors.add("high volatility");
        } else if (absRate > 10.0) {
            score -= 15.0;
            factors.add("medium volatility");
        }

        if (ind.volumeRatio < 0.5) {
            score -= 20.0;
            factors.add("insufficient volume");
        }

        if (ind.rsi > 80.0) {
            score -= 15.0;
            factors.add("RSI overheated");
        } else if (ind.rsi < 20.0) {
            score -= 10.0;
            factors.add("RSI oversold");
        }

        score = Math.max(0.0, Math.min(100.0, score));
        RiskLevel level = levelOf(score);
        return new RiskAssessment(level, score, List.copyOf(factors), recommendationOf(level));
    }

    static RiskLevel levelOf(double score) {
        if (score >= 90.0) {
            return RiskLevel.VERY_LOW;
        }
        if (score >= 75.0) {
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
            case VERY_LOW:
                return "Very low risk; normal investment decision applies";
            case LOW:
                return "Low risk; suitable for a regular position";
            case MEDIUM:
                return "Moderate risk; invest only with risk controls in place";
            case HIGH:
                return "High risk; use a small amount or analyse further";
            default:
                return "Very high risk; skip or seek a second opinion";
        }
    }
}
