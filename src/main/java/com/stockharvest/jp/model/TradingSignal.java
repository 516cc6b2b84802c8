package com.stockharvest.jp.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class TradingSignal {
    public final String symbol;
    public final String name;
    public final SignalAction action;
    public final double signalStrength;
    public final double confidence;
    public final double currentPrice;
    public final double entryPrice;
    public final Double profitTarget;
    public final Double stopLoss;
    public final double riskRewardRatio;
    public final long recommendedShares;
    public final double positionValue;
    public final double portfolioExposure;
    public final RiskAssessment riskAssessment;
    public final Map<String, Double> componentScores;
    public final List<DetectionVerdict> detections;
    public final boolean executable;
    public final List<String> executionNotes;
    public final String errorMessage;
    public final Instant generatedAt;

    public static TradingSignal error(String symbol, String name, double price, String message, Instant generatedAt) {
        return TradingSignal.builder()
                .symbol(symbol == null ? "" : symbol)
                .name(name == null ? "" : name)
                .action(SignalAction.ERROR)
                .currentPrice(price)
                .entryPrice(price)
                .riskAssessment(new RiskAssessment(RiskLevel.VERY_HIGH, 0.0, List.of("evaluation failed"), "Do not trade"))
                .componentScores(Map.of())
                .detections(List.of())
                .executionNotes(List.of())
                .errorMessage(message == null ? "unknown error" : message)
                .generatedAt(generatedAt)
                .build();
    }

    public boolean isError() {
        return action == SignalAction.ERROR;
    }
}
