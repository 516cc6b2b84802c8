package com.stockharvest.app;

import com.stockharvest.jp.model.DetectionVerdict;
import com.stockharvest.jp.model.PatternSignal;
import com.stockharvest.jp.model.RiskAssessment;
import com.stockharvest.jp.model.TradingSignal;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;

/**
 * Renders trading signals as JSON for the command line and downstream consumers.
 */
final class SignalJsonWriter {

    JSONArray toJson(List<TradingSignal> signals) {
        JSONArray array = new JSONArray();
        for (TradingSignal signal : signals) {
            array.put(toJson(signal));
        }
        return array;
    }

    JSONObject toJson(TradingSignal signal) {
        JSONObject json = new JSONObject();
        json.put("symbol", signal.symbol);
        json.put("name", signal.name);
        json.put("action", signal.action.name());
        json.put("signalStrength", signal.signalStrength);
        json.put("confidence", signal.confidence);
        json.put("currentPrice", signal.currentPrice);
        json.put("entryPrice", signal.entryPrice);
        json.put("profitTarget", signal.profitTarget == null ? JSONObject.NULL : signal.profitTarget);
        json.put("stopLoss", signal.stopLoss == null ? JSONObject.NULL : signal.stopLoss);
        json.put("riskRewardRatio", signal.riskRewardRatio);
        json.put("recommendedShares", signal.recommendedShares);
        json.put("positionValue", signal.positionValue);
        json.put("portfolioExposure", signal.portfolioExposure);
        json.put("executable", signal.executable);
        if (signal.riskAssessment != null) {
            json.put("riskAssessment", toJson(signal.riskAssessment));
        }
        if (signal.componentScores != null) {
            json.put("componentScores", new JSONObject(signal.componentScores));
        }
        JSONArray detections = new JSONArray();
        if (signal.detections != null) {
            for (DetectionVerdict verdict : signal.detections) {
                detections.put(toJson(verdict));
            }
        }
        json.put("detections", detections);
        json.put("executionNotes", signal.executionNotes == null ? new JSONArray() : new JSONArray(signal.executionNotes));
        if (signal.errorMessage != null) {
            json.put("error", signal.errorMessage);
        }
        if (signal.generatedAt != null) {
            json.put("generatedAt", signal.generatedAt.toString());
        }
        return json;
    }

    private JSONObject toJson(DetectionVerdict verdict) {
        JSONObject json = new JSONObject();
        json.put("pattern", verdict.patternId.name());
        json.put("status", verdict.status.name());
        json.put("cause", verdict.causeCode.name());
        json.put("reason", verdict.reason);
        json.put("strength", verdict.strength);
        json.put("confidence", verdict.confidence);
        JSONObject evidence = new JSONObject();
        for (Map.Entry<String, Object> entry : verdict.evidence.entrySet()) {
            evidence.put(entry.getKey(), entry.getValue());
        }
        json.put("evidence", evidence);
        if (verdict.signal != null) {
            PatternSignal plan = verdict.signal;
            JSONObject planJson = new JSONObject();
            planJson.put("entryPrice", plan.entryPrice);
            planJson.put("profitTarget", plan.profitTarget);
            planJson.put("stopLoss", plan.stopLoss);
            planJson.put("maxHoldingDays", plan.maxHoldingDays);
            planJson.put("expectedReturnPct", plan.expectedReturnPct);
            planJson.put("maxLossPct", plan.maxLossPct);
            if (plan.riskAssessment != null) {
                planJson.put("riskAssessment", toJson(plan.riskAssessment));
            }
            json.put("signal", planJson);
        }
        return json;
    }

    private JSONObject toJson(RiskAssessment risk) {
        JSONObject json = new JSONObject();
        json.put("level", risk.riskLevel.name());
        json.put("score", risk.riskScore);
        json.put("factors", new JSONArray(risk.riskFactors));
        json.put("recommendation", risk.recommendation);
        return json;
    }
}
