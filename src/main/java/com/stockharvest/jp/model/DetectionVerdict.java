package com.stockharvest.jp.model;

import com.stockharvest.core.diagnostics.CauseCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Result of running one detector against one snapshot.
 */
public final class DetectionVerdict {
    public final VerdictStatus status;
    public final PatternId patternId;
    public final String reason;
    public final CauseCode causeCode;
    public final double strength;
    public final double confidence;
    public final Map<String, Object> evidence;
    public final PatternSignal signal;

    private DetectionVerdict(
            VerdictStatus status,
            PatternId patternId,
            String reason,
            CauseCode causeCode,
            double strength,
            double confidence,
            Map<String, Object> evidence,
            PatternSignal signal
    ) {
        this.status = status;
        this.patternId = patternId;
        this.reason = reason == null || reason.isBlank() ? status.name().toLowerCase(Locale.ROOT) : reason;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.strength = clamp(strength, 0.0, 100.0);
        this.confidence = clamp(confidence, 0.0, 1.0);
        this.evidence = copy(evidence);
        this.signal = signal;
    }

    public static DetectionVerdict detected(
            PatternId patternId,
            String reason,
            double strength,
            double confidence,
            Map<String, Object> evidence,
            PatternSignal signal
    ) {
        return new DetectionVerdict(VerdictStatus.DETECTED, patternId, reason, CauseCode.NONE, strength, confidence, evidence, signal);
    }

    public static DetectionVerdict rejected(PatternId patternId, CauseCode causeCode, String reason) {
        return rejected(patternId, causeCode, reason, Map.of());
    }

    public static DetectionVerdict rejected(PatternId patternId, CauseCode causeCode, String reason, Map<String, Object> evidence) {
        return new DetectionVerdict(VerdictStatus.REJECTED, patternId, reason, causeCode, 0.0, 0.0, evidence, null);
    }

    public static DetectionVerdict error(PatternId patternId, Throwable cause) {
        String message = cause == null ? "unknown" : String.valueOf(cause.getMessage());
        return new DetectionVerdict(VerdictStatus.ERROR, patternId, "evaluation error: " + message, CauseCode.RUNTIME_ERROR, 0.0, 0.0, Map.of(), null);
    }

    public boolean detected() {
        return status == VerdictStatus.DETECTED;
    }

    @Override
    public String toString() {
        return patternId + "/" + status + "(" + causeCode + "): " + reason;
    }

    private static double clamp(double value, double min, double max) {
        if (!Double.isFinite(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    private static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : in.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                out.put(entry.getKey(), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
