package com.stockharvest.jp.scan;

import com.stockharvest.core.diagnostics.CauseCode;
import com.stockharvest.core.diagnostics.Outcome;
import com.stockharvest.jp.model.DetectionVerdict;
import com.stockharvest.jp.model.TradingSignal;

/**
 * Per-symbol scan result. Failed fetches carry no signal and count as "no detection".
 */
public final class ScanOutcome {
    private static final String OWNER = "scan";

    public final String symbol;
    public final Outcome<TradingSignal> outcome;

    private ScanOutcome(String symbol, Outcome<TradingSignal> outcome) {
        this.symbol = symbol;
        this.outcome = outcome;
    }

    public static ScanOutcome of(String symbol, TradingSignal signal) {
        return new ScanOutcome(symbol, Outcome.success(signal, OWNER));
    }

    public static ScanOutcome failed(String symbol, CauseCode causeCode, String message) {
        return new ScanOutcome(symbol, Outcome.failure(causeCode, OWNER, message));
    }

    public TradingSignal signal() {
        return outcome.orElse(null);
    }

    public double strength() {
        TradingSignal signal = signal();
        return signal == null || signal.isError() ? 0.0 : signal.signalStrength;
    }

    public boolean anyDetected() {
        TradingSignal signal = signal();
        if (signal == null || signal.detections == null) {
            return false;
        }
        for (DetectionVerdict verdict : signal.detections) {
            if (verdict.detected()) {
                return true;
            }
        }
        return false;
    }
}
