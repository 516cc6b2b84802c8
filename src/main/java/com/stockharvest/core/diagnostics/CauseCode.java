package com.stockharvest.core.diagnostics;

/**
 * Machine-readable cause attached to every rejected or failed result, so callers can branch
 * without matching on reason text.
 */
public enum CauseCode {
    NONE,
    LISTING_NOT_ELIGIBLE,
    NOT_STOP_HIGH,
    LOWER_SHADOW_TOO_LONG,
    OUTSIDE_EARNINGS_WINDOW,
    CONSECUTIVE_STOP_HIGH,
    UNEXPLAINED_SPIKE,
    ALREADY_DETECTED,
    NO_EARNINGS_DATA,
    LATEST_QUARTER_NOT_PROFITABLE,
    LOSS_RUN_TOO_SHORT,
    MA5_UNAVAILABLE,
    NO_MA5_CROSSOVER,
    ENTRY_CONDITIONS_NOT_MET,
    TAX_LOSS_CARRYFORWARD,
    EXCESSIVE_VOLATILITY,
    LOW_LIQUIDITY,
    RECENTLY_DETECTED,
    LEGACY_CONDITIONS_NOT_MET,
    FETCH_FAILED,
    RUNTIME_ERROR
}
