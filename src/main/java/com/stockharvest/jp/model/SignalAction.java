package com.stockharvest.jp.model;

public enum SignalAction {
    STRONG_BUY,
    BUY,
    WATCH,
    HOLD,
    SELL,
    STRONG_SELL,
    ERROR;

    public boolean isBuy() {
        return this == STRONG_BUY || this == BUY;
    }
}
