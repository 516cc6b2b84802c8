package com.stockharvest.jp.model;

import java.util.Locale;

public enum TrendDirection {
    UP,
    DOWN,
    SIDEWAYS;

    public static TrendDirection parse(String raw) {
        if (raw == null) {
            return SIDEWAYS;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "up":
                return UP;
            case "down":
                return DOWN;
            default:
                return SIDEWAYS;
        }
    }
}
