package com.stockharvest.jp.model;

public enum RiskLevel {
    VERY_LOW,
    LOW,
    MEDIUM,
    MEDIUM_HIGH,
    HIGH,
    VERY_HIGH
}
