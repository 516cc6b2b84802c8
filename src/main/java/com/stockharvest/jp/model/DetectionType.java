package com.stockharvest.jp.model;

public enum DetectionType {
    STOP_HIGH,
    PATTERN_A,
    PATTERN_B
}
