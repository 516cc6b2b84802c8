package com.stockharvest.jp.model;

public enum VerdictStatus {
    DETECTED,
    REJECTED,
    ERROR
}
