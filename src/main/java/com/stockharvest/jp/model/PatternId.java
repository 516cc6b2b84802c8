package com.stockharvest.jp.model;

public enum PatternId {
    A,
    A_LEGACY,
    B,
    B_LEGACY
}
