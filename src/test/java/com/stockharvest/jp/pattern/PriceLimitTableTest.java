package com.stockharvest.jp.pattern;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PriceLimitTableTest {

    @Test
    void limitFor_shouldFollowExchangeBands() {
        assertEquals(30.0, PriceLimitTable.limitFor(99.0));
        assertEquals(50.0, PriceLimitTable.limitFor(100.0));
        assertEquals(300.0, PriceLimitTable.limitFor(1250.0));
        assertEquals(400.0, PriceLimitTable.limitFor(1500.0));
        assertEquals(1_500.0, PriceLimitTable.limitFor(9_999.0));
        assertEquals(4_000_000.0, PriceLimitTable.limitFor(20_000_000.0));
    }

    @Test
    void stopHighPrice_shouldAddLimitToBase() {
        assertEquals(1550.0, PriceLimitTable.stopHighPrice(1250.0));
    }

    @Test
    void limitFor_shouldBeZeroForInvalidBase() {
        assertEquals(0.0, PriceLimitTable.limitFor(-1.0));
        assertEquals(0.0, PriceLimitTable.limitFor(Double.NaN));
    }
}
