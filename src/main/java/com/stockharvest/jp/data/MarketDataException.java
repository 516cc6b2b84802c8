package com.stockharvest.jp.data;

/**
 * A market data source could not answer for one symbol.
 */
public class MarketDataException extends Exception {
    private final String symbol;

    public MarketDataException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public MarketDataException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
