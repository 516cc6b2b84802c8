package com.stockharvest.jp.pattern;

/**
 * Tokyo Stock Exchange daily price-limit (value limit) table, revised October 2022.
 */
public final class PriceLimitTable {
    private static final double[][] BANDS = {
            {100, 30},
            {200, 50},
            {500, 80},
            {700, 100},
            {1_000, 150},
            {1_500, 300},
            {2_000, 400},
            {3_000, 500},
            {5_000, 700},
            {7_000, 1_000},
            {10_000, 1_500},
            {15_000, 3_000},
            {20_000, 4_000},
            {30_000, 5_000},
            {50_000, 7_000},
            {70_000, 10_000},
            {100_000, 15_000},
            {150_000, 30_000},
            {200_000, 40_000},
            {300_000, 50_000},
            {500_000, 70_000},
            {700_000, 100_000},
            {1_000_000, 150_000},
            {1_500_000, 300_000},
            {2_000_000, 400_000},
            {3_000_000, 500_000},
            {5_000_000, 700_000},
            {7_000_000, 1_000_000},
            {10_000_000, 1_500_000},
            {15_000_000, 3_000_000},
    };
    private static final double TOP_LIMIT = 4_000_000;

    private PriceLimitTable() {
    }

    /**
     * Maximum daily move in yen for a stock whose base (previous close) is {@code basePrice}.
     */
    public static double limitFor(double basePrice) {
        if (!Double.isFinite(basePrice) || basePrice < 0.0) {
            return 0.0;
        }
        for (double[] band : BANDS) {
            if (basePrice < band[0]) {
                return band[1];
            }
        }
        return TOP_LIMIT;
    }

    public static double stopHighPrice(double basePrice) {
        return basePrice + limitFor(basePrice);
    }
}
