package com.stockharvest.jp.model;

import java.time.LocalDate;

public final class QuarterlyEarnings {
    public final LocalDate quarterEnd;
    public final double operatingIncome;

    public QuarterlyEarnings(LocalDate quarterEnd, double operatingIncome) {
        this.quarterEnd = quarterEnd;
        this.operatingIncome = operatingIncome;
    }

    public boolean isProfit() {
        return operatingIncome > 0.0;
    }
}
