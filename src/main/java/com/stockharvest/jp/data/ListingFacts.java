package com.stockharvest.jp.data;

import java.time.LocalDate;

public final class ListingFacts {
    public final boolean newlyListed;
    public final LocalDate listingDate;
    public final boolean withinEarningsWindow;

    public ListingFacts(boolean newlyListed, LocalDate listingDate, boolean withinEarningsWindow) {
        this.newlyListed = newlyListed;
        this.listingDate = listingDate;
        this.withinEarningsWindow = withinEarningsWindow;
    }

    public static ListingFacts unknown() {
        return new ListingFacts(false, null, false);
    }
}
