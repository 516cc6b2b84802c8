package com.stockharvest.jp.signal;

import com.stockharvest.jp.indicator.IndicatorEngine;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.SnapshotFixtures;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TrendDirection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeframeAnalyzerTest {

    private final TimeframeAnalyzer analyzer = new TimeframeAnalyzer();

    @Test
    void analyze_shouldAgreeAcrossTimeframesOnSteadyRise() {
        StockSnapshot snapshot = SnapshotFixtures.quiet()
                .bars(SnapshotFixtures.bars(40, 800.0, 5.0, 1_000_000))
                .build();
        IndicatorSet indicators = new IndicatorEngine().resolve(snapshot);

        TimeframeConsistency result = analyzer.analyze(snapshot, indicators);

        assertEquals(TrendDirection.UP, result.trends.get("daily"));
        assertEquals(TrendDirection.UP, result.trends.get("weekly"));
        assertEquals(TrendDirection.UP, result.trends.get("session"));
        assertEquals(100.0, result.consistency, 1e-9);
        assertEquals(TrendDirection.UP, result.overallDirection);
    }

    @Test
    void analyze_shouldSkipDailyAndWeeklyWithoutHistory() {
        TimeframeConsistency result = analyzer.analyze(SnapshotFixtures.quiet().build(), IndicatorSet.neutral());

        assertFalse(result.trends.containsKey("daily"));
        assertFalse(result.trends.containsKey("weekly"));
        assertEquals(100.0, result.consistency, 1e-9);
    }

    @Test
    void analyze_shouldSplitOnConflictingTimeframes() {
        StockSnapshot snapshot = SnapshotFixtures.quiet()
                .indicators(IndicatorSet.of(40.0, -0.5, -0.2, 1.0, TrendDirection.DOWN))
                .build();

        TimeframeConsistency result = analyzer.analyze(snapshot, snapshot.indicators);

        assertEquals(50.0, result.consistency, 1e-9);
        assertEquals(TrendDirection.SIDEWAYS, result.overallDirection);
    }

    @Test
    void analyze_shouldDefaultToFiftyWhenNothingIsKnown() {
        StockSnapshot snapshot = SnapshotFixtures.quiet().changeRate(Double.NaN).build();

        TimeframeConsistency result = analyzer.analyze(snapshot, null);

        assertTrue(result.trends.isEmpty());
        assertEquals(50.0, result.consistency, 1e-9);
        assertEquals(TrendDirection.SIDEWAYS, result.overallDirection);
    }

    @Test
    void weeklyCloses_shouldTakeLastCloseOfEachCompleteWeek() {
        double[] weekly = TimeframeAnalyzer.weeklyCloses(SnapshotFixtures.bars(12, 100.0, 1.0, 1_000));

        assertArrayEquals(new double[]{106.0, 111.0}, weekly, 1e-9);
    }

    @Test
    void sessionDirection_shouldFollowSign() {
        assertEquals(TrendDirection.DOWN, TimeframeAnalyzer.sessionDirection(-0.1));
        assertEquals(TrendDirection.SIDEWAYS, TimeframeAnalyzer.sessionDirection(0.0));
    }
}
