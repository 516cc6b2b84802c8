package com.stockharvest.jp.indicator;

import com.stockharvest.jp.model.DailyBar;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.SnapshotFixtures;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TrendDirection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndicatorEngineTest {

    private final IndicatorEngine engine = new IndicatorEngine();

    @Test
    void compute_shouldReturnNeutralForNoBars() {
        IndicatorSet ind = engine.compute(List.of());

        assertEquals(50.0, ind.rsi, 1e-9);
        assertEquals(1.0, ind.volumeRatio, 1e-9);
        assertEquals(TrendDirection.SIDEWAYS, ind.trendDirection);
    }

    @Test
    void compute_shouldReadSteadyRise() {
        IndicatorSet ind = engine.compute(SnapshotFixtures.bars(40, 100.0, 1.0, 1_000));

        assertEquals(100.0, ind.rsi, 1e-9);
        assertEquals(TrendDirection.UP, ind.trendDirection);
        assertTrue(ind.macd > 0.0);
        assertTrue(ind.ma5 > ind.ma5Previous);
        assertEquals(137.0, ind.ma5, 1e-9);
        assertTrue(ind.ma20 > ind.ma50 || ind.ma50 == 0.0);
        assertEquals(1.0, ind.volumeRatio, 1e-9);
        assertTrue(ind.bollingerPosition > 0.0);
    }

    @Test
    void compute_shouldReadFlatSeriesAsNeutral() {
        IndicatorSet ind = engine.compute(SnapshotFixtures.bars(30, 500.0, 0.0, 1_000));

        assertEquals(50.0, ind.rsi, 1e-9);
        assertEquals(TrendDirection.SIDEWAYS, ind.trendDirection);
        assertEquals(0.0, ind.bollingerPosition, 1e-9);
        assertEquals(0.0, ind.macd, 1e-9);
    }

    @Test
    void compute_shouldLeaveLongLookbacksNeutralOnShortSeries() {
        IndicatorSet ind = engine.compute(SnapshotFixtures.bars(8, 100.0, 2.0, 1_000));

        assertEquals(50.0, ind.rsi, 1e-9);
        assertEquals(0.0, ind.macd, 1e-9);
        assertEquals(0.0, ind.ma20, 1e-9);
        assertTrue(ind.hasMa5());
    }

    @Test
    void compute_shouldMeasureVolumeAgainstTwentyDayAverage() {
        List<DailyBar> bars = new ArrayList<>(SnapshotFixtures.bars(20, 100.0, 0.0, 1_000));
        DailyBar last = bars.remove(bars.size() - 1);
        bars.add(new DailyBar(last.tradeDate, last.open, last.high, last.low, last.close, 2_000));

        IndicatorSet ind = engine.compute(bars);

        assertEquals(2_000.0 / 1_050.0, ind.volumeRatio, 1e-9);
    }

    @Test
    void resolve_shouldPreferPrecomputedIndicatorsAndFillMa5() {
        IndicatorSet given = IndicatorSet.of(66.0, 0.4, 0.2, 1.3, TrendDirection.UP);
        StockSnapshot withBars = SnapshotFixtures.quiet()
                .indicators(given)
                .bars(SnapshotFixtures.bars(6, 100.0, 1.0, 1_000))
                .build();
        StockSnapshot withoutBars = SnapshotFixtures.quiet().indicators(given).build();

        IndicatorSet filled = engine.resolve(withBars);

        assertEquals(66.0, filled.rsi, 1e-9);
        assertEquals(103.0, filled.ma5, 1e-9);
        assertEquals(102.0, filled.ma5Previous, 1e-9);
        assertSame(given, engine.resolve(withoutBars));
    }

    @Test
    void trend_shouldRespectDeadband() {
        assertEquals(TrendDirection.SIDEWAYS, engine.trend(new double[]{100, 100, 100, 100, 100, 100, 100, 100, 100, 100, 101, 101, 101}));
        assertEquals(TrendDirection.DOWN, engine.trend(new double[]{100, 100, 100, 100, 100, 100, 100, 100, 100, 100, 95, 95, 95}));
        assertEquals(TrendDirection.SIDEWAYS, engine.trend(new double[]{1, 2, 3}));
    }

    @Test
    void returnPct_shouldCompareAgainstCloseNDaysBack() {
        assertEquals(10.0, IndicatorEngine.returnPct(new double[]{100, 105, 110}, 2), 1e-9);
        assertEquals(0.0, IndicatorEngine.returnPct(new double[]{100}, 2), 1e-9);
    }
}
