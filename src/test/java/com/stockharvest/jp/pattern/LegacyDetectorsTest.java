package com.stockharvest.jp.pattern;

import com.stockharvest.core.diagnostics.CauseCode;
import com.stockharvest.jp.model.DetectionVerdict;
import com.stockharvest.jp.model.IndicatorSet;
import com.stockharvest.jp.model.PatternId;
import com.stockharvest.jp.model.SnapshotFixtures;
import com.stockharvest.jp.model.StockSnapshot;
import com.stockharvest.jp.model.TrendDirection;
import com.stockharvest.jp.model.VerdictStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LegacyDetectorsTest {

    private final LegacyStopHighDetector legacyA = new LegacyStopHighDetector();
    private final LegacyTurnaroundDetector legacyB = new LegacyTurnaroundDetector();

    @Test
    void legacyA_shouldDetectMomentumWithVolumeConfirmation() {
        StockSnapshot snapshot = SnapshotFixtures.stopHigh().changeRate(6.0).volume(11_000_000L).build();
        IndicatorSet sideways = IndicatorSet.of(55.0, 0.0, 0.0, 1.6, TrendDirection.SIDEWAYS);

        DetectionVerdict verdict = legacyA.evaluate(snapshot, sideways);

        assertTrue(verdict.detected());
        assertEquals(PatternId.A_LEGACY, verdict.patternId);
        assertEquals(0.7, verdict.confidence, 1e-9);
    }

    @Test
    void legacyA_shouldRequireVolumeAboveTenMillion() {
        StockSnapshot snapshot = SnapshotFixtures.stopHigh().changeRate(6.0).volume(10_000_000L).build();

        DetectionVerdict verdict = legacyA.evaluate(snapshot, snapshot.indicators);

        assertEquals(VerdictStatus.REJECTED, verdict.status);
        assertEquals(CauseCode.LEGACY_CONDITIONS_NOT_MET, verdict.causeCode);
        assertTrue(verdict.reason.contains("volume"));
    }

    @Test
    void legacyA_shouldRequireAConfirmingIndicator() {
        StockSnapshot snapshot = SnapshotFixtures.stopHigh().changeRate(6.0).build();
        IndicatorSet flat = IndicatorSet.of(55.0, 0.0, 0.0, 1.2, TrendDirection.SIDEWAYS);

        assertFalse(legacyA.evaluate(snapshot, flat).detected());
        assertTrue(legacyA.evaluate(snapshot, IndicatorSet.of(72.0, 0.0, 0.0, 1.2, TrendDirection.SIDEWAYS)).detected());
    }

    @Test
    void legacyB_shouldDetectSteadyAdvance() {
        StockSnapshot snapshot = SnapshotFixtures.turnaround().build();

        DetectionVerdict verdict = legacyB.evaluate(snapshot, snapshot.indicators);

        assertTrue(verdict.detected());
        assertEquals(PatternId.B_LEGACY, verdict.patternId);
        assertEquals(0.6, verdict.confidence, 1e-9);
    }

    @Test
    void legacyB_shouldRejectWeakRsi() {
        StockSnapshot snapshot = SnapshotFixtures.turnaround().build();

        DetectionVerdict verdict = legacyB.evaluate(snapshot, IndicatorSet.of(55.0, 1.0, 0.0, 1.5, TrendDirection.UP));

        assertFalse(verdict.detected());
        assertTrue(verdict.reason.contains("RSI"));
    }

    @Test
    void legacyB_shouldRejectDowntrendWithoutSupport() {
        StockSnapshot snapshot = SnapshotFixtures.turnaround().build();
        IndicatorSet down = IndicatorSet.of(62.0, -0.4, -0.8, 1.5, TrendDirection.DOWN);

        assertFalse(legacyB.evaluate(snapshot, down).detected());
        assertTrue(legacyB.evaluate(snapshot, IndicatorSet.of(62.0, 0.3, -0.8, 1.5, TrendDirection.DOWN)).detected());
    }

    @Test
    void legacyDetectors_shouldReturnErrorOnNullSnapshot() {
        assertEquals(VerdictStatus.ERROR, legacyA.evaluate(null, IndicatorSet.neutral()).status);
        assertEquals(VerdictStatus.ERROR, legacyB.evaluate(null, IndicatorSet.neutral()).status);
    }
}
