package com.stockharvest.jp.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScreeningConfigTest {

    @Test
    void defaults_shouldMatchBuiltInThresholds() {
        ScreeningConfig config = ScreeningConfig.defaults();

        assertEquals(15.0, config.patternAMinChangeRate, 1e-9);
        assertEquals(0.98, config.patternAStopHighProximity, 1e-9);
        assertEquals(20_000_000L, config.patternAMinVolume);
        assertEquals(0.15, config.patternAMaxLowerShadowRatio, 1e-9);
        assertEquals(0.02, config.patternBMa5CrossoverThreshold, 1e-9);
        assertEquals(2, config.patternBMinLossQuarters);
        assertEquals(6, config.patternBDedupMonths);
        assertEquals(1.0, config.patternBEntryMinChangeRate, 1e-9);
        assertEquals(8.0, config.patternBEntryMaxChangeRate, 1e-9);
        assertEquals(10_000_000.0, config.portfolioSize, 1e-9);
        assertEquals(100, config.lotSize);
        assertEquals(50, config.historyCapacity);
    }

    @Test
    void from_shouldRejectProximityAboveOne() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ScreeningConfig.from(Config.of(Map.of("patternA.stop_high_proximity", "1.2"))));

        assertTrue(e.getMessage().contains("patternA.stop_high_proximity"));
    }

    @Test
    void validate_shouldRejectNonPositiveLotSize() {
        ScreeningConfig broken = ScreeningConfig.defaults().toBuilder().lotSize(0).build();

        assertThrows(IllegalArgumentException.class, broken::validate);
    }

    @Test
    void validate_shouldRequireFullScaleAboveTrigger() {
        ScreeningConfig broken = ScreeningConfig.defaults().toBuilder().patternAStrengthFullScalePct(5.0).build();

        assertThrows(IllegalArgumentException.class, broken::validate);
    }

    @Test
    void from_shouldRejectMinChangeRateBelowEntryTrigger() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ScreeningConfig.from(Config.of(Map.of("patternA.min_change_rate", "3"))));

        assertTrue(e.getMessage().contains("patternA.min_change_rate"), e.getMessage());
    }

    @Test
    void from_shouldAcceptMinChangeRateEqualToEntryTrigger() {
        ScreeningConfig config = ScreeningConfig.from(Config.of(Map.of("patternA.min_change_rate", "5")));

        assertEquals(5.0, config.patternAMinChangeRate, 1e-9);
    }

    @Test
    void validate_shouldRejectNonPositiveEntryTrigger() {
        ScreeningConfig zero = ScreeningConfig.defaults().toBuilder().patternAEntryTriggerPct(0.0).build();
        ScreeningConfig negative = ScreeningConfig.defaults().toBuilder().patternAEntryTriggerPct(-2.0).build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, zero::validate);
        assertTrue(e.getMessage().contains("patternA.entry_trigger_pct"), e.getMessage());
        assertThrows(IllegalArgumentException.class, negative::validate);
    }

    @Test
    void validate_shouldRejectInvertedTurnaroundEntryRange() {
        ScreeningConfig broken = ScreeningConfig.defaults().toBuilder()
                .patternBEntryMinChangeRate(8.0).patternBEntryMaxChangeRate(1.0).build();

        assertThrows(IllegalArgumentException.class, broken::validate);
    }
}
