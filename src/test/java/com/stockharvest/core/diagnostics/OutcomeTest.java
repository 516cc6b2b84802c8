package com.stockharvest.core.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutcomeTest {

    @Test
    void success_shouldCarryValueAndNoCause() {
        Outcome<Integer> outcome = Outcome.success(3, "scan");

        assertTrue(outcome.success);
        assertEquals(3, outcome.value);
        assertEquals(CauseCode.NONE, outcome.causeCode);
        assertEquals(3, outcome.orElse(7));
    }

    @Test
    void failure_shouldFallBackAndKeepCause() {
        Outcome<Integer> outcome = Outcome.failure(CauseCode.FETCH_FAILED, "scan", "timeout");

        assertFalse(outcome.success);
        assertNull(outcome.value);
        assertEquals(CauseCode.FETCH_FAILED, outcome.causeCode);
        assertEquals("timeout", outcome.message);
        assertEquals(7, outcome.orElse(7));
    }

    @Test
    void details_shouldDropNullEntriesAndBeImmutable() {
        Map<String, Object> details = new HashMap<>();
        details.put("price", 1500.0);
        details.put("missing", null);

        Outcome<Void> outcome = Outcome.failure(CauseCode.NOT_STOP_HIGH, "patternA", "below", details);

        assertEquals(1, outcome.details.size());
        assertThrows(UnsupportedOperationException.class, () -> outcome.details.put("x", 1));
    }
}
