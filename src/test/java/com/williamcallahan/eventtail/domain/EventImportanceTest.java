package com.williamcallahan.eventtail.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link EventImportance} ordering and parsing.
 */
class EventImportanceTest {

    @Test
    void ordersLevelsFromLowToCritical() {
        assertTrue(EventImportance.compare("low", "normal") < 0);
        assertTrue(EventImportance.compare("critical", "high") > 0);
        assertEquals(0, EventImportance.compare("high", "high"));
    }

    @Test
    void thresholdIsInclusive() {
        assertTrue(EventImportance.HIGH.isAtLeast(EventImportance.HIGH));
        assertTrue(EventImportance.CRITICAL.isAtLeast(EventImportance.HIGH));
        assertFalse(EventImportance.NORMAL.isAtLeast(EventImportance.HIGH));
    }

    @Test
    void parsesExactWireValues() {
        assertEquals(EventImportance.CRITICAL, EventImportance.fromWireValue("critical"));
        assertEquals(EventImportance.LOW, EventImportance.fromWireValue("low"));
    }

    @Test
    void rejectsWireValuesThatDifferInCaseOrWhitespace() {
        InvalidImportanceException upperCase =
                assertThrows(InvalidImportanceException.class, () -> EventImportance.fromWireValue("HIGH"));
        assertEquals("HIGH", upperCase.getRejectedValue());
        assertThrows(InvalidImportanceException.class, () -> EventImportance.fromWireValue(" High "));
        assertThrows(InvalidImportanceException.class, () -> EventImportance.compare(" low ", "normal"));
        assertFalse(EventImportance.isValid("Normal"));
        assertFalse(EventImportance.isValid("critical "));
    }

    @Test
    void rejectsUnknownValues() {
        InvalidImportanceException unknown =
                assertThrows(InvalidImportanceException.class, () -> EventImportance.fromWireValue("urgent"));
        assertTrue(unknown.getMessage().contains("urgent"));
        assertThrows(InvalidImportanceException.class, () -> EventImportance.compare("low", "bogus"));
        InvalidImportanceException missing =
                assertThrows(InvalidImportanceException.class, () -> EventImportance.fromWireValue(null));
        assertNull(missing.getRejectedValue());
    }

    @Test
    void validatesWithoutThrowing() {
        assertTrue(EventImportance.isValid("low"));
        assertFalse(EventImportance.isValid("urgent"));
        assertFalse(EventImportance.isValid(null));
    }
}
