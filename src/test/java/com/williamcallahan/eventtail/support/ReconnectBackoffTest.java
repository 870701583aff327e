package com.williamcallahan.eventtail.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies the capped doubling schedule used for reconnects.
 */
class ReconnectBackoffTest {

    private static final Duration BASE = Duration.ofMillis(1000);
    private static final Duration MAX = Duration.ofMillis(30_000);

    @Test
    void doublesFromBaseUntilCap() {
        long[] expectedMillis = {1000, 2000, 4000, 8000, 16_000, 30_000, 30_000};
        for (int attempt = 0; attempt < expectedMillis.length; attempt++) {
            assertEquals(
                    expectedMillis[attempt],
                    ReconnectBackoff.delayForAttempt(attempt, BASE, MAX).toMillis(),
                    "attempt " + attempt);
        }
    }

    @Test
    void largeAttemptCountsDoNotOverflow() {
        assertEquals(MAX, ReconnectBackoff.delayForAttempt(Integer.MAX_VALUE, BASE, MAX));
    }

    @Test
    void rejectsNegativeAttempt() {
        assertThrows(IllegalArgumentException.class, () -> ReconnectBackoff.delayForAttempt(-1, BASE, MAX));
    }
}
