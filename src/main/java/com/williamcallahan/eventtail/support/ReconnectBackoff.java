package com.williamcallahan.eventtail.support;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff schedule for reconnect attempts.
 *
 * <p>Attempt {@code n} (zero based) waits {@code min(base * 2^n, max)}. Doubling stops at the cap
 * so large attempt counts never overflow.</p>
 */
public final class ReconnectBackoff {

    private ReconnectBackoff() {}

    /**
     * Computes the delay before a reconnect attempt.
     *
     * @param attempt zero-based attempt number
     * @param base delay of the first attempt
     * @param max upper bound for any delay
     * @return the delay to wait
     */
    public static Duration delayForAttempt(int attempt, Duration base, Duration max) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        }
        Duration delay = base;
        for (int step = 0; step < attempt && delay.compareTo(max) < 0; step++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
