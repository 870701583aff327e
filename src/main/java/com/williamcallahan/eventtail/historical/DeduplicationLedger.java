package com.williamcallahan.eventtail.historical;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Remembers recently delivered event keys for a fixed window.
 *
 * <p>An entry is forgotten once its age reaches the window, after which the same key counts as new
 * again. Time is read from the supplied millisecond clock so the window follows the poller's
 * scheduler rather than the system clock.</p>
 */
final class DeduplicationLedger {

    private final Cache<String, Long> seenKeys;
    private final LongSupplier clockMillis;

    DeduplicationLedger(Duration window, LongSupplier clockMillis) {
        this.clockMillis = Objects.requireNonNull(clockMillis, "clockMillis");
        this.seenKeys = Caffeine.newBuilder()
                .expireAfterWrite(window)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clockMillis.getAsLong()))
                .executor(Runnable::run)
                .build();
    }

    /** Drops every entry whose window has elapsed. */
    void evictExpired() {
        seenKeys.cleanUp();
    }

    /**
     * Records a key unless it is still remembered.
     *
     * @return true when the key was new
     */
    boolean recordIfAbsent(String key) {
        if (seenKeys.getIfPresent(key) != null) {
            return false;
        }
        seenKeys.put(key, clockMillis.getAsLong());
        return true;
    }

    long size() {
        return seenKeys.estimatedSize();
    }
}
