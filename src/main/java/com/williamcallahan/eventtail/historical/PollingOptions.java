package com.williamcallahan.eventtail.historical;

import com.williamcallahan.eventtail.domain.EventFilter;
import com.williamcallahan.eventtail.domain.TailEvent;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Configuration of a {@link HistoricalTailPoller}.
 *
 * @param baseUrl history endpoint
 * @param filter filter applied server side, null for none
 * @param onEvents receives each poll's new events, possibly an empty list
 * @param onError receives fetch failures, null to only log them
 * @param pollInterval delay between the end of one poll and the start of the next
 * @param dedupWindow how long a delivered event key suppresses redelivery
 */
public record PollingOptions(
        String baseUrl,
        EventFilter filter,
        Consumer<List<TailEvent>> onEvents,
        Consumer<Throwable> onError,
        Duration pollInterval,
        Duration dedupWindow) {

    /** Default delay between polls. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(2000);
    /** Default deduplication window. */
    public static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofMillis(60_000);

    public PollingOptions {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(onEvents, "onEvents");
        pollInterval = pollInterval == null ? DEFAULT_POLL_INTERVAL : pollInterval;
        dedupWindow = dedupWindow == null ? DEFAULT_DEDUP_WINDOW : dedupWindow;
        requirePositive(pollInterval, "pollInterval");
        requirePositive(dedupWindow, "dedupWindow");
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
    }

    /** Starts a builder for the given endpoint. */
    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /** Fluent builder; validation runs in {@link #build()}. */
    public static final class Builder {
        private final String baseUrl;
        private EventFilter filter;
        private Consumer<List<TailEvent>> onEvents;
        private Consumer<Throwable> onError;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration dedupWindow = DEFAULT_DEDUP_WINDOW;

        private Builder(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Builder filter(EventFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder onEvents(Consumer<List<TailEvent>> onEvents) {
            this.onEvents = onEvents;
            return this;
        }

        public Builder onError(Consumer<Throwable> onError) {
            this.onError = onError;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder dedupWindow(Duration dedupWindow) {
            this.dedupWindow = dedupWindow;
            return this;
        }

        public PollingOptions build() {
            return new PollingOptions(baseUrl, filter, onEvents, onError, pollInterval, dedupWindow);
        }
    }
}
