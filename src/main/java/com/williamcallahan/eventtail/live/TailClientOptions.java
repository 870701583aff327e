package com.williamcallahan.eventtail.live;

import com.williamcallahan.eventtail.domain.EventFilter;
import com.williamcallahan.eventtail.domain.TailEvent;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Configuration of a {@link TailClient}.
 *
 * <p>Callbacks are optional. Durations must be positive and {@code reconnectMax} must not be
 * shorter than {@code reconnectBase}.</p>
 */
public record TailClientOptions(
        URI url,
        EventFilter filter,
        Consumer<TailEvent> onEvent,
        Runnable onConnect,
        Runnable onDisconnect,
        Consumer<Throwable> onError,
        boolean reconnect,
        Duration reconnectBase,
        Duration reconnectMax,
        Duration pingInterval) {

    public static final Duration DEFAULT_RECONNECT_BASE = Duration.ofMillis(1000);
    public static final Duration DEFAULT_RECONNECT_MAX = Duration.ofMillis(30_000);
    public static final Duration DEFAULT_PING_INTERVAL = Duration.ofMillis(30_000);

    public TailClientOptions {
        Objects.requireNonNull(url, "url");
        reconnectBase = reconnectBase == null ? DEFAULT_RECONNECT_BASE : reconnectBase;
        reconnectMax = reconnectMax == null ? DEFAULT_RECONNECT_MAX : reconnectMax;
        pingInterval = pingInterval == null ? DEFAULT_PING_INTERVAL : pingInterval;
        requirePositive(reconnectBase, "reconnectBase");
        requirePositive(reconnectMax, "reconnectMax");
        requirePositive(pingInterval, "pingInterval");
        if (reconnectMax.compareTo(reconnectBase) < 0) {
            throw new IllegalArgumentException(
                    "reconnectMax (" + reconnectMax + ") must not be shorter than reconnectBase (" + reconnectBase + ")");
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + duration);
        }
    }

    public static Builder builder(URI url) {
        return new Builder(url);
    }

    public static Builder builder(String url) {
        return new Builder(URI.create(url));
    }

    /**
     * Fluent builder. Reconnection is off unless enabled explicitly.
     */
    public static final class Builder {
        private final URI url;
        private EventFilter filter;
        private Consumer<TailEvent> onEvent;
        private Runnable onConnect;
        private Runnable onDisconnect;
        private Consumer<Throwable> onError;
        private boolean reconnect;
        private Duration reconnectBase = DEFAULT_RECONNECT_BASE;
        private Duration reconnectMax = DEFAULT_RECONNECT_MAX;
        private Duration pingInterval = DEFAULT_PING_INTERVAL;

        private Builder(URI url) {
            this.url = url;
        }

        public Builder filter(EventFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder onEvent(Consumer<TailEvent> onEvent) {
            this.onEvent = onEvent;
            return this;
        }

        public Builder onConnect(Runnable onConnect) {
            this.onConnect = onConnect;
            return this;
        }

        public Builder onDisconnect(Runnable onDisconnect) {
            this.onDisconnect = onDisconnect;
            return this;
        }

        public Builder onError(Consumer<Throwable> onError) {
            this.onError = onError;
            return this;
        }

        public Builder reconnect(boolean reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        public Builder reconnectBase(Duration reconnectBase) {
            this.reconnectBase = reconnectBase;
            return this;
        }

        public Builder reconnectMax(Duration reconnectMax) {
            this.reconnectMax = reconnectMax;
            return this;
        }

        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        public TailClientOptions build() {
            return new TailClientOptions(
                    url,
                    filter,
                    onEvent,
                    onConnect,
                    onDisconnect,
                    onError,
                    reconnect,
                    reconnectBase,
                    reconnectMax,
                    pingInterval);
        }
    }
}
