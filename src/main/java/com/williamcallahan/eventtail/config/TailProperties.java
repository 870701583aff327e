package com.williamcallahan.eventtail.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from {@code tail.*}.
 */
@ConfigurationProperties(prefix = "tail")
public class TailProperties {

    private static final String DEFAULT_BASE_URL = "https://api.mdxe.do/tail";
    private static final String POSITIVE_FMT = "%s must be positive (got %s).";
    private static final String BASE_URL_KEY = "tail.base-url";

    private String baseUrl = DEFAULT_BASE_URL;
    private Poll poll = new Poll();
    private Live live = new Live();
    private Cli cli = new Cli();

    /**
     * Validates every group.
     *
     * @throws IllegalArgumentException when a value is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException(BASE_URL_KEY + " must not be blank.");
        }
        requirePositive("tail.poll.interval", poll.getInterval());
        requirePositive("tail.poll.dedup-window", poll.getDedupWindow());
        requirePositive("tail.live.reconnect-base", live.getReconnectBase());
        requirePositive("tail.live.reconnect-max", live.getReconnectMax());
        requirePositive("tail.live.ping-interval", live.getPingInterval());
        if (live.getReconnectMax().compareTo(live.getReconnectBase()) < 0) {
            throw new IllegalArgumentException(String.format(
                    Locale.ROOT,
                    "tail.live.reconnect-max must not be shorter than tail.live.reconnect-base (got %s < %s).",
                    live.getReconnectMax(),
                    live.getReconnectBase()));
        }
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key, value));
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Poll getPoll() {
        return poll;
    }

    public void setPoll(Poll poll) {
        this.poll = poll;
    }

    public Live getLive() {
        return live;
    }

    public void setLive(Live live) {
        this.live = live;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /** Historical polling settings. */
    public static class Poll {
        private Duration interval = Duration.ofMillis(2000);
        private Duration dedupWindow = Duration.ofMillis(60_000);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getDedupWindow() {
            return dedupWindow;
        }

        public void setDedupWindow(Duration dedupWindow) {
            this.dedupWindow = dedupWindow;
        }
    }

    /** Live connection settings. */
    public static class Live {
        private boolean reconnect = true;
        private Duration reconnectBase = Duration.ofMillis(1000);
        private Duration reconnectMax = Duration.ofMillis(30_000);
        private Duration pingInterval = Duration.ofMillis(30_000);

        public boolean isReconnect() {
            return reconnect;
        }

        public void setReconnect(boolean reconnect) {
            this.reconnect = reconnect;
        }

        public Duration getReconnectBase() {
            return reconnectBase;
        }

        public void setReconnectBase(Duration reconnectBase) {
            this.reconnectBase = reconnectBase;
        }

        public Duration getReconnectMax() {
            return reconnectMax;
        }

        public void setReconnectMax(Duration reconnectMax) {
            this.reconnectMax = reconnectMax;
        }

        public Duration getPingInterval() {
            return pingInterval;
        }

        public void setPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
        }
    }

    /** Command line runner settings. */
    public static class Cli {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
