package com.williamcallahan.eventtail.live;

import java.util.OptionalLong;

/**
 * Snapshot of live client counters.
 *
 * @param messagesReceived frames received across all connections, including malformed ones
 * @param connectionAttempts connections opened, including reconnects
 * @param lastPingLatencyMs round trip of the most recent answered ping
 */
public record TailClientMetrics(long messagesReceived, long connectionAttempts, OptionalLong lastPingLatencyMs) {}
