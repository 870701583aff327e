package com.williamcallahan.eventtail.live.protocol;

import com.williamcallahan.eventtail.domain.EventFilter;
import com.williamcallahan.eventtail.domain.TailEvent;

/**
 * Frames the live tail server may send.
 */
public sealed interface TailServerMessage {

    /** Delivers one event matching the active subscription. */
    record EventMessage(TailEvent event) implements TailServerMessage {}

    /** Answers a ping; {@code timestamp} is the server's clock in epoch milliseconds. */
    record Pong(long timestamp) implements TailServerMessage {}

    /** Confirms a subscription, echoing the filter the server applied. */
    record Subscribed(EventFilter filter) implements TailServerMessage {}

    /** Confirms an unsubscribe. */
    record Unsubscribed() implements TailServerMessage {}

    /** Reports a server-side problem with the previous request. */
    record ErrorMessage(String message) implements TailServerMessage {}
}
