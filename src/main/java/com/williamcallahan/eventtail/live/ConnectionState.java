package com.williamcallahan.eventtail.live;

import com.williamcallahan.eventtail.live.transport.TailConnection;
import reactor.core.Disposable;

/**
 * Connection lifecycle of a {@link TailClient}.
 *
 * <p>Each variant carries exactly the resources that exist in that state, so a timer or socket can
 * only be reached while it is meaningful.</p>
 */
public sealed interface ConnectionState {

    /** No socket and no pending reconnect. */
    record Disconnected() implements ConnectionState {}

    /** A socket is being opened. */
    record Connecting(long connectionId, TailConnection connection) implements ConnectionState {}

    /** The socket is open and the keepalive timer is running. */
    record Open(long connectionId, TailConnection connection, Disposable keepalive) implements ConnectionState {}

    /** The previous socket closed abnormally; a reconnect is scheduled after {@code delayMillis}. */
    record Reconnecting(Disposable timer, long delayMillis) implements ConnectionState {}

    /** Shared instance for the disconnected state. */
    ConnectionState DISCONNECTED = new Disconnected();
}
