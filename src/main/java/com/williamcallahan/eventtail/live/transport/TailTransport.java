package com.williamcallahan.eventtail.live.transport;

import java.net.URI;

/**
 * Opens WebSocket connections for the live tail client.
 */
@FunctionalInterface
public interface TailTransport {

    /**
     * Starts opening a connection.
     *
     * <p>Implementations must not invoke the listener before this method returns.</p>
     *
     * @param url WebSocket endpoint
     * @param listener receiver of lifecycle and frame callbacks
     * @return handle on the connection being opened
     */
    TailConnection open(URI url, TailConnectionListener listener);
}
