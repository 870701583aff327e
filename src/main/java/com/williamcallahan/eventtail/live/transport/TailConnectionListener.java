package com.williamcallahan.eventtail.live.transport;

/**
 * Receives lifecycle and frame notifications for one connection.
 *
 * <p>Calls may arrive on any thread. {@link #onClose(int)} is delivered at most once and is the last
 * call for a connection.</p>
 */
public interface TailConnectionListener {

    void onOpen();

    void onMessage(String text);

    void onError(Throwable error);

    /**
     * Reports closure.
     *
     * @param code close code, 1006 when the connection dropped without a close frame
     */
    void onClose(int code);
}
