package com.williamcallahan.eventtail.live.transport;

/**
 * Handle on one open or opening WebSocket connection.
 */
public interface TailConnection {

    /** Close code for a normal, intentional closure. */
    int NORMAL_CLOSURE = 1000;

    /** Close code reported when the connection dropped without a close frame. */
    int ABNORMAL_CLOSURE = 1006;

    /**
     * Queues a text frame. Frames sent before the connection opens are dropped by implementations
     * that cannot buffer them.
     *
     * @param text frame payload
     */
    void send(String text);

    /**
     * Closes the connection with the given code.
     *
     * @param code WebSocket close code
     */
    void close(int code);
}
