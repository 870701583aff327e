package com.williamcallahan.eventtail.live;

/**
 * Wraps a transport-level failure of the live tail connection.
 */
public class TailConnectionException extends RuntimeException {

    /**
     * Creates an exception with a message.
     *
     * @param message description of the failure
     */
    public TailConnectionException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the transport's cause.
     *
     * @param message description of the failure
     * @param cause underlying transport error
     */
    public TailConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
