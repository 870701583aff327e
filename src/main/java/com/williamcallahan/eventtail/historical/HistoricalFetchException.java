package com.williamcallahan.eventtail.historical;

/**
 * Raised when the history endpoint answers with a non-success status or no body at all.
 */
public class HistoricalFetchException extends RuntimeException {

    private static final String MESSAGE_PREFIX = "Failed to fetch historical events: ";

    private final int statusCode;

    /**
     * Creates an exception for a non-success HTTP response.
     *
     * @param statusCode HTTP status code
     * @param statusText reason phrase, may be empty
     */
    public HistoricalFetchException(int statusCode, String statusText) {
        super(MESSAGE_PREFIX + statusCode + (statusText == null || statusText.isEmpty() ? "" : " " + statusText));
        this.statusCode = statusCode;
    }

    /**
     * Creates an exception for a successful response that carried no usable body.
     *
     * @param message description of the failure
     */
    public HistoricalFetchException(String message) {
        super(message);
        this.statusCode = 0;
    }

    /**
     * Returns the HTTP status that caused the failure.
     *
     * @return status code, or 0 when the failure was not a status error
     */
    public int getStatusCode() {
        return statusCode;
    }
}
