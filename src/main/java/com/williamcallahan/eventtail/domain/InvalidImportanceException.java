package com.williamcallahan.eventtail.domain;

/**
 * Signals that an importance value is not one of {@code low}, {@code normal}, {@code high} or
 * {@code critical}.
 */
public class InvalidImportanceException extends IllegalArgumentException {

    private final String rejectedValue;

    /**
     * Creates an exception for the rejected value.
     *
     * @param rejectedValue value that failed validation, may be null
     */
    public InvalidImportanceException(String rejectedValue) {
        super("Invalid importance: " + rejectedValue + " (expected one of low, normal, high, critical)");
        this.rejectedValue = rejectedValue;
    }

    /**
     * Returns the value that failed validation.
     *
     * @return rejected value, may be null
     */
    public String getRejectedValue() {
        return rejectedValue;
    }
}
