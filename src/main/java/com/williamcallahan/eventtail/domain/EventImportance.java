package com.williamcallahan.eventtail.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered importance levels carried by every tail event.
 *
 * <p>Declaration order is the ordering used by filters: an event passes a minimum-importance
 * threshold when its level is at or above the threshold.</p>
 */
public enum EventImportance {
    /** Routine chatter such as progress ticks. */
    LOW("low"),

    /** Default level for lifecycle events. */
    NORMAL("normal"),

    /** Events an operator usually wants to see, such as failed tests. */
    HIGH("high"),

    /** Events that need immediate attention, such as a failed deploy. */
    CRITICAL("critical");

    private final String wireValue;

    EventImportance(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Returns the lowercase name used on the wire and in query strings.
     *
     * @return wire representation of this level
     */
    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Checks whether this level satisfies an inclusive minimum threshold.
     *
     * @param threshold minimum level
     * @return true when this level is at or above the threshold
     */
    public boolean isAtLeast(EventImportance threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * Resolves a wire value into a level.
     *
     * <p>Matching is exact: {@code "HIGH"} and {@code " high"} are rejected.</p>
     *
     * @param value wire value such as {@code "high"}
     * @return matching level
     * @throws InvalidImportanceException when the value names no known level
     */
    @JsonCreator
    public static EventImportance fromWireValue(String value) {
        for (EventImportance importance : values()) {
            if (importance.wireValue.equals(value)) {
                return importance;
            }
        }
        throw new InvalidImportanceException(value);
    }

    /**
     * Reports whether a string names one of the known levels.
     *
     * @param value candidate wire value
     * @return true when {@link #fromWireValue(String)} would succeed
     */
    public static boolean isValid(String value) {
        for (EventImportance importance : values()) {
            if (importance.wireValue.equals(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Compares two wire values by importance.
     *
     * @param first first wire value
     * @param second second wire value
     * @return negative, zero or positive as the first level is lower than, equal to or higher than the second
     * @throws InvalidImportanceException when either value is unknown
     */
    public static int compare(String first, String second) {
        return fromWireValue(first).compareTo(fromWireValue(second));
    }
}
