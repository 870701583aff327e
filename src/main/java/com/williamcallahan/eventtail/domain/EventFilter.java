package com.williamcallahan.eventtail.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Selects tail events by source, type and minimum importance.
 *
 * <p>Every field is optional; an unset field matches every event, so an empty filter matches
 * everything. The same filter is sent to the live server on subscribe and flattened into query
 * parameters for historical requests.</p>
 *
 * @param source exact source or a glob where {@code *} matches any run of characters
 * @param type exact event type; {@code *} has no special meaning here
 * @param minImportance inclusive importance threshold
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"source", "type", "minImportance"})
public record EventFilter(String source, String type, EventImportance minImportance) {

    private static final EventFilter EMPTY = new EventFilter(null, null, null);
    private static final char WILDCARD = '*';

    /** Returns the filter that matches every event. */
    public static EventFilter empty() {
        return EMPTY;
    }

    /** Returns a filter on source only. */
    public static EventFilter bySource(String source) {
        return new EventFilter(source, null, null);
    }

    /** Returns a copy with the given source pattern. */
    public EventFilter withSource(String source) {
        return new EventFilter(source, type, minImportance);
    }

    /** Returns a copy with the given type. */
    public EventFilter withType(String type) {
        return new EventFilter(source, type, minImportance);
    }

    /** Returns a copy with the given minimum importance. */
    public EventFilter withMinImportance(EventImportance minImportance) {
        return new EventFilter(source, type, minImportance);
    }

    /**
     * Reports whether no field is set.
     *
     * @return true when this filter matches every event
     */
    @JsonIgnore
    public boolean isEmpty() {
        return source == null && type == null && minImportance == null;
    }

    /**
     * Tests an event against every set field. Never throws.
     *
     * @param event candidate event, null never matches
     * @return true when every set field matches
     */
    public boolean matches(TailEvent event) {
        if (event == null) {
            return false;
        }
        if (source != null && !matchesGlob(source, event.source())) {
            return false;
        }
        if (type != null && !type.equals(event.type())) {
            return false;
        }
        return minImportance == null || event.importance().isAtLeast(minImportance);
    }

    /**
     * Null-tolerant form of {@link #matches(TailEvent)}: a null filter matches every event.
     *
     * @param event candidate event
     * @param filter filter, may be null
     * @return true when the event passes the filter
     */
    public static boolean matches(TailEvent event, EventFilter filter) {
        if (filter == null) {
            return event != null;
        }
        return filter.matches(event);
    }

    static boolean matchesGlob(String pattern, String value) {
        if (value == null) {
            return false;
        }
        if (pattern.indexOf(WILDCARD) < 0) {
            return pattern.equals(value);
        }
        String[] literals = pattern.split("\\*", -1);
        String prefix = literals[0];
        if (!value.startsWith(prefix)) {
            return false;
        }
        int cursor = prefix.length();
        int lastIndex = literals.length - 1;
        for (int literalIndex = 1; literalIndex < lastIndex; literalIndex++) {
            String literal = literals[literalIndex];
            int found = value.indexOf(literal, cursor);
            if (found < 0) {
                return false;
            }
            cursor = found + literal.length();
        }
        String suffix = literals[lastIndex];
        return value.length() - cursor >= suffix.length() && value.endsWith(suffix);
    }
}
