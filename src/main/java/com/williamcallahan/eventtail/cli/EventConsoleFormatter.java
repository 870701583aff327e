package com.williamcallahan.eventtail.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventtail.domain.EventImportance;
import com.williamcallahan.eventtail.domain.TailEvent;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Renders events for the terminal.
 *
 * <p>Text lines read {@code TIMESTAMP IMPORTANCE SOURCE TYPE [DATA]}, for example
 * {@code 2024-01-30 20:00:00.000 normal   mdxe-build build_started {"target":"production"}}.</p>
 */
public class EventConsoleFormatter {

    static final String RESET = "\u001b[0m";
    static final String RED = "\u001b[31m";
    static final String YELLOW = "\u001b[33m";
    static final String GRAY = "\u001b[90m";
    static final String CYAN = "\u001b[36m";
    static final String DIM = "\u001b[2m";

    private static final int IMPORTANCE_WIDTH = 8;
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    public EventConsoleFormatter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Formats one event.
     *
     * @param event event to render
     * @param json render as a single JSON line, ignoring {@code noColor}
     * @param noColor omit ANSI escape codes
     * @return printable line without a trailing newline
     */
    public String format(TailEvent event, boolean json, boolean noColor) {
        if (json) {
            return toJson(event);
        }
        String timestamp = TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(event.timestamp()));
        String importance = padRight(event.importance().wireValue());
        String data = event.data().isEmpty() ? "" : toJson(event.data());

        if (noColor) {
            return timestamp + " " + importance + " " + event.source() + " " + event.type()
                    + (data.isEmpty() ? "" : " " + data);
        }
        return DIM + timestamp + RESET + " "
                + getColorForImportance(event.importance()) + importance + RESET + " "
                + CYAN + event.source() + RESET + " "
                + event.type()
                + (data.isEmpty() ? "" : " " + DIM + data + RESET);
    }

    /**
     * Returns the ANSI color used for an importance level.
     *
     * @param importance level to color
     * @return escape sequence; normal events use the reset code
     */
    public static String getColorForImportance(EventImportance importance) {
        return switch (importance) {
            case CRITICAL -> RED;
            case HIGH -> YELLOW;
            case LOW -> GRAY;
            case NORMAL -> RESET;
        };
    }

    private static String padRight(String value) {
        StringBuilder padded = new StringBuilder(value);
        while (padded.length() < IMPORTANCE_WIDTH) {
            padded.append(' ');
        }
        return padded.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException serializationFailure) {
            throw new IllegalStateException("Failed to serialize event for output", serializationFailure);
        }
    }
}
