package com.williamcallahan.eventtail.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventtail.domain.EventImportance;
import com.williamcallahan.eventtail.domain.TailEvent;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link EventConsoleFormatter}.
 */
class EventConsoleFormatterTest {

    private static final long TIMESTAMP = 1_706_644_800_000L;

    private final EventConsoleFormatter formatter = new EventConsoleFormatter(new ObjectMapper());

    private static TailEvent event(EventImportance importance, Map<String, Object> data) {
        return TailEvent.builder("mdxe-build", "build_started")
                .importance(importance)
                .data(data)
                .timestamp(TIMESTAMP)
                .build();
    }

    @Test
    void plainTextLineHasTimestampPaddedImportanceSourceTypeAndData() {
        String line = formatter.format(event(EventImportance.NORMAL, Map.of("target", "production")), false, true);

        assertEquals("2024-01-30 20:00:00.000 normal   mdxe-build build_started {\"target\":\"production\"}", line);
    }

    @Test
    void plainTextLineOmitsEmptyData() {
        String line = formatter.format(event(EventImportance.CRITICAL, Map.of()), false, true);

        assertEquals("2024-01-30 20:00:00.000 critical mdxe-build build_started", line);
        assertFalse(line.contains("\u001b["));
    }

    @Test
    void coloredLineUsesImportanceColors() {
        assertTrue(formatter.format(event(EventImportance.CRITICAL, Map.of()), false, false).contains("\u001b[31m"));
        assertTrue(formatter.format(event(EventImportance.HIGH, Map.of()), false, false).contains("\u001b[33m"));
        assertTrue(formatter.format(event(EventImportance.LOW, Map.of()), false, false).contains("\u001b[90m"));

        String normal = formatter.format(event(EventImportance.NORMAL, Map.of("target", "production")), false, false);
        assertTrue(normal.startsWith("\u001b[2m2024-01-30 20:00:00.000\u001b[0m "));
        assertTrue(normal.contains("\u001b[36mmdxe-build\u001b[0m"));
        assertTrue(normal.endsWith(" \u001b[2m{\"target\":\"production\"}\u001b[0m"));
    }

    @Test
    void jsonModeIgnoresColorFlag() {
        TailEvent event = event(EventImportance.HIGH, Map.of("target", "production"));
        String expected = "{\"timestamp\":1706644800000,\"source\":\"mdxe-build\",\"type\":\"build_started\","
                + "\"importance\":\"high\",\"data\":{\"target\":\"production\"}}";

        assertEquals(expected, formatter.format(event, true, false));
        assertEquals(expected, formatter.format(event, true, true));
    }

    @Test
    void mapsImportanceToAnsiColor() {
        assertEquals("\u001b[31m", EventConsoleFormatter.getColorForImportance(EventImportance.CRITICAL));
        assertEquals("\u001b[33m", EventConsoleFormatter.getColorForImportance(EventImportance.HIGH));
        assertEquals("\u001b[0m", EventConsoleFormatter.getColorForImportance(EventImportance.NORMAL));
        assertEquals("\u001b[90m", EventConsoleFormatter.getColorForImportance(EventImportance.LOW));
    }
}
