package com.williamcallahan.eventtail.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TailEvent} creation and JSON shape.
 */
class TailEventTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-01-30T20:00:00Z"), ZoneOffset.UTC);

    @Test
    void builderStampsTimestampAndDefaultsImportance() {
        TailEvent event = TailEvent.builder("mdxe-build", "build_started")
                .data(Map.of("target", "production"))
                .clock(FIXED_CLOCK)
                .build();

        assertEquals(FIXED_CLOCK.millis(), event.timestamp());
        assertEquals(EventImportance.NORMAL, event.importance());
        assertEquals("production", event.data().get("target"));
        assertNull(event.traceId());
    }

    @Test
    void createRejectsUnknownImportance() {
        assertThrows(
                InvalidImportanceException.class,
                () -> TailEvent.create("mdxe", "build_started", "urgent", Map.of(), null, null));
        assertThrows(
                InvalidImportanceException.class,
                () -> TailEvent.create("mdxe", "build_started", "HIGH", Map.of(), null, null));
    }

    @Test
    void createAcceptsMissingImportance() {
        TailEvent event = TailEvent.create("mdxe", "build_started", null, null, "trace-1", "cause-1");

        assertEquals(EventImportance.NORMAL, event.importance());
        assertTrue(event.data().isEmpty());
        assertEquals("cause-1", event.causationId());
    }

    @Test
    void dataIsDetachedFromCallerMap() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("step", 1);
        payload.put("note", null);
        TailEvent event = TailEvent.builder("s", "t").data(payload).build();

        payload.put("step", 2);

        assertEquals(1, event.data().get("step"));
        assertTrue(event.data().containsKey("note"));
        assertThrows(UnsupportedOperationException.class, () -> event.data().put("x", 1));
    }

    @Test
    void deduplicationKeyPrefersTraceId() {
        TailEvent traced = TailEvent.builder("s", "t").timestamp(42L).traceId("trace-9").build();
        TailEvent untraced = TailEvent.builder("s", "t").timestamp(42L).build();

        assertEquals("trace-9", traced.deduplicationKey());
        assertEquals("42:s:t", untraced.deduplicationKey());
    }

    @Test
    void serializesWithLowercaseImportanceAndWithoutNullIds() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        TailEvent event = TailEvent.builder("mdxe-build", "build_started")
                .importance(EventImportance.HIGH)
                .data(Map.of("target", "production"))
                .timestamp(1_706_644_800_000L)
                .build();

        String json = objectMapper.writeValueAsString(event);

        assertEquals(
                "{\"timestamp\":1706644800000,\"source\":\"mdxe-build\",\"type\":\"build_started\","
                        + "\"importance\":\"high\",\"data\":{\"target\":\"production\"}}",
                json);
        assertEquals(event, objectMapper.readValue(json, TailEvent.class));
    }

    @Test
    void decodingDefaultsMissingOptionalFields() throws Exception {
        TailEvent event = new ObjectMapper()
                .readValue("{\"timestamp\":5,\"source\":\"s\",\"type\":\"t\",\"extra\":true}", TailEvent.class);

        assertEquals(5L, event.timestamp());
        assertEquals(EventImportance.NORMAL, event.importance());
        assertTrue(event.data().isEmpty());
    }

    @Test
    void decodingRejectsEventWithoutTimestamp() {
        ObjectMapper objectMapper = new ObjectMapper();

        assertThrows(
                JsonProcessingException.class,
                () -> objectMapper.readValue("{\"source\":\"s\",\"type\":\"t\"}", TailEvent.class));
        assertThrows(
                JsonProcessingException.class,
                () -> objectMapper.readValue("{\"timestamp\":null,\"source\":\"s\",\"type\":\"t\"}", TailEvent.class));
    }

    @Test
    void decodingRejectsUppercaseImportance() {
        assertThrows(
                JsonProcessingException.class,
                () -> new ObjectMapper()
                        .readValue(
                                "{\"timestamp\":5,\"source\":\"s\",\"type\":\"t\",\"importance\":\"HIGH\"}",
                                TailEvent.class));
    }
}
