package com.williamcallahan.eventtail.live.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventtail.domain.EventFilter;
import com.williamcallahan.eventtail.domain.EventImportance;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TailProtocolCodec} frame encoding and decoding.
 */
class TailProtocolCodecTest {

    private final TailProtocolCodec codec = new TailProtocolCodec(new ObjectMapper());

    @Test
    void encodesClientFrames() {
        assertEquals("{\"type\":\"subscribe\"}", codec.encodeSubscribe(null));
        assertEquals(
                "{\"type\":\"subscribe\",\"filter\":"
                        + "{\"source\":\"mdxe-*\",\"type\":\"build_failed\",\"minImportance\":\"high\"}}",
                codec.encodeSubscribe(new EventFilter("mdxe-*", "build_failed", EventImportance.HIGH)));
        assertEquals("{\"type\":\"subscribe\",\"filter\":{}}", codec.encodeSubscribe(EventFilter.empty()));
        assertEquals("{\"type\":\"unsubscribe\"}", codec.encodeUnsubscribe());
        assertEquals("{\"type\":\"ping\"}", codec.encodePing());
    }

    @Test
    void decodesEventFrame() {
        Optional<TailServerMessage> decoded = codec.decode("{\"type\":\"event\",\"event\":{\"timestamp\":10,"
                + "\"source\":\"mdxe-test\",\"type\":\"test_failed\",\"importance\":\"critical\","
                + "\"data\":{\"file\":\"a.test.ts\"},\"causationId\":\"c-1\"}}");

        TailServerMessage.EventMessage message =
                assertInstanceOf(TailServerMessage.EventMessage.class, decoded.orElseThrow());
        assertEquals(10L, message.event().timestamp());
        assertEquals(EventImportance.CRITICAL, message.event().importance());
        assertEquals("a.test.ts", message.event().data().get("file"));
        assertEquals("c-1", message.event().causationId());
    }

    @Test
    void decodesControlFrames() {
        assertEquals(Optional.of(new TailServerMessage.Pong(99)), codec.decode("{\"type\":\"pong\",\"timestamp\":99}"));
        assertEquals(
                Optional.of(new TailServerMessage.Subscribed(EventFilter.bySource("mdxe-*"))),
                codec.decode("{\"type\":\"subscribed\",\"filter\":{\"source\":\"mdxe-*\"}}"));
        assertEquals(Optional.of(new TailServerMessage.Subscribed(null)), codec.decode("{\"type\":\"subscribed\"}"));
        assertEquals(Optional.of(new TailServerMessage.Unsubscribed()), codec.decode("{\"type\":\"unsubscribed\"}"));
        assertEquals(
                Optional.of(new TailServerMessage.ErrorMessage("bad filter")),
                codec.decode("{\"type\":\"error\",\"message\":\"bad filter\"}"));
    }

    @Test
    void discardsMalformedFrames() {
        assertTrue(codec.decode("not json").isEmpty());
        assertTrue(codec.decode("").isEmpty());
        assertTrue(codec.decode("[1,2]").isEmpty());
        assertTrue(codec.decode("{\"no\":\"type\"}").isEmpty());
        assertTrue(codec.decode("{\"type\":\"mystery\"}").isEmpty());
        assertTrue(codec.decode("{\"type\":\"event\"}").isEmpty());
        assertTrue(codec.decode("{\"type\":\"subscribed\",\"filter\":{\"minImportance\":\"loud\"}}").isEmpty());
    }

    @Test
    void discardsEventWithUnknownOrMiscasedImportance() {
        assertTrue(codec.decode("{\"type\":\"event\",\"event\":{\"timestamp\":1,\"source\":\"s\",\"type\":\"t\","
                        + "\"importance\":\"urgent\"}}")
                .isEmpty());
        assertTrue(codec.decode("{\"type\":\"event\",\"event\":{\"timestamp\":1,\"source\":\"s\",\"type\":\"t\","
                        + "\"importance\":\"HIGH\"}}")
                .isEmpty());
    }

    @Test
    void discardsEventWithoutTimestamp() {
        assertTrue(codec.decode("{\"type\":\"event\",\"event\":{\"source\":\"s\",\"type\":\"t\"}}")
                .isEmpty());
        assertTrue(codec.decode("{\"type\":\"event\",\"event\":{\"timestamp\":null,\"source\":\"s\",\"type\":\"t\"}}")
                .isEmpty());
    }
}
