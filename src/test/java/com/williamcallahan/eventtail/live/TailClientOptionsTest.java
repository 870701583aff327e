package com.williamcallahan.eventtail.live;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TailClientOptionsTest {

    @Test
    void appliesDefaults() {
        TailClientOptions options = TailClientOptions.builder("wss://api.mdxe.do/tail").build();

        assertFalse(options.reconnect());
        assertEquals(Duration.ofMillis(1000), options.reconnectBase());
        assertEquals(Duration.ofMillis(30_000), options.reconnectMax());
        assertEquals(Duration.ofMillis(30_000), options.pingInterval());
        assertNull(options.filter());
    }

    @Test
    void rejectsInvalidTiming() {
        IllegalArgumentException zeroPing = assertThrows(
                IllegalArgumentException.class,
                () -> TailClientOptions.builder("wss://x").pingInterval(Duration.ZERO).build());
        assertTrue(zeroPing.getMessage().contains("pingInterval"));

        IllegalArgumentException inverted = assertThrows(
                IllegalArgumentException.class,
                () -> TailClientOptions.builder("wss://x")
                        .reconnectBase(Duration.ofSeconds(5))
                        .reconnectMax(Duration.ofSeconds(1))
                        .build());
        assertTrue(inverted.getMessage().contains("reconnectMax"));
    }
}
