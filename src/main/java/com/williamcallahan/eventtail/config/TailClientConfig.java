package com.williamcallahan.eventtail.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventtail.historical.HistoricalEventFetcher;
import com.williamcallahan.eventtail.live.protocol.TailProtocolCodec;
import com.williamcallahan.eventtail.live.transport.ReactorNettyTailTransport;
import com.williamcallahan.eventtail.live.transport.TailTransport;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the shared pieces behind the poller and the live client.
 */
@Configuration
public class TailClientConfig {

    /** Single event loop for timers and transport callbacks. */
    @Bean(destroyMethod = "dispose")
    public Scheduler tailScheduler() {
        return Schedulers.newSingle("event-tail", true);
    }

    @Bean
    public HistoricalEventFetcher historicalEventFetcher(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        return new HistoricalEventFetcher(webClientBuilder, objectMapper);
    }

    @Bean
    public TailTransport tailTransport() {
        return new ReactorNettyTailTransport(new ReactorNettyWebSocketClient());
    }

    @Bean
    public TailProtocolCodec tailProtocolCodec(ObjectMapper objectMapper) {
        return new TailProtocolCodec(objectMapper);
    }

    @Bean
    public Clock tailClock() {
        return Clock.systemUTC();
    }
}
