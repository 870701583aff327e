package com.williamcallahan.eventtail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.eventtail.cli.TailCommandRunner;
import com.williamcallahan.eventtail.config.TailProperties;
import com.williamcallahan.eventtail.historical.HistoricalEventFetcher;
import com.williamcallahan.eventtail.live.transport.TailTransport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = {"tail.cli.enabled=false", "tail.base-url=http://localhost:8787/tail"})
class EventTailApplicationTests {

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private TailProperties tailProperties;

    @Test
    void contextLoads() {
        assertEquals(1, applicationContext.getBeansOfType(HistoricalEventFetcher.class).size());
        assertEquals(1, applicationContext.getBeansOfType(TailTransport.class).size());
        assertTrue(applicationContext.getBeansOfType(TailCommandRunner.class).isEmpty());
        assertEquals("http://localhost:8787/tail", tailProperties.getBaseUrl());
    }
}
