package com.williamcallahan.eventtail.config;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import reactor.core.publisher.Hooks;

/**
 * Routes errors Reactor drops after a subscriber has gone away into the application log.
 *
 * <p>Closing a WebSocket or stopping a poll mid-request often surfaces a late channel-closed or
 * cancellation error. Those are logged at DEBUG; anything else stays at WARN.</p>
 */
@Configuration
public class ReactorHooksConfig {

    private static final Logger log = LoggerFactory.getLogger(ReactorHooksConfig.class);

    @EventListener(ContextRefreshedEvent.class)
    public void configureDroppedErrorHandler() {
        Hooks.onErrorDropped(error -> {
            if (isExpectedShutdownError(error)) {
                log.debug("Dropped expected connection shutdown error (exceptionType={})",
                        error.getClass().getSimpleName());
            } else {
                log.warn("Dropped unexpected error", error);
            }
        });
        log.debug("Reactor dropped-error hook configured");
    }

    static boolean isExpectedShutdownError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ClosedChannelException
                    || current instanceof CancellationException
                    || current instanceof InterruptedException) {
                return true;
            }
            if (current instanceof IOException) {
                String message = current.getMessage();
                if (message != null && message.toLowerCase(Locale.ROOT).contains("connection reset")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
