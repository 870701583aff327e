package com.williamcallahan.eventtail.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventtail.config.TailProperties;
import com.williamcallahan.eventtail.domain.TailEvent;
import com.williamcallahan.eventtail.historical.HistoricalEventFetcher;
import com.williamcallahan.eventtail.historical.HistoricalPage;
import com.williamcallahan.eventtail.historical.HistoricalQuery;
import com.williamcallahan.eventtail.historical.HistoricalTailPoller;
import com.williamcallahan.eventtail.historical.PollingOptions;
import com.williamcallahan.eventtail.live.ConnectionState;
import com.williamcallahan.eventtail.live.TailClient;
import com.williamcallahan.eventtail.live.TailClientOptions;
import com.williamcallahan.eventtail.live.protocol.TailProtocolCodec;
import com.williamcallahan.eventtail.live.transport.TailTransport;
import jakarta.annotation.PreDestroy;
import java.io.PrintStream;
import java.net.URI;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.scheduler.Scheduler;

/**
 * The {@code tail} command: prints historical events once, follows them by polling, or streams
 * them live over WebSocket.
 *
 * <p>Follow and live modes run until the application context closes (Ctrl-C), or, in live mode,
 * until the server closes the connection normally.</p>
 */
@Component
@ConditionalOnProperty(prefix = "tail.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TailCommandRunner implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(TailCommandRunner.class);

    private final TailProperties properties;
    private final HistoricalEventFetcher fetcher;
    private final TailTransport transport;
    private final TailProtocolCodec codec;
    private final Scheduler scheduler;
    private final EventConsoleFormatter formatter;
    private final Clock clock;
    private final PrintStream out;
    private final PrintStream err;
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile int exitCode;
    private volatile HistoricalTailPoller activePoller;
    private volatile TailClient activeClient;

    @Autowired
    public TailCommandRunner(
            TailProperties properties,
            HistoricalEventFetcher fetcher,
            TailTransport transport,
            TailProtocolCodec codec,
            Scheduler scheduler,
            ObjectMapper objectMapper,
            Clock clock) {
        this(properties, fetcher, transport, codec, scheduler, objectMapper, clock, System.out, System.err);
    }

    TailCommandRunner(
            TailProperties properties,
            HistoricalEventFetcher fetcher,
            TailTransport transport,
            TailProtocolCodec codec,
            Scheduler scheduler,
            ObjectMapper objectMapper,
            Clock clock,
            PrintStream out,
            PrintStream err) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.transport = transport;
        this.codec = codec;
        this.scheduler = scheduler;
        this.formatter = new EventConsoleFormatter(objectMapper);
        this.clock = clock;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        TailCommandOptions options = TailCommandOptions.parse(args, properties.getBaseUrl(), clock);
        if (!options.json()) {
            err.println("mdxe tail");
            err.println();
        }
        if (options.live()) {
            runLive(options);
        } else if (options.follow()) {
            runFollow(options);
        } else {
            runHistorical(options);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void runLive(TailCommandOptions options) {
        String webSocketUrl = toWebSocketUrl(options.url());
        if (options.verbose()) {
            err.println("Connecting to " + webSocketUrl + " (WebSocket)...");
        }
        TailProperties.Live live = properties.getLive();
        TailClientOptions clientOptions = TailClientOptions.builder(URI.create(webSocketUrl))
                .filter(options.filter())
                .onEvent(event -> print(event, options))
                .onConnect(() -> {
                    if (options.verbose()) {
                        err.println("Connected. Streaming events...");
                    }
                })
                .onDisconnect(() -> handleLiveDisconnect(options))
                .onError(error -> err.println("Error: " + error.getMessage()))
                .reconnect(live.isReconnect())
                .reconnectBase(live.getReconnectBase())
                .reconnectMax(live.getReconnectMax())
                .pingInterval(live.getPingInterval())
                .build();
        TailClient client = new TailClient(clientOptions, transport, codec, scheduler);
        activeClient = client;
        client.connect();
        awaitFinish();
    }

    private void handleLiveDisconnect(TailCommandOptions options) {
        TailClient client = activeClient;
        boolean reconnecting = client != null && client.getState() instanceof ConnectionState.Reconnecting;
        if (options.verbose()) {
            err.println(reconnecting ? "Disconnected. Reconnecting..." : "Disconnected.");
        }
        if (!reconnecting) {
            finished.countDown();
        }
    }

    private void runFollow(TailCommandOptions options) {
        if (options.verbose()) {
            err.println("Polling " + options.url() + "...");
        }
        PollingOptions pollingOptions = PollingOptions.builder(options.url())
                .filter(options.filter())
                .onEvents(events -> events.forEach(event -> print(event, options)))
                .onError(error -> err.println("Polling error: " + error.getMessage()))
                .pollInterval(properties.getPoll().getInterval())
                .dedupWindow(properties.getPoll().getDedupWindow())
                .build();
        HistoricalTailPoller poller = new HistoricalTailPoller(fetcher, pollingOptions, scheduler);
        activePoller = poller;
        poller.start();
        awaitFinish();
    }

    private void runHistorical(TailCommandOptions options) {
        if (options.verbose()) {
            err.println("Fetching historical events from " + options.url() + "...");
        }
        HistoricalQuery query = HistoricalQuery.of(options.url())
                .withFilter(options.filter())
                .withSince(options.since())
                .withUntil(options.until())
                .withLimit(options.limit());
        try {
            HistoricalPage page = fetcher.fetchHistoricalEvents(query).block();
            if (page == null) {
                page = HistoricalPage.empty();
            }
            page.events().forEach(event -> print(event, options));
            if (options.verbose()) {
                err.println("Fetched " + page.events().size() + " event(s)");
                if (page.hasMore()) {
                    err.println("More events available. Use --limit to fetch more.");
                }
            }
        } catch (RuntimeException fetchFailure) {
            Throwable cause = Exceptions.unwrap(fetchFailure);
            log.debug("Historical fetch failed", cause);
            err.println("Error: " + cause.getMessage());
            exitCode = 1;
        }
    }

    private void print(TailEvent event, TailCommandOptions options) {
        out.println(formatter.format(event, options.json(), options.noColor()));
    }

    private void awaitFinish() {
        try {
            finished.await();
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while tailing");
        }
    }

    /** Stops the active poller or client and releases a waiting {@link #run(String...)}. */
    @PreDestroy
    public void shutdown() {
        HistoricalTailPoller poller = activePoller;
        if (poller != null) {
            poller.stop();
        }
        TailClient client = activeClient;
        if (client != null) {
            client.disconnect();
        }
        finished.countDown();
    }

    static String toWebSocketUrl(String url) {
        if (url.startsWith("http")) {
            return "ws" + url.substring("http".length());
        }
        return url;
    }
}
