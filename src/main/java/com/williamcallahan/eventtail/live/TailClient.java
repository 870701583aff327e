package com.williamcallahan.eventtail.live;

import com.williamcallahan.eventtail.domain.EventFilter;
import com.williamcallahan.eventtail.domain.TailEvent;
import com.williamcallahan.eventtail.live.protocol.TailProtocolCodec;
import com.williamcallahan.eventtail.live.protocol.TailServerMessage;
import com.williamcallahan.eventtail.live.transport.TailConnection;
import com.williamcallahan.eventtail.live.transport.TailConnectionListener;
import com.williamcallahan.eventtail.live.transport.TailTransport;
import com.williamcallahan.eventtail.support.ReconnectBackoff;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

/**
 * Live tail client: keeps one WebSocket subscription open and delivers events as they arrive.
 *
 * <p>Transport callbacks, keepalive pings and reconnect timers all run on the supplied
 * {@link Scheduler}, and every entry point holds the instance monitor, so the state machine only
 * ever sees one transition at a time. Callbacks tagged with an old connection id are ignored,
 * which keeps a late close or frame from a replaced socket from touching the current one.</p>
 *
 * <p>When reconnection is enabled, any close other than 1000 schedules a new connection after
 * {@code min(base * 2^attempt, max)}; a successful open resets the attempt counter and restores
 * the last subscription.</p>
 */
public class TailClient {
    private static final Logger log = LoggerFactory.getLogger(TailClient.class);

    private static final Counter RECEIVED_FRAME_COUNTER = Metrics.counter("eventtail.live.frames.received");
    private static final Counter SCHEDULED_RECONNECT_COUNTER = Metrics.counter("eventtail.live.reconnects.scheduled");

    private final TailClientOptions options;
    private final TailTransport transport;
    private final TailProtocolCodec codec;
    private final Scheduler scheduler;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private long connectionSequence;
    private int reconnectAttempt;
    private boolean disconnectRequested;
    private boolean subscriptionActive;
    private EventFilter lastFilter;
    private Long lastPingSentAt;

    private long messagesReceived;
    private long connectionAttempts;
    private Long lastPingLatencyMs;

    /**
     * Creates a disconnected client.
     *
     * @param options endpoint, filter, callbacks and timing
     * @param transport opens the underlying connections
     * @param codec frame encoder and decoder
     * @param scheduler runs timers and callbacks and supplies the clock
     */
    public TailClient(
            TailClientOptions options, TailTransport transport, TailProtocolCodec codec, Scheduler scheduler) {
        this.options = Objects.requireNonNull(options, "options");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.subscriptionActive = options.filter() != null;
        this.lastFilter = options.filter();
    }

    /**
     * Opens a connection. No-op while connecting or open; cancels a pending reconnect otherwise.
     */
    public synchronized void connect() {
        if (state instanceof ConnectionState.Connecting || state instanceof ConnectionState.Open) {
            return;
        }
        disconnectRequested = false;
        if (state instanceof ConnectionState.Reconnecting reconnecting) {
            reconnecting.timer().dispose();
        }
        openConnection();
    }

    private void openConnection() {
        long connectionId = ++connectionSequence;
        log.debug("Opening live tail connection {} to {}", connectionId, options.url());
        TailConnection connection;
        try {
            connection = transport.open(options.url(), new ConnectionEvents(connectionId));
        } catch (RuntimeException openFailure) {
            state = ConnectionState.DISCONNECTED;
            notifyError(new TailConnectionException("Failed to open WebSocket connection", openFailure));
            if (options.reconnect() && !disconnectRequested) {
                scheduleReconnect(TailConnection.ABNORMAL_CLOSURE);
            }
            return;
        }
        connectionAttempts++;
        state = new ConnectionState.Connecting(connectionId, connection);
    }

    /**
     * Closes the connection with code 1000 and cancels every timer. No callback fires for the closed
     * connection afterwards. Idempotent.
     */
    public synchronized void disconnect() {
        disconnectRequested = true;
        ConnectionState previous = state;
        state = ConnectionState.DISCONNECTED;
        lastPingSentAt = null;
        if (previous instanceof ConnectionState.Reconnecting reconnecting) {
            reconnecting.timer().dispose();
        } else if (previous instanceof ConnectionState.Connecting connecting) {
            closeQuietly(connecting.connection());
        } else if (previous instanceof ConnectionState.Open open) {
            open.keepalive().dispose();
            closeQuietly(open.connection());
        }
    }

    private void closeQuietly(TailConnection connection) {
        try {
            connection.close(TailConnection.NORMAL_CLOSURE);
        } catch (RuntimeException closeFailure) {
            log.debug("Closing live tail connection failed: {}", closeFailure.toString());
        }
    }

    /**
     * Subscribes with the given filter. Ignored unless the connection is open.
     *
     * <p>Only a non-null filter is restored after a reconnect.</p>
     *
     * @param filter filter to apply, null for every event
     */
    public synchronized void subscribe(EventFilter filter) {
        if (!(state instanceof ConnectionState.Open open)) {
            return;
        }
        subscriptionActive = true;
        lastFilter = filter;
        open.connection().send(codec.encodeSubscribe(filter));
    }

    /** Cancels the subscription. Ignored unless the connection is open. */
    public synchronized void unsubscribe() {
        if (!(state instanceof ConnectionState.Open open)) {
            return;
        }
        subscriptionActive = false;
        open.connection().send(codec.encodeUnsubscribe());
    }

    /** Reports whether the connection is open. */
    public synchronized boolean isConnected() {
        return state instanceof ConnectionState.Open;
    }

    /** Returns the current lifecycle state. */
    public synchronized ConnectionState getState() {
        return state;
    }

    /** Returns a snapshot of frame, connection and latency counters. */
    public synchronized TailClientMetrics getMetrics() {
        OptionalLong latency = lastPingLatencyMs == null ? OptionalLong.empty() : OptionalLong.of(lastPingLatencyMs);
        return new TailClientMetrics(messagesReceived, connectionAttempts, latency);
    }

    private synchronized void handleOpen(long connectionId) {
        if (!(state instanceof ConnectionState.Connecting connecting) || connecting.connectionId() != connectionId) {
            return;
        }
        reconnectAttempt = 0;
        TailConnection connection = connecting.connection();
        long pingMillis = options.pingInterval().toMillis();
        Disposable keepalive = scheduler.schedulePeriodically(
                () -> sendPing(connectionId), pingMillis, pingMillis, TimeUnit.MILLISECONDS);
        state = new ConnectionState.Open(connectionId, connection, keepalive);
        log.info("Live tail connected to {}", options.url());
        if (subscriptionActive && lastFilter != null) {
            connection.send(codec.encodeSubscribe(lastFilter));
        }
        runCallback(options.onConnect(), "onConnect");
    }

    private synchronized void sendPing(long connectionId) {
        if (!(state instanceof ConnectionState.Open open) || open.connectionId() != connectionId) {
            return;
        }
        lastPingSentAt = scheduler.now(TimeUnit.MILLISECONDS);
        open.connection().send(codec.encodePing());
    }

    private synchronized void handleMessage(long connectionId, String text) {
        if (!(state instanceof ConnectionState.Open open) || open.connectionId() != connectionId) {
            return;
        }
        messagesReceived++;
        RECEIVED_FRAME_COUNTER.increment();
        Optional<TailServerMessage> decoded = codec.decode(text);
        if (decoded.isEmpty()) {
            return;
        }
        TailServerMessage message = decoded.get();
        if (message instanceof TailServerMessage.EventMessage eventMessage) {
            deliverEvent(eventMessage.event());
        } else if (message instanceof TailServerMessage.Pong) {
            if (lastPingSentAt != null) {
                lastPingLatencyMs = scheduler.now(TimeUnit.MILLISECONDS) - lastPingSentAt;
                lastPingSentAt = null;
            }
        } else if (message instanceof TailServerMessage.ErrorMessage errorMessage) {
            log.warn("Live tail server reported an error: {}", errorMessage.message());
        } else {
            log.debug("Live tail server acknowledged: {}", message);
        }
    }

    private void deliverEvent(TailEvent event) {
        Consumer<TailEvent> onEvent = options.onEvent();
        if (onEvent == null) {
            return;
        }
        try {
            onEvent.accept(event);
        } catch (RuntimeException callbackFailure) {
            log.warn("onEvent callback failed", callbackFailure);
        }
    }

    private synchronized void handleError(long connectionId, Throwable cause) {
        if (!isCurrentConnection(connectionId)) {
            return;
        }
        log.warn("Live tail connection error: {}", cause.toString());
        notifyError(new TailConnectionException("WebSocket error", cause));
    }

    private synchronized void handleClose(long connectionId, int code) {
        if (!isCurrentConnection(connectionId)) {
            return;
        }
        if (state instanceof ConnectionState.Open open) {
            open.keepalive().dispose();
        }
        lastPingSentAt = null;
        boolean abnormal = code != TailConnection.NORMAL_CLOSURE;
        if (options.reconnect() && !disconnectRequested && abnormal) {
            scheduleReconnect(code);
        } else {
            state = ConnectionState.DISCONNECTED;
            log.info("Live tail disconnected (code {})", code);
        }
        runCallback(options.onDisconnect(), "onDisconnect");
    }

    private void scheduleReconnect(int closeCode) {
        long delayMillis = ReconnectBackoff.delayForAttempt(
                        reconnectAttempt, options.reconnectBase(), options.reconnectMax())
                .toMillis();
        reconnectAttempt++;
        SCHEDULED_RECONNECT_COUNTER.increment();
        try {
            Disposable timer = scheduler.schedule(this::reconnectIfPending, delayMillis, TimeUnit.MILLISECONDS);
            state = new ConnectionState.Reconnecting(timer, delayMillis);
            log.info("Live tail disconnected (code {}), reconnecting in {} ms", closeCode, delayMillis);
        } catch (RejectedExecutionException rejected) {
            log.debug("Scheduler rejected reconnect timer; staying disconnected");
            state = ConnectionState.DISCONNECTED;
        }
    }

    private synchronized void reconnectIfPending() {
        if (state instanceof ConnectionState.Reconnecting && !disconnectRequested) {
            openConnection();
        }
    }

    private boolean isCurrentConnection(long connectionId) {
        if (state instanceof ConnectionState.Connecting connecting) {
            return connecting.connectionId() == connectionId;
        }
        if (state instanceof ConnectionState.Open open) {
            return open.connectionId() == connectionId;
        }
        return false;
    }

    private void notifyError(Throwable error) {
        Consumer<Throwable> onError = options.onError();
        if (onError == null) {
            return;
        }
        try {
            onError.accept(error);
        } catch (RuntimeException callbackFailure) {
            log.warn("onError callback failed", callbackFailure);
        }
    }

    private void runCallback(Runnable callback, String name) {
        if (callback == null) {
            return;
        }
        try {
            callback.run();
        } catch (RuntimeException callbackFailure) {
            log.warn("{} callback failed", name, callbackFailure);
        }
    }

    private void dispatch(Runnable task) {
        try {
            scheduler.schedule(task);
        } catch (RejectedExecutionException rejected) {
            log.debug("Scheduler rejected live tail callback; client is shutting down");
        }
    }

    /** Marshals transport callbacks for one connection onto the scheduler. */
    private final class ConnectionEvents implements TailConnectionListener {
        private final long connectionId;

        ConnectionEvents(long connectionId) {
            this.connectionId = connectionId;
        }

        @Override
        public void onOpen() {
            dispatch(() -> handleOpen(connectionId));
        }

        @Override
        public void onMessage(String text) {
            dispatch(() -> handleMessage(connectionId, text));
        }

        @Override
        public void onError(Throwable error) {
            dispatch(() -> handleError(connectionId, error));
        }

        @Override
        public void onClose(int code) {
            dispatch(() -> handleClose(connectionId, code));
        }
    }
}
