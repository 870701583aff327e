package com.williamcallahan.eventtail.live.transport;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * {@link TailTransport} backed by Spring's reactive {@link WebSocketClient}, normally
 * {@code ReactorNettyWebSocketClient}.
 *
 * <p>Outbound frames are buffered in a unicast sink until the session opens. Closure is reported
 * exactly once: with the locally requested code, else the code of the server's close frame, else
 * 1006.</p>
 */
public class ReactorNettyTailTransport implements TailTransport {
    private static final Logger log = LoggerFactory.getLogger(ReactorNettyTailTransport.class);


    private final WebSocketClient webSocketClient;

    /**
     * Creates the transport.
     *
     * @param webSocketClient reactive WebSocket client used for every connection
     */
    public ReactorNettyTailTransport(WebSocketClient webSocketClient) {
        this.webSocketClient = Objects.requireNonNull(webSocketClient, "webSocketClient");
    }

    @Override
    public TailConnection open(URI url, TailConnectionListener listener) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(listener, "listener");
        SessionConnection connection = new SessionConnection(url, listener);
        connection.start(webSocketClient);
        return connection;
    }

    private static final class SessionConnection implements TailConnection {
        private final URI url;
        private final TailConnectionListener listener;
        private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        private final AtomicBoolean closeReported = new AtomicBoolean();

        private volatile WebSocketSession session;
        private volatile Disposable exchange;
        private volatile Integer localCloseCode;
        private volatile Integer remoteCloseCode;

        SessionConnection(URI url, TailConnectionListener listener) {
            this.url = url;
            this.listener = listener;
        }

        void start(WebSocketClient webSocketClient) {
            // Subscribing off the caller's thread keeps listener calls out of TailTransport.open.
            exchange = webSocketClient
                    .execute(url, this::handleSession)
                    .subscribeOn(Schedulers.parallel())
                    .subscribe(
                            unused -> {},
                            this::handleExchangeError,
                            () -> reportClose(resolveCloseCode()));
        }

        private Mono<Void> handleSession(WebSocketSession webSocketSession) {
            session = webSocketSession;
            webSocketSession.closeStatus().subscribe(status -> remoteCloseCode = status.getCode());
            log.debug("WebSocket session {} opened to {}", webSocketSession.getId(), url);
            listener.onOpen();

            Mono<Void> inbound = webSocketSession
                    .receive()
                    .map(WebSocketMessage::getPayloadAsText)
                    .doOnNext(listener::onMessage)
                    .doFinally(signal -> outbound.tryEmitComplete())
                    .then();
            Mono<Void> send = webSocketSession.send(outbound.asFlux().map(webSocketSession::textMessage));
            return Mono.when(inbound, send);
        }

        private void handleExchangeError(Throwable error) {
            log.debug("WebSocket exchange with {} failed: {}", url, error.toString());
            listener.onError(error);
            Integer requested = localCloseCode;
            reportClose(requested != null ? requested : TailConnection.ABNORMAL_CLOSURE);
        }

        private int resolveCloseCode() {
            Integer requested = localCloseCode;
            if (requested != null) {
                return requested;
            }
            Integer received = remoteCloseCode;
            return received != null ? received : TailConnection.ABNORMAL_CLOSURE;
        }

        private void reportClose(int code) {
            if (closeReported.compareAndSet(false, true)) {
                log.debug("WebSocket connection to {} closed with code {}", url, code);
                listener.onClose(code);
            }
        }

        @Override
        public void send(String text) {
            Sinks.EmitResult result = outbound.tryEmitNext(text);
            if (result.isFailure()) {
                log.debug("Dropped outbound frame ({}) for {}", result, url);
            }
        }

        @Override
        public void close(int code) {
            localCloseCode = code;
            WebSocketSession current = session;
            if (current != null) {
                current.close(new CloseStatus(code))
                        .subscribe(
                                unused -> {},
                                error -> log.debug("Closing WebSocket session failed: {}", error.toString()));
                return;
            }
            Disposable pending = exchange;
            if (pending != null) {
                pending.dispose();
            }
            reportClose(code);
        }
    }
}
