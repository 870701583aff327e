package com.williamcallahan.eventtail.historical;

import com.williamcallahan.eventtail.domain.TailEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Polls the history endpoint forward in time, delivering each event once per dedup window.
 *
 * <p>Each poll asks for events since the highest timestamp seen so far. Because that bound is
 * inclusive, events sharing the boundary timestamp come back on the next poll and are suppressed
 * by the ledger. The next poll is scheduled only after the current one settles, so polls never
 * overlap.</p>
 *
 * <p>{@link #stop()} cancels the pending timer synchronously. A fetch already in flight may still
 * complete; its result is dropped without touching the watermark or the ledger.</p>
 */
public class HistoricalTailPoller {
    private static final Logger log = LoggerFactory.getLogger(HistoricalTailPoller.class);

    private static final Counter DELIVERED_EVENT_COUNTER = Metrics.counter("eventtail.poller.events.delivered");
    private static final Counter FAILED_POLL_COUNTER = Metrics.counter("eventtail.poller.failures");

    private final HistoricalEventFetcher fetcher;
    private final PollingOptions options;
    private final Scheduler scheduler;
    private final HistoricalQuery baseQuery;
    private final DeduplicationLedger ledger;

    private boolean polling;
    private long generation;
    private Long watermark;
    private Disposable pendingPoll;

    /**
     * Creates an idle poller.
     *
     * @param fetcher fetcher used for every poll
     * @param options endpoint, filter, callbacks and timing
     * @param scheduler scheduler that runs timers and continuations and supplies the clock
     */
    public HistoricalTailPoller(HistoricalEventFetcher fetcher, PollingOptions options, Scheduler scheduler) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.options = Objects.requireNonNull(options, "options");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.baseQuery = HistoricalQuery.of(options.baseUrl()).withFilter(options.filter());
        this.ledger = new DeduplicationLedger(options.dedupWindow(), () -> scheduler.now(TimeUnit.MILLISECONDS));
    }

    /**
     * Starts polling with an immediate first poll. No-op while already polling.
     *
     * <p>A restart after {@link #stop()} keeps the previous watermark and ledger.</p>
     */
    public synchronized void start() {
        if (polling) {
            return;
        }
        polling = true;
        long startGeneration = ++generation;
        log.debug("Starting historical poller for {} (generation {})", options.baseUrl(), startGeneration);
        pendingPoll = null;
        Disposable firstPoll = scheduler.schedule(() -> poll(startGeneration));
        // The first poll may already have run and armed the next timer on an immediate scheduler.
        if (pendingPoll == null) {
            pendingPoll = firstPoll;
        }
    }

    /** Stops polling. Idempotent. */
    public synchronized void stop() {
        if (!polling) {
            return;
        }
        polling = false;
        if (pendingPoll != null) {
            pendingPoll.dispose();
            pendingPoll = null;
        }
        log.debug("Stopped historical poller for {}", options.baseUrl());
    }

    public synchronized boolean isPolling() {
        return polling;
    }

    /**
     * Returns the highest event timestamp seen so far.
     *
     * @return watermark in epoch milliseconds, empty before the first non-empty page
     */
    public synchronized OptionalLong watermark() {
        return watermark == null ? OptionalLong.empty() : OptionalLong.of(watermark);
    }

    private boolean isCurrent(long pollGeneration) {
        return polling && pollGeneration == generation;
    }

    private synchronized void poll(long pollGeneration) {
        if (!isCurrent(pollGeneration)) {
            return;
        }
        pendingPoll = null;
        ledger.evictExpired();
        HistoricalQuery query = watermark == null ? baseQuery : baseQuery.withSince(watermark);

        Mono<HistoricalPage> request;
        try {
            request = fetcher.fetchHistoricalEvents(query);
        } catch (RuntimeException fetchFailure) {
            request = Mono.error(fetchFailure);
        }
        request.defaultIfEmpty(HistoricalPage.empty())
                .subscribe(
                        page -> dispatch(() -> handlePage(pollGeneration, page)),
                        failure -> dispatch(() -> handleFailure(pollGeneration, failure)));
    }

    private void dispatch(Runnable continuation) {
        try {
            scheduler.schedule(continuation);
        } catch (RejectedExecutionException rejected) {
            log.debug("Scheduler rejected poll continuation; poller is shutting down");
        }
    }

    private synchronized void handlePage(long pollGeneration, HistoricalPage page) {
        if (!isCurrent(pollGeneration)) {
            log.debug("Discarding page of {} events that arrived after stop", page.events().size());
            return;
        }
        List<TailEvent> freshEvents = new ArrayList<>();
        for (TailEvent event : page.events()) {
            if (ledger.recordIfAbsent(event.deduplicationKey())) {
                freshEvents.add(event);
            }
            if (watermark == null || event.timestamp() > watermark) {
                watermark = event.timestamp();
            }
        }
        DELIVERED_EVENT_COUNTER.increment(freshEvents.size());
        try {
            options.onEvents().accept(List.copyOf(freshEvents));
        } catch (RuntimeException callbackFailure) {
            log.warn("onEvents callback failed", callbackFailure);
        }
        scheduleNext(pollGeneration);
    }

    private synchronized void handleFailure(long pollGeneration, Throwable failure) {
        if (!isCurrent(pollGeneration)) {
            log.debug("Discarding poll failure that arrived after stop: {}", failure.toString());
            return;
        }
        FAILED_POLL_COUNTER.increment();
        log.warn("Historical poll failed: {}", failure.getMessage());
        if (options.onError() != null) {
            try {
                options.onError().accept(failure);
            } catch (RuntimeException callbackFailure) {
                log.warn("onError callback failed", callbackFailure);
            }
        }
        scheduleNext(pollGeneration);
    }

    private void scheduleNext(long pollGeneration) {
        if (!isCurrent(pollGeneration)) {
            return;
        }
        try {
            pendingPoll = scheduler.schedule(
                    () -> poll(pollGeneration), options.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException rejected) {
            log.debug("Scheduler rejected next poll; poller is shutting down");
        }
    }
}
