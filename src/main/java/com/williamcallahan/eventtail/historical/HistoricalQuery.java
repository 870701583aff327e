package com.williamcallahan.eventtail.historical;

import com.williamcallahan.eventtail.domain.EventFilter;
import java.time.Instant;
import java.util.Objects;

/**
 * Parameters of a single historical fetch.
 *
 * @param baseUrl endpoint serving historical events
 * @param since inclusive lower bound, null for unbounded
 * @param until upper bound, null for unbounded
 * @param limit maximum number of events, null for the server default
 * @param offset pagination offset, null for the first page
 * @param filter event filter, null for none
 */
public record HistoricalQuery(
        String baseUrl, Instant since, Instant until, Integer limit, Integer offset, EventFilter filter) {

    public HistoricalQuery {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
    }

    /** Returns a query for the whole history behind the given URL. */
    public static HistoricalQuery of(String baseUrl) {
        return new HistoricalQuery(baseUrl, null, null, null, null, null);
    }

    /** Returns a copy starting at the given instant. */
    public HistoricalQuery withSince(Instant since) {
        return new HistoricalQuery(baseUrl, since, until, limit, offset, filter);
    }

    /** Returns a copy starting at the given epoch millisecond. */
    public HistoricalQuery withSince(long sinceEpochMillis) {
        return withSince(Instant.ofEpochMilli(sinceEpochMillis));
    }

    /** Returns a copy ending at the given instant. */
    public HistoricalQuery withUntil(Instant until) {
        return new HistoricalQuery(baseUrl, since, until, limit, offset, filter);
    }

    /** Returns a copy limited to the given number of events. */
    public HistoricalQuery withLimit(Integer limit) {
        return new HistoricalQuery(baseUrl, since, until, limit, offset, filter);
    }

    /** Returns a copy starting at the given pagination offset. */
    public HistoricalQuery withOffset(Integer offset) {
        return new HistoricalQuery(baseUrl, since, until, limit, offset, filter);
    }

    /** Returns a copy restricted by the given filter. */
    public HistoricalQuery withFilter(EventFilter filter) {
        return new HistoricalQuery(baseUrl, since, until, limit, offset, filter);
    }
}
