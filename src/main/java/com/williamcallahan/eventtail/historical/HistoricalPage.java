package com.williamcallahan.eventtail.historical;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.eventtail.domain.TailEvent;
import java.util.List;
import java.util.Optional;

/**
 * One page of historical events as returned by the history endpoint.
 *
 * <p>Missing {@code events} decode to an empty list and missing {@code hasMore} to false.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoricalPage(List<TailEvent> events, boolean hasMore, Integer nextOffset) {

    private static final HistoricalPage EMPTY = new HistoricalPage(List.of(), false, null);

    public HistoricalPage {
        events = events == null ? List.of() : List.copyOf(events);
    }

    @JsonCreator
    static HistoricalPage fromJson(
            @JsonProperty("events") List<TailEvent> events,
            @JsonProperty("hasMore") Boolean hasMore,
            @JsonProperty("nextOffset") Integer nextOffset) {
        return new HistoricalPage(events, Boolean.TRUE.equals(hasMore), nextOffset);
    }

    /** Returns a page with no events and nothing more to fetch. */
    public static HistoricalPage empty() {
        return EMPTY;
    }

    /** Returns the offset of the following page, when the server supplied one. */
    public Optional<Integer> nextOffsetIfPresent() {
        return Optional.ofNullable(nextOffset);
    }
}
