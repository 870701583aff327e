package com.williamcallahan.eventtail.historical;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.eventtail.domain.EventFilter;
import com.williamcallahan.eventtail.domain.EventImportance;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HistoricalEventFetcher#buildQueryUrl(HistoricalQuery)}.
 */
class HistoricalQueryUrlTest {

    private static final String BASE_URL = "https://api.mdxe.do/tail";

    @Test
    void returnsBaseUrlUnchangedWithoutParameters() {
        assertEquals(BASE_URL, HistoricalEventFetcher.buildQueryUrl(HistoricalQuery.of(BASE_URL)));
        assertEquals(
                BASE_URL,
                HistoricalEventFetcher.buildQueryUrl(HistoricalQuery.of(BASE_URL).withFilter(EventFilter.empty())));
    }

    @Test
    void encodesInstantsAsUtcWithMilliseconds() {
        HistoricalQuery query = HistoricalQuery.of(BASE_URL).withSince(Instant.parse("2024-01-15T10:00:00Z"));

        assertEquals(BASE_URL + "?since=2024-01-15T10%3A00%3A00.000Z", HistoricalEventFetcher.buildQueryUrl(query));
    }

    @Test
    void keepsParameterOrderStable() {
        HistoricalQuery query = HistoricalQuery.of(BASE_URL)
                .withFilter(new EventFilter("mdxe-*", "build_failed", EventImportance.HIGH))
                .withOffset(100)
                .withLimit(50)
                .withUntil(Instant.parse("2024-01-16T10:00:00.250Z"))
                .withSince(Instant.parse("2024-01-15T10:00:00Z"));

        assertEquals(
                BASE_URL + "?since=2024-01-15T10%3A00%3A00.000Z"
                        + "&until=2024-01-16T10%3A00%3A00.250Z"
                        + "&limit=50"
                        + "&offset=100"
                        + "&source=mdxe-*"
                        + "&type=build_failed"
                        + "&minImportance=high",
                HistoricalEventFetcher.buildQueryUrl(query));
    }

    @Test
    void omitsUnsetFilterFields() {
        HistoricalQuery query = HistoricalQuery.of(BASE_URL)
                .withFilter(EventFilter.empty().withMinImportance(EventImportance.CRITICAL));

        assertEquals(BASE_URL + "?minImportance=critical", HistoricalEventFetcher.buildQueryUrl(query));
    }

    @Test
    void appendsToExistingQueryString() {
        HistoricalQuery query = HistoricalQuery.of(BASE_URL + "?project=docs").withLimit(10);

        assertEquals(BASE_URL + "?project=docs&limit=10", HistoricalEventFetcher.buildQueryUrl(query));
    }

    @Test
    void encodesReservedCharactersInFilterValues() {
        HistoricalQuery query = HistoricalQuery.of(BASE_URL).withFilter(EventFilter.bySource("team a&b"));

        assertEquals(BASE_URL + "?source=team+a%26b", HistoricalEventFetcher.buildQueryUrl(query));
    }
}
