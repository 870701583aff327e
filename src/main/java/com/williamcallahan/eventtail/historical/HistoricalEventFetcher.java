package com.williamcallahan.eventtail.historical;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventtail.domain.EventFilter;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Issues one HTTP GET against the history endpoint per subscription and decodes the page.
 *
 * <p>The fetcher holds no state between calls and never follows pagination on its own; callers
 * use {@link HistoricalPage#hasMore()} and {@link HistoricalPage#nextOffset()} to page forward.
 * Network failures surface unchanged as the error signal of the returned {@link Mono}.</p>
 */
public class HistoricalEventFetcher {
    private static final Logger log = LoggerFactory.getLogger(HistoricalEventFetcher.class);

    private static final DateTimeFormatter INSTANT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    /**
     * Creates a fetcher on top of a WebClient.
     *
     * @param webClientBuilder builder for the outbound client
     * @param objectMapper mapper used to decode response bodies
     */
    public HistoricalEventFetcher(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.webClient = Objects.requireNonNull(webClientBuilder, "webClientBuilder").build();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Fetches one page of historical events.
     *
     * <p>The request is sent when the returned Mono is subscribed. A non-2xx response fails with
     * {@link HistoricalFetchException}; a body that is not valid JSON fails with the decoding
     * error.</p>
     *
     * @param query time range, pagination and filter
     * @return the decoded page
     */
    public Mono<HistoricalPage> fetchHistoricalEvents(HistoricalQuery query) {
        Objects.requireNonNull(query, "query");
        String url = buildQueryUrl(query);
        return Mono.defer(() -> {
            log.debug("Fetching historical events from {}", url);
            return webClient
                    .get()
                    .uri(URI.create(url))
                    .accept(MediaType.APPLICATION_JSON)
                    .exchangeToMono(this::readPage);
        });
    }

    private Mono<HistoricalPage> readPage(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (!response.statusCode().is2xxSuccessful()) {
            HttpStatus knownStatus = HttpStatus.resolve(statusCode);
            String statusText = knownStatus == null ? "" : knownStatus.getReasonPhrase();
            log.warn("History endpoint answered {} {}", statusCode, statusText);
            return response.releaseBody().then(Mono.error(new HistoricalFetchException(statusCode, statusText)));
        }
        return response.bodyToMono(String.class)
                .switchIfEmpty(Mono.error(
                        new HistoricalFetchException("History endpoint returned an empty body with status " + statusCode)))
                .flatMap(body -> Mono.fromCallable(() -> objectMapper.readValue(body, HistoricalPage.class)))
                .doOnNext(page -> log.debug("Decoded {} historical events (hasMore={})", page.events().size(), page.hasMore()));
    }

    /**
     * Builds the request URL for a query.
     *
     * <p>Parameters appear in the order {@code since, until, limit, offset, source, type,
     * minImportance}; absent values are omitted. Without parameters the base URL is returned
     * unchanged.</p>
     *
     * @param query query to serialize
     * @return absolute request URL
     */
    public static String buildQueryUrl(HistoricalQuery query) {
        List<String> parameters = new ArrayList<>();
        if (query.since() != null) {
            addParameter(parameters, "since", formatInstant(query.since()));
        }
        if (query.until() != null) {
            addParameter(parameters, "until", formatInstant(query.until()));
        }
        if (query.limit() != null) {
            addParameter(parameters, "limit", query.limit().toString());
        }
        if (query.offset() != null) {
            addParameter(parameters, "offset", query.offset().toString());
        }
        EventFilter filter = query.filter();
        if (filter != null) {
            if (filter.source() != null) {
                addParameter(parameters, "source", filter.source());
            }
            if (filter.type() != null) {
                addParameter(parameters, "type", filter.type());
            }
            if (filter.minImportance() != null) {
                addParameter(parameters, "minImportance", filter.minImportance().wireValue());
            }
        }
        if (parameters.isEmpty()) {
            return query.baseUrl();
        }
        String separator = query.baseUrl().indexOf('?') >= 0 ? "&" : "?";
        return query.baseUrl() + separator + String.join("&", parameters);
    }

    static String formatInstant(Instant instant) {
        return INSTANT_FORMAT.format(instant);
    }

    private static void addParameter(List<String> parameters, String name, String value) {
        parameters.add(name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
    }
}
