package com.williamcallahan.eventtail.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Build, test or deploy event as produced by the pipeline and delivered to tail consumers.
 *
 * <p>Instances are immutable. New events are created through {@link #builder(String, String)},
 * which stamps the current time; the canonical constructor exists for decoding events that
 * already carry a timestamp.</p>
 *
 * @param timestamp epoch milliseconds at which the event was created
 * @param source producer identifier, for example {@code mdxe-build}
 * @param type event kind, for example {@code build_started}
 * @param importance importance level, defaults to {@link EventImportance#NORMAL}
 * @param data open payload, never null
 * @param traceId optional trace identifier shared by related events
 * @param causationId optional identifier of the event that caused this one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"timestamp", "source", "type", "importance", "data", "traceId", "causationId"})
public record TailEvent(
        long timestamp,
        String source,
        String type,
        EventImportance importance,
        Map<String, Object> data,
        String traceId,
        String causationId) {

    public TailEvent {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(type, "type");
        importance = importance == null ? EventImportance.NORMAL : importance;
        // Payloads may legitimately contain JSON nulls, which Map.copyOf rejects.
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Decodes an event received from a server. Unlike locally created events, a decoded event must
     * already carry its timestamp.
     *
     * @throws IllegalArgumentException when the timestamp is missing
     */
    @JsonCreator
    static TailEvent fromJson(
            @JsonProperty("timestamp") Long timestamp,
            @JsonProperty("source") String source,
            @JsonProperty("type") String type,
            @JsonProperty("importance") EventImportance importance,
            @JsonProperty("data") Map<String, Object> data,
            @JsonProperty("traceId") String traceId,
            @JsonProperty("causationId") String causationId) {
        if (timestamp == null) {
            throw new IllegalArgumentException("Event is missing its timestamp");
        }
        return new TailEvent(timestamp, source, type, importance, data, traceId, causationId);
    }

    /**
     * Creates an event stamped with the current time.
     *
     * @param source producer identifier
     * @param type event kind
     * @param importance wire importance value, null for {@code normal}
     * @param data payload, may be null
     * @param traceId optional trace identifier
     * @param causationId optional causation identifier
     * @return the new event
     * @throws InvalidImportanceException when importance is not a known level
     */
    public static TailEvent create(
            String source,
            String type,
            String importance,
            Map<String, Object> data,
            String traceId,
            String causationId) {
        Builder builder = builder(source, type).data(data).traceId(traceId).causationId(causationId);
        if (importance != null) {
            builder.importance(importance);
        }
        return builder.build();
    }

    /**
     * Returns the key used to suppress duplicate deliveries: the trace id when present, otherwise
     * {@code timestamp:source:type}.
     *
     * @return deduplication key
     */
    public String deduplicationKey() {
        if (traceId != null) {
            return traceId;
        }
        return timestamp + ":" + source + ":" + type;
    }

    /** Creates a builder with the fields every event requires. */
    public static Builder builder(String source, String type) {
        return new Builder(source, type);
    }

    /**
     * Fluent builder that stamps the creation time when {@link #build()} is called.
     */
    public static final class Builder {
        private final String source;
        private final String type;
        private EventImportance importance = EventImportance.NORMAL;
        private Map<String, Object> data = Map.of();
        private String traceId;
        private String causationId;
        private Clock clock = Clock.systemUTC();
        private Long timestamp;

        private Builder(String source, String type) {
            this.source = source;
            this.type = type;
        }

        /** Sets the importance from its wire value, validating it immediately. */
        public Builder importance(String importance) {
            this.importance = EventImportance.fromWireValue(importance);
            return this;
        }

        /** Sets the importance level. */
        public Builder importance(EventImportance importance) {
            this.importance = Objects.requireNonNull(importance, "importance");
            return this;
        }

        /** Sets the payload. */
        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        /** Sets the trace identifier. */
        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        /** Sets the causation identifier. */
        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        /** Uses the given clock to stamp the event. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Uses an explicit timestamp instead of the clock, for replayed or synthetic events. */
        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /** Builds the immutable event. */
        public TailEvent build() {
            long resolvedTimestamp = timestamp != null ? timestamp : clock.millis();
            return new TailEvent(resolvedTimestamp, source, type, importance, data, traceId, causationId);
        }
    }
}
