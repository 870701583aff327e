package com.williamcallahan.eventtail.live.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.eventtail.domain.EventFilter;
import com.williamcallahan.eventtail.domain.TailEvent;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes client frames and decodes server frames of the live tail protocol.
 *
 * <p>Every frame is one JSON object with a {@code type} discriminator. Frames that are not valid
 * JSON, lack a known type, or carry an invalid payload decode to {@link Optional#empty()}.</p>
 */
public class TailProtocolCodec {
    private static final Logger log = LoggerFactory.getLogger(TailProtocolCodec.class);

    private static final String TYPE_FIELD = "type";

    private final ObjectMapper objectMapper;

    public TailProtocolCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Encodes a subscribe frame.
     *
     * @param filter filter to apply, null to omit the {@code filter} field
     * @return JSON text frame
     */
    public String encodeSubscribe(EventFilter filter) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put(TYPE_FIELD, "subscribe");
        if (filter != null) {
            ObjectNode filterNode = frame.putObject("filter");
            if (filter.source() != null) {
                filterNode.put("source", filter.source());
            }
            if (filter.type() != null) {
                filterNode.put("type", filter.type());
            }
            if (filter.minImportance() != null) {
                filterNode.put("minImportance", filter.minImportance().wireValue());
            }
        }
        return frame.toString();
    }

    public String encodeUnsubscribe() {
        return typeOnlyFrame("unsubscribe");
    }

    public String encodePing() {
        return typeOnlyFrame("ping");
    }

    private String typeOnlyFrame(String type) {
        return objectMapper.createObjectNode().put(TYPE_FIELD, type).toString();
    }

    /**
     * Decodes a server frame.
     *
     * @param text raw frame text
     * @return the decoded message, empty when the frame is malformed or of an unknown type
     */
    public Optional<TailServerMessage> decode(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode frame = objectMapper.readTree(text);
            if (frame == null || !frame.isObject()) {
                log.debug("Ignoring non-object frame");
                return Optional.empty();
            }
            String type = frame.path(TYPE_FIELD).asText("");
            switch (type) {
                case "event":
                    return decodeEvent(frame);
                case "pong":
                    return Optional.of(new TailServerMessage.Pong(frame.path("timestamp").asLong(0L)));
                case "subscribed":
                    return Optional.of(new TailServerMessage.Subscribed(decodeFilter(frame.get("filter"))));
                case "unsubscribed":
                    return Optional.of(new TailServerMessage.Unsubscribed());
                case "error":
                    return Optional.of(new TailServerMessage.ErrorMessage(frame.path("message").asText(null)));
                default:
                    log.debug("Ignoring frame with unknown type '{}'", type);
                    return Optional.empty();
            }
        } catch (JsonProcessingException | IllegalArgumentException malformed) {
            log.debug("Ignoring malformed frame: {}", malformed.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TailServerMessage> decodeEvent(JsonNode frame) throws JsonProcessingException {
        JsonNode eventNode = frame.get("event");
        if (eventNode == null || !eventNode.isObject()) {
            log.debug("Ignoring event frame without an event object");
            return Optional.empty();
        }
        TailEvent event = objectMapper.treeToValue(eventNode, TailEvent.class);
        return Optional.of(new TailServerMessage.EventMessage(event));
    }

    private EventFilter decodeFilter(JsonNode filterNode) throws JsonProcessingException {
        if (filterNode == null || filterNode.isNull()) {
            return null;
        }
        return objectMapper.treeToValue(filterNode, EventFilter.class);
    }
}
