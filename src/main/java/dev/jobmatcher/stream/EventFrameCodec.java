package dev.jobmatcher.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jobmatcher.event.SearchEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Text form of search events on the wire: one SSE frame per event,
 * {@code event:<type>\ndata:<json>\n\n}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventFrameCodec {

    public static final String FRAME_TERMINATOR = "\n\n";

    private final ObjectMapper objectMapper;

    public String toJson(SearchEvent event) {
        try {
            return objectMapper.writerFor(SearchEvent.class).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new FrameEncodingException("Could not serialize " + event.type() + " event", e);
        }
    }

    public String encodeFrame(SearchEvent event) {
        return "event:" + event.type() + "\ndata:" + toJson(event) + FRAME_TERMINATOR;
    }

    /**
     * Decode one complete frame without its terminator.
     *
     * @return the event, or empty for comment-only frames and unknown event types
     * @throws MalformedFrameException when the payload is not a readable event
     */
    public Optional<SearchEvent> decodeFrame(String frame) {
        String eventName = null;
        StringBuilder data = null;

        for (String line : frame.split("\r?\n")) {
            if (line.isEmpty() || line.startsWith(":")) {
                continue;
            }
            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            if (field.equals("event")) {
                eventName = value;
            } else if (field.equals("data")) {
                data = data == null ? new StringBuilder(value) : data.append('\n').append(value);
            }
        }

        if (data == null) {
            return Optional.empty();
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(data.toString());
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Frame data is not JSON: " + e.getOriginalMessage(), e);
        }
        if (!node.isObject()) {
            throw new MalformedFrameException("Frame data is not a JSON object", null);
        }

        String type = node.hasNonNull("type") ? node.get("type").asText() : eventName;
        if (type == null || !SearchEvent.KNOWN_TYPES.contains(type)) {
            log.debug("Ignoring frame with unknown type {}", type);
            return Optional.empty();
        }
        ((ObjectNode) node).put("type", type);

        try {
            return Optional.of(objectMapper.treeToValue(node, SearchEvent.class));
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Unreadable " + type + " frame: " + e.getOriginalMessage(), e);
        }
    }
}
