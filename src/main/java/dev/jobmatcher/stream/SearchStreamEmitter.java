package dev.jobmatcher.stream;

import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.event.SearchError;
import dev.jobmatcher.event.SearchEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Writes a session's events as SSE frames, with keep-alive comments in between.
 * The stream ends with the first terminal frame.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchStreamEmitter {

    static final String KEEPALIVE_COMMENT = "keepalive";
    private static final String FALLBACK_ERROR_JSON =
            "{\"type\":\"error\",\"message\":\"Search failed\",\"code\":\"" + SearchError.CODE_SERIALIZATION + "\"}";

    private final EventFrameCodec codec;
    private final SearchConfig searchConfig;

    private record Frame(ServerSentEvent<String> sse, boolean terminal) {
    }

    public Flux<ServerSentEvent<String>> emit(Flux<SearchEvent> events) {
        Flux<ServerSentEvent<String>> frames = events
                .map(this::toFrame)
                .takeUntil(Frame::terminal)
                .map(Frame::sse);

        Duration interval = searchConfig.getHeartbeatInterval();
        if (interval.isZero()) {
            return frames;
        }
        return frames.publish(shared -> Flux.merge(
                shared,
                Flux.interval(interval, interval)
                        .map(tick -> ServerSentEvent.<String>builder().comment(KEEPALIVE_COMMENT).build())
                        .takeUntilOther(shared.then().thenReturn(true))));
    }

    private Frame toFrame(SearchEvent event) {
        try {
            return new Frame(sse(event.type(), codec.toJson(event)), event.terminal());
        } catch (FrameEncodingException e) {
            log.error("Dropping {} event and closing the stream: {}", event.type(), e.getMessage());
            SearchError error = new SearchError("Search results could not be delivered",
                    SearchError.CODE_SERIALIZATION);
            return new Frame(sse(error.type(), encodeErrorSafely(error)), true);
        }
    }

    private String encodeErrorSafely(SearchError error) {
        try {
            return codec.toJson(error);
        } catch (FrameEncodingException e) {
            log.error("Error frame could not be serialized: {}", e.getMessage());
            return FALLBACK_ERROR_JSON;
        }
    }

    private static ServerSentEvent<String> sse(String type, String json) {
        return ServerSentEvent.<String>builder(json).event(type).build();
    }
}
