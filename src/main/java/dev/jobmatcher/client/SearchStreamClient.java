package dev.jobmatcher.client;

import dev.jobmatcher.model.SearchRequest;
import dev.jobmatcher.stream.EventFrameCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reads a search stream from a job-matcher server.
 */
@Slf4j
public class SearchStreamClient {

    private static final Duration TRANSPORT_MARGIN = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final SearchStreamConsumer consumer;
    private final Duration readTimeout;

    /**
     * @param readTimeout   idle time allowed between two reads
     * @param globalTimeout the server's session deadline; the read timeout is raised above it
     */
    public SearchStreamClient(WebClient.Builder builder, String baseUrl, EventFrameCodec codec,
            Duration readTimeout, Duration globalTimeout) {
        this.webClient = builder.clone().baseUrl(baseUrl).build();
        this.consumer = new SearchStreamConsumer(codec);
        this.readTimeout = transportTimeout(readTimeout, globalTimeout);
    }

    static Duration transportTimeout(Duration requested, Duration globalTimeout) {
        Duration floor = globalTimeout.plus(TRANSPORT_MARGIN);
        if (requested == null || requested.compareTo(floor) < 0) {
            return floor;
        }
        return requested;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    /**
     * Run a search and collect its stream.
     *
     * @return the aggregate, or {@link SearchRejectedException} when the server refused the search
     */
    public Mono<SearchAggregate> search(SearchRequest request) {
        Flux<byte[]> bytes = webClient.post()
                .uri("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM, MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new SearchRejectedException(response.statusCode().value(), body)))
                .bodyToFlux(DataBuffer.class)
                .timeout(readTimeout)
                .map(SearchStreamClient::toBytes);

        return consumer.consume(bytes)
                .doOnNext(result -> log.info("Search stream finished: {} listings{}", result.getTotal(),
                        result.isInterrupted() ? " (interrupted)" : ""));
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
