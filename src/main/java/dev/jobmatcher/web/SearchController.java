package dev.jobmatcher.web;

import dev.jobmatcher.model.SearchRequest;
import dev.jobmatcher.service.SearchOrchestrator;
import dev.jobmatcher.stream.SearchStreamEmitter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SearchController {

    private final SearchOrchestrator orchestrator;
    private final SearchStreamEmitter emitter;

    /**
     * Validation and provider checks run before the stream opens, so they
     * surface as plain JSON errors.
     */
    @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> search(@RequestBody SearchRequest request) {
        return emitter.emit(orchestrator.search(request));
    }
}
