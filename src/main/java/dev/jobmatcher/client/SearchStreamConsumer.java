package dev.jobmatcher.client;

import dev.jobmatcher.event.SearchEvent;
import dev.jobmatcher.stream.EventFrameCodec;
import dev.jobmatcher.stream.MalformedFrameException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Turns raw stream bytes into a {@link SearchAggregate}.
 * A stream that ends without a terminal event, or fails in transit, still yields
 * the listings received so far, flagged as interrupted.
 */
@Slf4j
@RequiredArgsConstructor
public class SearchStreamConsumer {

    private final EventFrameCodec codec;

    public Mono<SearchAggregate> consume(Flux<byte[]> chunks) {
        return Mono.defer(() -> {
            FrameReassembler reassembler = new FrameReassembler();
            SearchAggregate aggregate = new SearchAggregate();

            return chunks
                    .concatMapIterable(reassembler::feed)
                    .concatMap(frame -> Mono.justOrEmpty(decode(frame)))
                    .doOnNext(aggregate::apply)
                    .takeUntil(SearchEvent::terminal)
                    .then(Mono.fromCallable(() -> finish(aggregate, reassembler)))
                    .onErrorResume(e -> !(e instanceof SearchRejectedException), e -> {
                        log.warn("Search stream failed after {} listings: {}", aggregate.getTotal(), e.getMessage());
                        aggregate.markInterrupted(new StreamTransportException("Search stream failed", e));
                        return Mono.just(aggregate);
                    });
        });
    }

    private Optional<SearchEvent> decode(String frame) {
        try {
            return codec.decodeFrame(frame);
        } catch (MalformedFrameException e) {
            log.warn("Skipping malformed frame: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private SearchAggregate finish(SearchAggregate aggregate, FrameReassembler reassembler) {
        if (!aggregate.isTerminal()) {
            if (reassembler.pendingBytes() > 0) {
                log.debug("Discarding {} bytes of unterminated frame", reassembler.pendingBytes());
            }
            log.warn("Search stream ended without a terminal event, keeping {} listings", aggregate.getTotal());
            aggregate.markInterrupted(new StreamTransportException("Stream ended before search completed"));
        }
        return aggregate;
    }
}
