package dev.jobmatcher.provider;

import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.metrics.SearchMetrics;
import dev.jobmatcher.model.ProviderId;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Objects;

/**
 * Stateless HTTP helpers shared by provider adapters.
 */
public final class ProviderHttp {

    private ProviderHttp() {
    }

    /**
     * Build a WebClient for one provider base URL.
     */
    public static WebClient buildClient(WebClient.Builder webClientBuilder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        return webClientBuilder.clone()
                .baseUrl(baseUrl)
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", "JobMatcher/1.0")
                .defaultHeader("Accept", "application/json")
                .build();
    }

    /**
     * Apply the request timeout, record latency and tag any failure with its kind.
     * An empty body counts as a parse failure.
     */
    public static <T> Mono<T> timed(ProviderId provider, Mono<T> call, Duration timeout, SearchMetrics metrics) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return call
                    .timeout(timeout)
                    .switchIfEmpty(Mono.error(() -> ProviderException.parse(provider, "empty response body")))
                    .onErrorMap(e -> ProviderException.classify(provider, e))
                    .doOnTerminate(() -> metrics.recordProviderLatency(provider, System.currentTimeMillis() - start));
        });
    }
}
