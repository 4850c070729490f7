package dev.jobmatcher.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal client for OpenAI-compatible chat completions.
 * Shared by the match scorer and the profile extractor.
 */
@Slf4j
@Component
public class OpenAiChatClient {

    private static final String CHAT_PATH = "/chat/completions";
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public OpenAiChatClient(
            @Value("${app.ai.openai.api-key:}") String apiKey,
            @Value("${app.ai.openai.model:gpt-4o-mini}") String model,
            @Value("${app.ai.openai.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${app.ai.openai.timeout:30s}") Duration timeout) {

        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.info("OpenAI API key not set - language-model features disabled");
        } else {
            log.info("OpenAI chat client ready with model: {}", this.model);
        }
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Send one system + user exchange and return the assistant text.
     */
    public Mono<String> complete(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
        ChatRequest request = new ChatRequest(model, List.of(
                new ChatRequest.Message("system", systemPrompt),
                new ChatRequest.Message("user", userPrompt)), temperature, maxTokens);

        return webClient.post()
                .uri(CHAT_PATH)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatResponse.class)
                .timeout(timeout)
                .retryWhen(Retry.backoff(2, Duration.ofSeconds(2)).filter(OpenAiChatClient::isRetryableError))
                .flatMap(response -> Mono.justOrEmpty(extractContent(response)));
    }

    /**
     * First-to-last brace span of a model reply, which may wrap JSON in prose or code fences.
     */
    public static Optional<String> extractJsonObject(String content) {
        if (content == null) {
            return Optional.empty();
        }
        Matcher matcher = JSON_OBJECT.matcher(content);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    static boolean isRetryableError(Throwable e) {
        if (e instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) e).getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }

    static boolean isRateLimited(Throwable e) {
        Throwable cause = unwrapRetryExhausted(e);
        return cause instanceof WebClientResponseException
                && ((WebClientResponseException) cause).getStatusCode().value() == 429;
    }

    private static Throwable unwrapRetryExhausted(Throwable e) {
        if (Exceptions.isRetryExhausted(e) && e.getCause() != null) {
            return e.getCause();
        }
        return e;
    }

    private String extractContent(ChatResponse response) {
        if (response != null && response.choices() != null && !response.choices().isEmpty()
                && response.choices().get(0).message() != null) {
            return response.choices().get(0).message().content();
        }
        return null;
    }

    // DTOs
    record ChatRequest(String model, List<Message> messages, double temperature,
            @JsonProperty("max_tokens") int maxTokens) {
        record Message(String role, String content) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Message(String content) {
            }
        }
    }
}
