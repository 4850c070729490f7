package dev.jobmatcher.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.jobmatcher.model.ProviderId;
import lombok.Getter;
import org.springframework.core.codec.CodecException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Failure of a single provider call, tagged with its kind where it happens.
 */
@Getter
public class ProviderException extends RuntimeException {

    public enum Kind {
        TIMEOUT,
        HTTP,
        PARSE,
        UNAUTHORIZED
    }

    private final ProviderId provider;
    private final Kind kind;
    private final Integer status;

    public ProviderException(ProviderId provider, Kind kind, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
        this.status = status;
    }

    public static ProviderException timeout(ProviderId provider, Throwable cause) {
        return new ProviderException(provider, Kind.TIMEOUT, null,
                provider + " request timed out", cause);
    }

    public static ProviderException parse(ProviderId provider, String message) {
        return new ProviderException(provider, Kind.PARSE, null, provider + ": " + message, null);
    }

    public static ProviderException parse(ProviderId provider, Throwable cause) {
        return new ProviderException(provider, Kind.PARSE, null,
                provider + " returned an unreadable response: " + cause.getMessage(), cause);
    }

    public static ProviderException http(ProviderId provider, int status, Throwable cause) {
        Kind kind = (status == 401 || status == 403) ? Kind.UNAUTHORIZED : Kind.HTTP;
        return new ProviderException(provider, kind, status,
                provider + " responded with HTTP " + status, cause);
    }

    /**
     * Map a raw failure from the HTTP client into a tagged provider failure.
     */
    public static ProviderException classify(ProviderId provider, Throwable error) {
        if (error instanceof ProviderException) {
            return (ProviderException) error;
        }
        if (error instanceof TimeoutException) {
            return timeout(provider, error);
        }
        if (error instanceof WebClientResponseException) {
            return http(provider, ((WebClientResponseException) error).getStatusCode().value(), error);
        }
        if (error instanceof CodecException || error instanceof JsonProcessingException) {
            return parse(provider, error);
        }
        if (error instanceof WebClientRequestException && error.getCause() instanceof TimeoutException) {
            return timeout(provider, error);
        }
        return new ProviderException(provider, Kind.HTTP, null,
                provider + " request failed: " + error.getMessage(), error);
    }
}
