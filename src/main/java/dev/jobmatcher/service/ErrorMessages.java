package dev.jobmatcher.service;

import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.model.ProviderId;

/**
 * User-facing text for provider failures.
 */
public final class ErrorMessages {

    private ErrorMessages() {
    }

    public static String forProviderFailure(ProviderId provider, ProviderException error) {
        return provider.getDisplayName() + " " + describe(error);
    }

    static String describe(ProviderException error) {
        switch (error.getKind()) {
            case TIMEOUT:
                return "did not respond in time";
            case UNAUTHORIZED:
                return "rejected the configured credentials";
            case PARSE:
                return "returned an unexpected response";
            case HTTP:
            default:
                Integer status = error.getStatus();
                if (status != null && status == 429) {
                    return "rate limit reached, try again later";
                }
                return "is temporarily unavailable";
        }
    }
}
