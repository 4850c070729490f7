package dev.jobmatcher.service;

import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.ProviderId;

import java.util.List;

/**
 * Result of one provider task, produced once per dispatched provider.
 */
record ProviderOutcome(ProviderId provider, List<Listing> listings, ProviderException error, long elapsedMillis) {

    static ProviderOutcome success(ProviderId provider, List<Listing> listings, long elapsedMillis) {
        return new ProviderOutcome(provider, listings, null, elapsedMillis);
    }

    static ProviderOutcome failure(ProviderId provider, ProviderException error, long elapsedMillis) {
        return new ProviderOutcome(provider, List.of(), error, elapsedMillis);
    }

    boolean failed() {
        return error != null;
    }
}
