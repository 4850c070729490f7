package dev.jobmatcher.provider;

import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.ProviderId;
import dev.jobmatcher.model.SearchFilters;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Interface for external job listing providers.
 * Each provider API implements this interface.
 */
public interface JobProvider {

    ProviderId getId();

    /**
     * Check if credentials for this provider are present.
     */
    boolean isConfigured();

    /**
     * Timeout applied by the orchestrator around one provider task.
     */
    Duration getTimeout();

    /**
     * Run one query against the provider.
     * Fails with {@link dev.jobmatcher.exception.ProviderException} on timeout, HTTP,
     * parse or authorization failures. Malformed individual records are skipped.
     */
    Mono<List<Listing>> search(String query, SearchFilters filters);
}
