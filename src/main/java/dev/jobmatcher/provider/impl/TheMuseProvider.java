package dev.jobmatcher.provider.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.jobmatcher.config.ProvidersConfig;
import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.metrics.SearchMetrics;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.ProviderId;
import dev.jobmatcher.model.SearchFilters;
import dev.jobmatcher.provider.JobProvider;
import dev.jobmatcher.provider.ProviderHttp;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static dev.jobmatcher.provider.ListingNormalizer.DEFAULT_EMPLOYMENT_TYPE;
import static dev.jobmatcher.provider.ListingNormalizer.DEFAULT_LOCATION;
import static dev.jobmatcher.provider.ListingNormalizer.SALARY_NOT_SPECIFIED;
import static dev.jobmatcher.provider.ListingNormalizer.UNKNOWN_COMPANY;
import static dev.jobmatcher.provider.ListingNormalizer.isBlank;
import static dev.jobmatcher.provider.ListingNormalizer.mapEach;
import static dev.jobmatcher.provider.ListingNormalizer.orDefault;
import static dev.jobmatcher.provider.ListingNormalizer.parseDate;
import static dev.jobmatcher.provider.ListingNormalizer.stripHtml;

/**
 * The Muse public API. Categories are inferred from the query text.
 */
@Slf4j
@Component
public class TheMuseProvider implements JobProvider {

    private static final String SEARCH_PATH = "/jobs";

    private static final Map<String, String> LEVELS = Map.of(
            "entry", "Entry Level",
            "mid", "Mid Level",
            "senior", "Senior Level",
            "lead", "management");

    private final WebClient webClient;
    private final ProvidersConfig.Provider settings;
    private final Duration timeout;
    private final int pageSize;
    private final SearchMetrics metrics;

    public TheMuseProvider(WebClient.Builder webClientBuilder, ProvidersConfig providersConfig, SearchMetrics metrics) {
        this.settings = providersConfig.getThemuse();
        this.timeout = providersConfig.timeoutFor(settings);
        this.pageSize = providersConfig.getResultsPerPage();
        this.metrics = metrics;
        this.webClient = ProviderHttp.buildClient(webClientBuilder, settings.getBaseUrl());
    }

    @Override
    public ProviderId getId() {
        return ProviderId.THE_MUSE;
    }

    @Override
    public boolean isConfigured() {
        return settings.isEnabled() && settings.hasApiKey();
    }

    @Override
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public Mono<List<Listing>> search(String query, SearchFilters filters) {
        List<String> categories = categoriesFor(query);
        String level = filters != null && filters.getExperience() != null
                ? LEVELS.get(filters.getExperience().toLowerCase(Locale.ROOT))
                : null;

        Mono<MuseResponse> call = webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(SEARCH_PATH)
                            .queryParam("api_key", settings.getApiKey())
                            .queryParam("page", 0)
                            .queryParam("limit", pageSize)
                            .queryParam("location", DEFAULT_LOCATION)
                            .queryParam("q", query);
                    if (level != null) {
                        uriBuilder.queryParam("level", level);
                    }
                    if (!categories.isEmpty()) {
                        uriBuilder.queryParam("category", String.join(",", categories));
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .bodyToMono(MuseResponse.class);

        return ProviderHttp.timed(getId(), call, timeout, metrics)
                .map(response -> {
                    if (response.getResults() == null) {
                        throw ProviderException.parse(getId(), "no results field in response");
                    }
                    return mapEach(getId(), response.getResults(), this::mapToListing);
                });
    }

    static List<String> categoriesFor(String query) {
        List<String> categories = new ArrayList<>();
        String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);
        if (lower.contains("developer") || lower.contains("engineer") || lower.contains("programming")) {
            categories.add("Engineering");
        }
        if (lower.contains("data") || lower.contains("analyst")) {
            categories.add("Data Science");
        }
        if (lower.contains("manager") || lower.contains("product")) {
            categories.add("Product");
        }
        if (lower.contains("design")) {
            categories.add("Design");
        }
        return categories;
    }

    private Listing mapToListing(MuseJob job) {
        if (isBlank(job.getName())) {
            return null;
        }
        String location = DEFAULT_LOCATION;
        if (job.getLocations() != null && !job.getLocations().isEmpty() && job.getLocations().get(0) != null) {
            location = orDefault(job.getLocations().get(0).getName(), DEFAULT_LOCATION);
        }

        return Listing.builder()
                .title(job.getName().trim())
                .company(orDefault(job.getCompany() != null ? job.getCompany().getName() : null, UNKNOWN_COMPANY))
                .location(location)
                .link(job.getRefs() != null ? job.getRefs().getLandingPage() : null)
                .source(getId())
                .description(stripHtml(job.getContents()))
                .salary(SALARY_NOT_SPECIFIED)
                .employmentType(orDefault(job.getType(), DEFAULT_EMPLOYMENT_TYPE))
                .datePosted(parseDate(job.getPublicationDate(), Instant.now()))
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MuseResponse {
        private List<MuseJob> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MuseJob {
        private String name;
        private Named company;
        private List<Named> locations;
        private Refs refs;
        private String contents;
        private String type;
        @JsonProperty("publication_date")
        private String publicationDate;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Named {
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Refs {
        @JsonProperty("landing_page")
        private String landingPage;
    }
}
