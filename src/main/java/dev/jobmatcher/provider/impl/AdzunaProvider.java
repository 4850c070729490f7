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
import java.util.List;

import static dev.jobmatcher.provider.ListingNormalizer.DEFAULT_EMPLOYMENT_TYPE;
import static dev.jobmatcher.provider.ListingNormalizer.DEFAULT_LOCATION;
import static dev.jobmatcher.provider.ListingNormalizer.UNKNOWN_COMPANY;
import static dev.jobmatcher.provider.ListingNormalizer.formatSalary;
import static dev.jobmatcher.provider.ListingNormalizer.isBlank;
import static dev.jobmatcher.provider.ListingNormalizer.mapEach;
import static dev.jobmatcher.provider.ListingNormalizer.orDefault;
import static dev.jobmatcher.provider.ListingNormalizer.parseDate;
import static dev.jobmatcher.provider.ListingNormalizer.stripHtml;
import static dev.jobmatcher.provider.ListingNormalizer.withoutRemotePrefix;

@Slf4j
@Component
public class AdzunaProvider implements JobProvider {

    private static final String SEARCH_PATH = "/api/jobs/us/search/1";

    private final WebClient webClient;
    private final ProvidersConfig.Provider settings;
    private final Duration timeout;
    private final int pageSize;
    private final SearchMetrics metrics;

    public AdzunaProvider(WebClient.Builder webClientBuilder, ProvidersConfig providersConfig, SearchMetrics metrics) {
        this.settings = providersConfig.getAdzuna();
        this.timeout = providersConfig.timeoutFor(settings);
        this.pageSize = providersConfig.getResultsPerPage();
        this.metrics = metrics;
        this.webClient = ProviderHttp.buildClient(webClientBuilder, settings.getBaseUrl());
    }

    @Override
    public ProviderId getId() {
        return ProviderId.ADZUNA;
    }

    @Override
    public boolean isConfigured() {
        return settings.isEnabled() && settings.hasAppId() && settings.hasApiKey();
    }

    @Override
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public Mono<List<Listing>> search(String query, SearchFilters filters) {
        Mono<AdzunaResponse> call = webClient.get()
                .uri(uriBuilder -> uriBuilder.path(SEARCH_PATH)
                        .queryParam("app_id", settings.getAppId())
                        .queryParam("app_key", settings.getApiKey())
                        .queryParam("what", withoutRemotePrefix(query))
                        .queryParam("where", "remote")
                        .queryParam("results_per_page", pageSize)
                        .queryParam("sort_by", "relevance")
                        .build())
                .retrieve()
                .bodyToMono(AdzunaResponse.class);

        return ProviderHttp.timed(getId(), call, timeout, metrics)
                .map(response -> {
                    if (response.getResults() == null) {
                        throw ProviderException.parse(getId(), "no results field in response");
                    }
                    return mapEach(getId(), response.getResults(), this::mapToListing);
                });
    }

    private Listing mapToListing(AdzunaJob job) {
        if (isBlank(job.getTitle())) {
            return null;
        }
        return Listing.builder()
                .title(stripHtml(job.getTitle()))
                .company(orDefault(job.getCompany() != null ? job.getCompany().getDisplayName() : null, UNKNOWN_COMPANY))
                .location(orDefault(job.getLocation() != null ? job.getLocation().getDisplayName() : null, DEFAULT_LOCATION))
                .link(job.getRedirectUrl())
                .source(getId())
                .description(stripHtml(job.getDescription()))
                .salary(formatSalary(job.getSalaryMin(), job.getSalaryMax()))
                .employmentType(orDefault(job.getContractTime(), DEFAULT_EMPLOYMENT_TYPE))
                .datePosted(parseDate(job.getCreated(), Instant.now()))
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AdzunaResponse {
        private List<AdzunaJob> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AdzunaJob {
        private String title;
        private DisplayName company;
        private DisplayName location;
        @JsonProperty("redirect_url")
        private String redirectUrl;
        private String description;
        @JsonProperty("salary_min")
        private Object salaryMin;
        @JsonProperty("salary_max")
        private Object salaryMax;
        @JsonProperty("contract_time")
        private String contractTime;
        private String created;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class DisplayName {
        @JsonProperty("display_name")
        private String displayName;
    }
}
