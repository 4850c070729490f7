package dev.jobmatcher.provider.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
import static dev.jobmatcher.provider.ListingNormalizer.currencySymbol;
import static dev.jobmatcher.provider.ListingNormalizer.formatSalary;
import static dev.jobmatcher.provider.ListingNormalizer.isBlank;
import static dev.jobmatcher.provider.ListingNormalizer.mapEach;
import static dev.jobmatcher.provider.ListingNormalizer.orDefault;
import static dev.jobmatcher.provider.ListingNormalizer.parseDate;
import static dev.jobmatcher.provider.ListingNormalizer.stripHtml;
import static dev.jobmatcher.provider.ListingNormalizer.withoutRemotePrefix;

/**
 * Reed.co.uk search API. The API key is sent as the Basic auth user name.
 */
@Slf4j
@Component
public class ReedProvider implements JobProvider {

    private static final String SEARCH_PATH = "/search";

    private final WebClient webClient;
    private final ProvidersConfig.Provider settings;
    private final Duration timeout;
    private final int pageSize;
    private final SearchMetrics metrics;

    public ReedProvider(WebClient.Builder webClientBuilder, ProvidersConfig providersConfig, SearchMetrics metrics) {
        this.settings = providersConfig.getReed();
        this.timeout = providersConfig.timeoutFor(settings);
        this.pageSize = providersConfig.getResultsPerPage();
        this.metrics = metrics;
        this.webClient = ProviderHttp.buildClient(webClientBuilder, settings.getBaseUrl());
    }

    @Override
    public ProviderId getId() {
        return ProviderId.REED;
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
        Mono<ReedResponse> call = webClient.get()
                .uri(uriBuilder -> uriBuilder.path(SEARCH_PATH)
                        .queryParam("keywords", withoutRemotePrefix(query))
                        .queryParam("locationName", DEFAULT_LOCATION)
                        .queryParam("distanceFromLocation", 0)
                        .queryParam("resultsToTake", pageSize)
                        .build())
                .headers(headers -> headers.setBasicAuth(settings.getApiKey(), ""))
                .retrieve()
                .bodyToMono(ReedResponse.class);

        return ProviderHttp.timed(getId(), call, timeout, metrics)
                .map(response -> {
                    if (response.getResults() == null) {
                        throw ProviderException.parse(getId(), "no results field in response");
                    }
                    return mapEach(getId(), response.getResults(), this::mapToListing);
                });
    }

    private Listing mapToListing(ReedJob job) {
        if (isBlank(job.getJobTitle())) {
            return null;
        }
        Object posted = job.getDatePosted() != null ? job.getDatePosted() : job.getDate();

        return Listing.builder()
                .title(job.getJobTitle().trim())
                .company(orDefault(job.getEmployerName(), UNKNOWN_COMPANY))
                .location(orDefault(job.getLocationName(), DEFAULT_LOCATION))
                .link(job.getJobUrl())
                .source(getId())
                .description(stripHtml(job.getJobDescription()))
                .salary(formatSalary(job.getMinimumSalary(), job.getMaximumSalary(), currencySymbol(orDefault(job.getCurrency(), "GBP"))))
                .employmentType(orDefault(job.getEmploymentType(), DEFAULT_EMPLOYMENT_TYPE))
                .datePosted(parseDate(posted, Instant.now()))
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ReedResponse {
        private List<ReedJob> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ReedJob {
        private String jobTitle;
        private String employerName;
        private String locationName;
        private String jobUrl;
        private String jobDescription;
        private Object minimumSalary;
        private Object maximumSalary;
        private String currency;
        private String employmentType;
        private String datePosted;
        private String date;
    }
}
