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
import static dev.jobmatcher.provider.ListingNormalizer.SALARY_NOT_SPECIFIED;
import static dev.jobmatcher.provider.ListingNormalizer.UNKNOWN_COMPANY;
import static dev.jobmatcher.provider.ListingNormalizer.currencySymbol;
import static dev.jobmatcher.provider.ListingNormalizer.formatSalary;
import static dev.jobmatcher.provider.ListingNormalizer.isBlank;
import static dev.jobmatcher.provider.ListingNormalizer.mapEach;
import static dev.jobmatcher.provider.ListingNormalizer.orDefault;
import static dev.jobmatcher.provider.ListingNormalizer.parseDate;
import static dev.jobmatcher.provider.ListingNormalizer.stripHtml;

@Slf4j
@Component
public class TheirstackProvider implements JobProvider {

    private static final String SEARCH_PATH = "/jobs/search";

    private final WebClient webClient;
    private final ProvidersConfig.Provider settings;
    private final Duration timeout;
    private final int pageSize;
    private final SearchMetrics metrics;

    public TheirstackProvider(WebClient.Builder webClientBuilder, ProvidersConfig providersConfig, SearchMetrics metrics) {
        this.settings = providersConfig.getTheirstack();
        this.timeout = providersConfig.timeoutFor(settings);
        this.pageSize = providersConfig.getResultsPerPage();
        this.metrics = metrics;
        this.webClient = ProviderHttp.buildClient(webClientBuilder, settings.getBaseUrl());
    }

    @Override
    public ProviderId getId() {
        return ProviderId.THEIRSTACK;
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
        Mono<TheirstackResponse> call = webClient.get()
                .uri(uriBuilder -> uriBuilder.path(SEARCH_PATH)
                        .queryParam("query", query)
                        .queryParam("location", DEFAULT_LOCATION)
                        .queryParam("limit", pageSize)
                        .build())
                .headers(headers -> headers.setBearerAuth(settings.getApiKey()))
                .retrieve()
                .bodyToMono(TheirstackResponse.class);

        return ProviderHttp.timed(getId(), call, timeout, metrics)
                .map(response -> {
                    if (response.getJobs() == null) {
                        throw ProviderException.parse(getId(), "no jobs field in response");
                    }
                    return mapEach(getId(), response.getJobs(), this::mapToListing);
                });
    }

    private Listing mapToListing(TheirstackJob job) {
        if (isBlank(job.getTitle())) {
            return null;
        }
        String salary = SALARY_NOT_SPECIFIED;
        if (job.getSalary() != null && job.getSalary().getRange() != null) {
            salary = formatSalary(job.getSalary().getRange().getMin(), job.getSalary().getRange().getMax(),
                    currencySymbol(job.getSalary().getCurrency()));
        }

        return Listing.builder()
                .title(job.getTitle().trim())
                .company(orDefault(job.getCompany() != null ? job.getCompany().getName() : null, UNKNOWN_COMPANY))
                .location(orDefault(job.getLocation(), DEFAULT_LOCATION))
                .link(job.getUrl())
                .source(getId())
                .description(stripHtml(job.getDescription()))
                .salary(salary)
                .employmentType(orDefault(job.getType(), DEFAULT_EMPLOYMENT_TYPE))
                .datePosted(parseDate(job.getPostedAt(), Instant.now()))
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TheirstackResponse {
        private List<TheirstackJob> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TheirstackJob {
        private String title;
        private Company company;
        private String location;
        private String url;
        private String description;
        private Salary salary;
        private String type;
        @JsonProperty("posted_at")
        private String postedAt;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Company {
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Salary {
        private Range range;
        private String currency;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Range {
        private Object min;
        private Object max;
    }
}
