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

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static dev.jobmatcher.provider.ListingNormalizer.DEFAULT_EMPLOYMENT_TYPE;
import static dev.jobmatcher.provider.ListingNormalizer.DEFAULT_LOCATION;
import static dev.jobmatcher.provider.ListingNormalizer.SALARY_NOT_SPECIFIED;
import static dev.jobmatcher.provider.ListingNormalizer.UNKNOWN_COMPANY;
import static dev.jobmatcher.provider.ListingNormalizer.isBlank;
import static dev.jobmatcher.provider.ListingNormalizer.mapEach;
import static dev.jobmatcher.provider.ListingNormalizer.orDefault;
import static dev.jobmatcher.provider.ListingNormalizer.parseDate;
import static dev.jobmatcher.provider.ListingNormalizer.stripHtml;

@Slf4j
@Component
public class RapidApiJobsProvider implements JobProvider {

    private static final String SEARCH_PATH = "/list";

    private final WebClient webClient;
    private final ProvidersConfig.Provider settings;
    private final Duration timeout;
    private final SearchMetrics metrics;
    private final String rapidApiHost;

    public RapidApiJobsProvider(WebClient.Builder webClientBuilder, ProvidersConfig providersConfig, SearchMetrics metrics) {
        this.settings = providersConfig.getRapidapiJobs();
        this.timeout = providersConfig.timeoutFor(settings);
        this.metrics = metrics;
        this.rapidApiHost = URI.create(settings.getBaseUrl()).getHost();
        this.webClient = ProviderHttp.buildClient(webClientBuilder, settings.getBaseUrl());
    }

    @Override
    public ProviderId getId() {
        return ProviderId.RAPIDAPI_JOBS;
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
        Mono<JobsResponse> call = webClient.get()
                .uri(uriBuilder -> uriBuilder.path(SEARCH_PATH)
                        .queryParam("query", query)
                        .queryParam("location", DEFAULT_LOCATION)
                        .queryParam("distance", "1.0")
                        .queryParam("language", "en_GB")
                        .queryParam("remoteOnly", true)
                        .queryParam("datePosted", "month")
                        .queryParam("jobType", "fulltime")
                        .queryParam("index", 0)
                        .build())
                .header("X-RapidAPI-Key", settings.getApiKey())
                .header("X-RapidAPI-Host", rapidApiHost)
                .retrieve()
                .bodyToMono(JobsResponse.class);

        return ProviderHttp.timed(getId(), call, timeout, metrics)
                .map(response -> {
                    if (response.getJobs() == null) {
                        throw ProviderException.parse(getId(), "no jobs field in response");
                    }
                    return mapEach(getId(), response.getJobs(), this::mapToListing);
                });
    }

    private Listing mapToListing(RapidJob job) {
        if (isBlank(job.getTitle())) {
            return null;
        }
        return Listing.builder()
                .title(job.getTitle().trim())
                .company(orDefault(job.getCompany(), UNKNOWN_COMPANY))
                .location(orDefault(job.getLocation(), DEFAULT_LOCATION))
                .link(job.getUrl())
                .source(getId())
                .description(stripHtml(job.getDescription()))
                // already human-formatted by the provider
                .salary(orDefault(job.getSalary(), SALARY_NOT_SPECIFIED))
                .employmentType(orDefault(job.getJobType(), DEFAULT_EMPLOYMENT_TYPE))
                .datePosted(parseDate(job.getDatePosted(), Instant.now()))
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class JobsResponse {
        private List<RapidJob> jobs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RapidJob {
        private String title;
        private String company;
        private String location;
        private String url;
        private String description;
        private String salary;
        private String jobType;
        private String datePosted;
    }
}
