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
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static dev.jobmatcher.provider.ListingNormalizer.DEFAULT_EMPLOYMENT_TYPE;
import static dev.jobmatcher.provider.ListingNormalizer.DEFAULT_LOCATION;
import static dev.jobmatcher.provider.ListingNormalizer.formatSalary;
import static dev.jobmatcher.provider.ListingNormalizer.isBlank;
import static dev.jobmatcher.provider.ListingNormalizer.mapEach;
import static dev.jobmatcher.provider.ListingNormalizer.orDefault;
import static dev.jobmatcher.provider.ListingNormalizer.parseDate;
import static dev.jobmatcher.provider.ListingNormalizer.stripHtml;

/**
 * JSearch on RapidAPI. Records without a title or employer are dropped.
 */
@Slf4j
@Component
public class JSearchProvider implements JobProvider {

    private static final String SEARCH_PATH = "/search";
    private static final String QUOTA_HEADER = "x-rapidapi-quota-left";
    private static final int LOW_QUOTA = 5;

    private final WebClient webClient;
    private final ProvidersConfig.Provider settings;
    private final Duration timeout;
    private final SearchMetrics metrics;
    private final String rapidApiHost;

    public JSearchProvider(WebClient.Builder webClientBuilder, ProvidersConfig providersConfig, SearchMetrics metrics) {
        this.settings = providersConfig.getJsearch();
        this.timeout = providersConfig.timeoutFor(settings);
        this.metrics = metrics;
        this.rapidApiHost = URI.create(settings.getBaseUrl()).getHost();
        this.webClient = ProviderHttp.buildClient(webClientBuilder, settings.getBaseUrl());
    }

    @Override
    public ProviderId getId() {
        return ProviderId.JSEARCH;
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
        Mono<ResponseEntity<JSearchResponse>> call = webClient.get()
                .uri(uriBuilder -> uriBuilder.path(SEARCH_PATH)
                        .queryParam("query", query)
                        .queryParam("page", 1)
                        .queryParam("num_pages", 2)
                        .queryParam("remote_jobs_only", true)
                        .build())
                .header("X-RapidAPI-Key", settings.getApiKey())
                .header("X-RapidAPI-Host", rapidApiHost)
                .retrieve()
                .toEntity(JSearchResponse.class);

        return ProviderHttp.timed(getId(), call, timeout, metrics)
                .map(entity -> {
                    warnOnLowQuota(entity);
                    JSearchResponse response = entity.getBody();
                    if (response == null || response.getData() == null) {
                        throw ProviderException.parse(getId(), "no data field in response");
                    }
                    return mapEach(getId(), response.getData(), this::mapToListing);
                });
    }

    private void warnOnLowQuota(ResponseEntity<?> entity) {
        String quotaLeft = entity.getHeaders().getFirst(QUOTA_HEADER);
        if (quotaLeft == null) {
            return;
        }
        try {
            int remaining = Integer.parseInt(quotaLeft.trim());
            if (remaining <= LOW_QUOTA) {
                log.warn("{} - RapidAPI quota nearly exhausted: {} requests left", getId(), remaining);
            }
        } catch (NumberFormatException e) {
            log.debug("{} - unreadable quota header '{}'", getId(), quotaLeft);
        }
    }

    private Listing mapToListing(JSearchJob job) {
        if (isBlank(job.getJobTitle()) || isBlank(job.getEmployerName())) {
            return null;
        }
        String location = DEFAULT_LOCATION;
        if (!isBlank(job.getJobCity())) {
            String region = !isBlank(job.getJobState()) ? job.getJobState() : job.getJobCountry();
            location = isBlank(region) ? job.getJobCity() : job.getJobCity() + ", " + region;
        }
        String link = !isBlank(job.getJobApplyLink()) ? job.getJobApplyLink() : job.getJobUrl();

        return Listing.builder()
                .title(job.getJobTitle().trim())
                .company(job.getEmployerName().trim())
                .location(location)
                .link(link)
                .source(getId())
                .description(stripHtml(job.getJobDescription()))
                .salary(formatSalary(job.getJobMinSalary(), job.getJobMaxSalary()))
                .employmentType(orDefault(job.getJobEmploymentType(), DEFAULT_EMPLOYMENT_TYPE))
                .datePosted(parseDate(job.getJobPostedAtDatetimeUtc(), Instant.now()))
                .build();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class JSearchResponse {
        private List<JSearchJob> data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class JSearchJob {
        @JsonProperty("job_title")
        private String jobTitle;
        @JsonProperty("employer_name")
        private String employerName;
        @JsonProperty("job_city")
        private String jobCity;
        @JsonProperty("job_state")
        private String jobState;
        @JsonProperty("job_country")
        private String jobCountry;
        @JsonProperty("job_apply_link")
        private String jobApplyLink;
        @JsonProperty("job_url")
        private String jobUrl;
        @JsonProperty("job_description")
        private String jobDescription;
        @JsonProperty("job_min_salary")
        private Object jobMinSalary;
        @JsonProperty("job_max_salary")
        private Object jobMaxSalary;
        @JsonProperty("job_employment_type")
        private String jobEmploymentType;
        @JsonProperty("job_posted_at_datetime_utc")
        private String jobPostedAtDatetimeUtc;
    }
}
