package dev.jobmatcher.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Credentials and endpoints for the external job providers.
 * Loaded from application.yml under 'providers' prefix; keys come from the environment.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "providers")
public class ProvidersConfig {

    private Duration defaultTimeout = Duration.ofSeconds(15);
    private int resultsPerPage = 50;

    private Provider theirstack = new Provider("https://api.theirstack.com/v1");
    private Provider adzuna = new Provider("https://api.adzuna.com/v1");
    private Provider themuse = new Provider("https://www.themuse.com/api/public");
    private Provider reed = new Provider("https://www.reed.co.uk/api/1.0");
    private Provider jsearch = new Provider("https://jsearch.p.rapidapi.com");
    private Provider rapidapiJobs = new Provider("https://jobs-api14.p.rapidapi.com");

    /**
     * Effective timeout for a provider, falling back to the default.
     */
    public Duration timeoutFor(Provider provider) {
        Duration timeout = provider.getTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return defaultTimeout;
        }
        return timeout;
    }

    public int getResultsPerPage() {
        return Math.max(1, Math.min(resultsPerPage, 100));
    }

    @Data
    @NoArgsConstructor
    public static class Provider {
        private boolean enabled = true;
        private String apiKey;
        private String appId;
        private String baseUrl;
        private Duration timeout;

        public Provider(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public boolean hasAppId() {
            return appId != null && !appId.isBlank();
        }
    }
}
