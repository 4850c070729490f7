package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Search session limits. Loaded from application.yml under 'search' prefix.
 * Getters clamp values so a bad override cannot break the timeout layering.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "search")
public class SearchConfig {

    private static final Duration MIN_GLOBAL_TIMEOUT = Duration.ofSeconds(1);

    private Duration globalTimeout = Duration.ofSeconds(170);
    private Duration scoringTimeout = Duration.ofSeconds(20);
    private Duration heartbeatInterval = Duration.ofSeconds(15);
    private int maxQueriesPerProvider = 3;
    private int scoringConcurrency = 4;
    private int minMatchPercentage = 0;
    private int initialPageSize = 12;
    private boolean announceProviders = false;

    public Duration getGlobalTimeout() {
        if (globalTimeout == null || globalTimeout.compareTo(MIN_GLOBAL_TIMEOUT) < 0) {
            return MIN_GLOBAL_TIMEOUT;
        }
        return globalTimeout;
    }

    public Duration getScoringTimeout() {
        if (scoringTimeout == null || scoringTimeout.isNegative() || scoringTimeout.isZero()) {
            return Duration.ofSeconds(20);
        }
        return scoringTimeout;
    }

    /**
     * Zero or negative disables keep-alive frames.
     */
    public Duration getHeartbeatInterval() {
        if (heartbeatInterval == null || heartbeatInterval.isNegative()) {
            return Duration.ZERO;
        }
        return heartbeatInterval;
    }

    public int getMaxQueriesPerProvider() {
        return Math.max(1, Math.min(maxQueriesPerProvider, 12));
    }

    public int getScoringConcurrency() {
        return Math.max(1, scoringConcurrency);
    }

    public int getMinMatchPercentage() {
        return Math.max(0, Math.min(minMatchPercentage, 100));
    }

    public int getInitialPageSize() {
        return Math.max(1, initialPageSize);
    }

    /**
     * Keep a provider timeout strictly below the session deadline.
     */
    public Duration capProviderTimeout(Duration requested) {
        Duration global = getGlobalTimeout();
        Duration ceiling = global.minus(global.dividedBy(10));
        if (requested == null || requested.compareTo(ceiling) > 0) {
            return ceiling;
        }
        return requested;
    }

    /**
     * Scoring time for a listing given the time left before the session deadline.
     * Leaves a twentieth of the global timeout for the provider to settle; zero means skip scoring.
     */
    public Duration capScoringTimeout(Duration untilDeadline) {
        Duration available = untilDeadline.minus(getGlobalTimeout().dividedBy(20));
        if (available.isNegative()) {
            return Duration.ZERO;
        }
        Duration timeout = getScoringTimeout();
        return available.compareTo(timeout) < 0 ? available : timeout;
    }
}
