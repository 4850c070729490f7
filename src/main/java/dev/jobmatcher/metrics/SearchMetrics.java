package dev.jobmatcher.metrics;

import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.model.ProviderId;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for search sessions and provider calls.
 */
@Component
public class SearchMetrics {

    private static final String TAG_PROVIDER = "provider";
    private final MeterRegistry registry;

    // Counters
    private final Counter sessionsStartedCounter;
    private final Counter sessionsCompletedCounter;
    private final Counter sessionsFailedCounter;
    private final Counter deadlineExceededCounter;
    private final Counter listingsDeliveredCounter;
    private final Counter scoringFailuresCounter;

    // Timers (per provider)
    private final ConcurrentHashMap<ProviderId, Timer> providerTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger activeSessions = new AtomicInteger(0);

    public SearchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.sessionsStartedCounter = Counter.builder("job_matcher_sessions_started_total")
                .description("Search sessions opened")
                .register(registry);

        this.sessionsCompletedCounter = Counter.builder("job_matcher_sessions_completed_total")
                .description("Search sessions that ended with search_complete")
                .register(registry);

        this.sessionsFailedCounter = Counter.builder("job_matcher_sessions_failed_total")
                .description("Search sessions that ended with an error event")
                .register(registry);

        this.deadlineExceededCounter = Counter.builder("job_matcher_deadline_exceeded_total")
                .description("Search sessions finalized by the global deadline")
                .register(registry);

        this.listingsDeliveredCounter = Counter.builder("job_matcher_listings_delivered_total")
                .description("Listings delivered to clients across all providers")
                .register(registry);

        this.scoringFailuresCounter = Counter.builder("job_matcher_scoring_failures_total")
                .description("Listings delivered unscored after a scoring failure")
                .register(registry);

        Gauge.builder("job_matcher_active_sessions", activeSessions, AtomicInteger::get)
                .description("Search sessions currently streaming")
                .register(registry);
    }

    /**
     * Get or create a timer for a specific provider.
     */
    public Timer getProviderTimer(ProviderId provider) {
        return providerTimers.computeIfAbsent(provider, id ->
                Timer.builder("job_matcher_provider_request_duration")
                        .description("Time to fetch listings from a provider")
                        .tag(TAG_PROVIDER, id.getDisplayName())
                        .register(registry)
        );
    }

    public void recordSessionStarted() {
        sessionsStartedCounter.increment();
        activeSessions.incrementAndGet();
    }

    public void recordSessionCompleted(boolean deadlineExceeded) {
        sessionsCompletedCounter.increment();
        if (deadlineExceeded) {
            deadlineExceededCounter.increment();
        }
    }

    public void recordSessionFailed() {
        sessionsFailedCounter.increment();
    }

    public void recordSessionClosed() {
        activeSessions.updateAndGet(current -> Math.max(0, current - 1));
    }

    /**
     * Record listings delivered in one jobs_found batch.
     */
    public void recordListingsDelivered(ProviderId provider, int count) {
        listingsDeliveredCounter.increment(count);
        Counter.builder("job_matcher_listings_by_provider_total")
                .tag(TAG_PROVIDER, provider.getDisplayName())
                .register(registry)
                .increment(count);
    }

    /**
     * Record a provider failure by kind.
     */
    public void recordProviderFailure(ProviderId provider, ProviderException.Kind kind) {
        Counter.builder("job_matcher_provider_failures_total")
                .tag(TAG_PROVIDER, provider.getDisplayName())
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordScoringFailure() {
        scoringFailuresCounter.increment();
    }

    /**
     * Record request latency for a provider.
     */
    public void recordProviderLatency(ProviderId provider, long latencyMs) {
        getProviderTimer(provider).record(Duration.ofMillis(latencyMs));
    }
}
