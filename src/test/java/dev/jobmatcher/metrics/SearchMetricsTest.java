package dev.jobmatcher.metrics;

import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.model.ProviderId;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SearchMetricsTest {

    private MeterRegistry meterRegistry;
    private SearchMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new SearchMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Session counters")
    class SessionTests {

        @Test
        @DisplayName("Should track active sessions")
        void shouldTrackActiveSessions() {
            metrics.recordSessionStarted();
            metrics.recordSessionStarted();
            metrics.recordSessionClosed();

            assertThat(meterRegistry.get("job_matcher_active_sessions").gauge().value()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_matcher_sessions_started_total").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Active sessions should never go negative")
        void activeSessionsShouldNotGoNegative() {
            metrics.recordSessionClosed();

            assertThat(meterRegistry.get("job_matcher_active_sessions").gauge().value()).isZero();
        }

        @Test
        @DisplayName("Should count deadline completions separately")
        void shouldCountDeadlineCompletions() {
            metrics.recordSessionCompleted(false);
            metrics.recordSessionCompleted(true);
            metrics.recordSessionFailed();

            assertThat(meterRegistry.counter("job_matcher_sessions_completed_total").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("job_matcher_deadline_exceeded_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("job_matcher_sessions_failed_total").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Provider meters")
    class ProviderTests {

        @Test
        @DisplayName("Should tag listings and failures by provider")
        void shouldTagByProvider() {
            metrics.recordListingsDelivered(ProviderId.ADZUNA, 4);
            metrics.recordListingsDelivered(ProviderId.REED, 2);
            metrics.recordProviderFailure(ProviderId.REED, ProviderException.Kind.UNAUTHORIZED);

            assertThat(meterRegistry.counter("job_matcher_listings_delivered_total").count()).isEqualTo(6.0);
            assertThat(meterRegistry.counter("job_matcher_listings_by_provider_total", "provider", "Adzuna").count())
                    .isEqualTo(4.0);
            assertThat(meterRegistry.counter("job_matcher_provider_failures_total",
                    "provider", "Reed", "kind", "unauthorized").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reuse one timer per provider")
        void shouldRecordProviderLatency() {
            metrics.recordProviderLatency(ProviderId.THE_MUSE, 1200);
            metrics.recordProviderLatency(ProviderId.THE_MUSE, 800);

            Timer timer = metrics.getProviderTimer(ProviderId.THE_MUSE);
            assertThat(timer.count()).isEqualTo(2);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(2000.0);
        }
    }
}
