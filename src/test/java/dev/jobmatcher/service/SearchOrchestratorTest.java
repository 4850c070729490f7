package dev.jobmatcher.service;

import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.event.JobsFound;
import dev.jobmatcher.event.ScraperComplete;
import dev.jobmatcher.event.ScraperError;
import dev.jobmatcher.event.ScraperStart;
import dev.jobmatcher.event.SearchComplete;
import dev.jobmatcher.event.SearchEvent;
import dev.jobmatcher.event.SearchStarted;
import dev.jobmatcher.event.UserMessage;
import dev.jobmatcher.exception.NoProvidersConfiguredException;
import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.exception.ScoringException;
import dev.jobmatcher.exception.SearchValidationException;
import dev.jobmatcher.metrics.SearchMetrics;
import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.MatchResult;
import dev.jobmatcher.model.ProviderId;
import dev.jobmatcher.model.ProviderState;
import dev.jobmatcher.model.ProviderStatus;
import dev.jobmatcher.model.SearchFilters;
import dev.jobmatcher.model.SearchRequest;
import dev.jobmatcher.provider.JobProvider;
import dev.jobmatcher.scoring.MatchScorer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class SearchOrchestratorTest {

    private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(10);

    @Mock
    private MatchScorer matchScorer;

    private StubProvider theirstack;
    private StubProvider adzuna;
    private SearchConfig searchConfig;
    private MeterRegistry meterRegistry;
    private SearchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        theirstack = new StubProvider(ProviderId.THEIRSTACK);
        adzuna = new StubProvider(ProviderId.ADZUNA);

        searchConfig = new SearchConfig();
        searchConfig.setGlobalTimeout(Duration.ofSeconds(5));
        searchConfig.setScoringTimeout(Duration.ofSeconds(10));

        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new SearchOrchestrator(List.of(theirstack, adzuna), new QueryPlanner(),
                new FilterService(), matchScorer, searchConfig, new SearchMetrics(meterRegistry));

        lenient().when(matchScorer.getName()).thenReturn("stub");
        lenient().when(matchScorer.score(any(), any())).thenAnswer(inv -> Mono.just(match(80)));
    }

    private static CandidateProfile profile() {
        return CandidateProfile.builder()
                .technicalSkills(List.of("Java", "Spring Boot"))
                .workExperience(List.of("Software Engineer at Acme"))
                .build();
    }

    private static SearchRequest request() {
        return new SearchRequest(profile(), SearchFilters.none());
    }

    private static Listing listing(String title, ProviderId source) {
        return Listing.builder().title(title).company("Acme").source(source).build();
    }

    private static MatchResult match(int percentage) {
        return new MatchResult(percentage, percentage, percentage, "medium",
                List.of("Java"), null, null, null, "stub");
    }

    private List<SearchEvent> collect(SearchRequest request) {
        return orchestrator.search(request).collectList().block(VERIFY_TIMEOUT);
    }

    private static void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static SearchComplete completion(List<SearchEvent> events) {
        return (SearchComplete) events.get(events.size() - 1);
    }

    @Nested
    @DisplayName("Request validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject a profile without skills, experience or responsibilities")
        void shouldRejectEmptyProfile() {
            SearchRequest empty = new SearchRequest(
                    CandidateProfile.builder().industries(List.of("FinTech")).build(), null);

            assertThatThrownBy(() -> orchestrator.search(empty))
                    .isInstanceOf(SearchValidationException.class)
                    .hasMessageContaining("Unable to extract sufficient information");
            assertThat(theirstack.calls.get()).isZero();
        }

        @Test
        @DisplayName("Should reject a missing profile")
        void shouldRejectMissingProfile() {
            assertThatThrownBy(() -> orchestrator.search(new SearchRequest(null, null)))
                    .isInstanceOf(SearchValidationException.class);
        }

        @Test
        @DisplayName("Should fail before streaming when no provider is configured")
        void shouldFailWithoutConfiguredProviders() {
            theirstack.configured = false;
            adzuna.configured = false;

            assertThatThrownBy(() -> orchestrator.search(request()))
                    .isInstanceOf(NoProvidersConfiguredException.class)
                    .hasMessage(SearchOrchestrator.NO_PROVIDERS_MESSAGE);
        }

        @Test
        @DisplayName("Should only dispatch configured providers")
        void shouldOnlyDispatchConfiguredProviders() {
            adzuna.configured = false;
            theirstack.respond(query -> Mono.just(List.of(listing("Java Engineer", ProviderId.THEIRSTACK))));

            List<SearchEvent> events = collect(request());

            SearchStarted started = (SearchStarted) events.get(0);
            assertThat(started.availableProviders()).containsExactly(ProviderId.THEIRSTACK);
            assertThat(started.message()).isEqualTo("Searching 1 job providers for remote roles matching your profile");
            assertThat(adzuna.calls.get()).isZero();
            assertThat(completion(events).providers())
                    .filteredOn(s -> s.getProvider() == ProviderId.ADZUNA)
                    .extracting(ProviderStatus::getState)
                    .containsExactly(ProviderState.NOT_CONFIGURED);
        }
    }

    @Nested
    @DisplayName("Streaming")
    class StreamingTests {

        @Test
        @DisplayName("Should stream one provider's results while another times out")
        void shouldStreamResultsAndReportTimeout() {
            theirstack.respond(query -> Mono.just(List.of(
                    listing("Java Engineer", ProviderId.THEIRSTACK),
                    listing("Backend Engineer", ProviderId.THEIRSTACK),
                    listing("Platform Engineer", ProviderId.THEIRSTACK))));
            adzuna.timeout = Duration.ofMillis(200);
            adzuna.respond(query -> Mono.never());

            StepVerifier.create(orchestrator.search(request()))
                    .assertNext(event -> assertThat(event).isInstanceOf(SearchStarted.class))
                    .assertNext(event -> {
                        JobsFound found = (JobsFound) event;
                        assertThat(found.provider()).isEqualTo(ProviderId.THEIRSTACK);
                        assertThat(found.listings()).hasSize(3);
                        assertThat(found.runningTotal()).isEqualTo(3);
                        assertThat(found.listings()).allMatch(l -> l.getMatchPercentage() == 80);
                    })
                    .assertNext(event -> {
                        ScraperError error = (ScraperError) event;
                        assertThat(error.provider()).isEqualTo(ProviderId.ADZUNA);
                        assertThat(error.kind()).isEqualTo(ProviderException.Kind.TIMEOUT);
                        assertThat(error.message()).isEqualTo("Adzuna did not respond in time");
                    })
                    .assertNext(event -> {
                        SearchComplete complete = (SearchComplete) event;
                        assertThat(complete.totalCount()).isEqualTo(3);
                        assertThat(complete.summary()).isEqualTo("Found 3 remote jobs matching your profile");
                        assertThat(complete.initialPageSize()).isEqualTo(12);
                        assertThat(complete.providers())
                                .filteredOn(s -> s.getProvider() == ProviderId.ADZUNA)
                                .extracting(ProviderStatus::getState)
                                .containsExactly(ProviderState.TIMED_OUT);
                    })
                    .expectComplete()
                    .verify(VERIFY_TIMEOUT);
        }

        @Test
        @DisplayName("Running totals should add up to the final count")
        void runningTotalsShouldMatchFinalCount() {
            theirstack.respond(query -> Mono.just(List.of(
                    listing("Java Engineer", ProviderId.THEIRSTACK),
                    listing("Backend Engineer", ProviderId.THEIRSTACK))));
            adzuna.respond(query -> Mono.just(List.of(listing("Java Engineer", ProviderId.ADZUNA)))
                    .delayElement(Duration.ofMillis(50)));

            List<SearchEvent> events = collect(request());

            List<JobsFound> batches = new ArrayList<>();
            for (SearchEvent event : events) {
                if (event instanceof JobsFound) {
                    batches.add((JobsFound) event);
                }
            }
            assertThat(batches).extracting(JobsFound::runningTotal).containsExactly(2, 3);
            int streamed = batches.stream().mapToInt(b -> b.listings().size()).sum();
            assertThat(completion(events).totalCount()).isEqualTo(streamed);
            assertThat(completion(events).listings()).hasSize(streamed);
        }

        @Test
        @DisplayName("Should dedupe repeated listings across queries of one provider")
        void shouldDedupeAcrossQueries() {
            theirstack.respond(query -> Mono.just(List.of(
                    listing("Java Engineer", ProviderId.THEIRSTACK),
                    listing("JAVA  engineer", ProviderId.THEIRSTACK))));
            adzuna.configured = false;

            List<SearchEvent> events = collect(request());

            assertThat(theirstack.calls.get()).isEqualTo(searchConfig.getMaxQueriesPerProvider());
            assertThat(((JobsFound) events.get(1)).listings()).hasSize(1);
            assertThat(completion(events).totalCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should announce providers when enabled")
        void shouldAnnounceProviders() {
            searchConfig.setAnnounceProviders(true);
            theirstack.respond(query -> Mono.just(List.of()));
            adzuna.respond(query -> Mono.just(List.of()));

            List<SearchEvent> events = collect(request());

            assertThat(events.subList(1, 3))
                    .extracting(e -> ((ScraperStart) e).provider())
                    .containsExactly(ProviderId.THEIRSTACK, ProviderId.ADZUNA);
        }

        @Test
        @DisplayName("Should report a provider with zero listings as complete")
        void shouldReportZeroListings() {
            theirstack.respond(query -> Mono.just(List.of()));
            adzuna.configured = false;

            List<SearchEvent> events = collect(request());

            assertThat(events).hasSize(3);
            assertThat(events.get(1)).isEqualTo(new ScraperComplete(ProviderId.THEIRSTACK, 0));
            SearchComplete complete = completion(events);
            assertThat(complete.totalCount()).isZero();
            assertThat(complete.summary()).isEqualTo(SearchOrchestrator.NO_RESULTS_SUMMARY);
        }

        @Test
        @DisplayName("Should sort final listings by match with unscored last")
        void shouldSortFinalListings() {
            Listing low = listing("Low Match", ProviderId.THEIRSTACK);
            Listing high = listing("High Match", ProviderId.THEIRSTACK);
            Listing unscored = listing("No Score", ProviderId.THEIRSTACK);
            theirstack.respond(query -> Mono.just(List.of(low, unscored, high)));
            adzuna.configured = false;
            lenient().when(matchScorer.score(any(), any())).thenAnswer(inv -> {
                Listing listing = inv.getArgument(0);
                if (listing == unscored) {
                    return Mono.error(new ScoringException("model unavailable"));
                }
                return Mono.just(match(listing == high ? 92 : 40));
            });

            List<SearchEvent> events = collect(request());

            assertThat(completion(events).listings())
                    .extracting(Listing::getTitle)
                    .containsExactly("High Match", "Low Match", "No Score");
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should warn and complete empty when every provider fails")
        void shouldCompleteWhenAllProvidersFail() {
            theirstack.respond(query -> Mono.error(ProviderException.http(ProviderId.THEIRSTACK, 503, null)));
            adzuna.respond(query -> Mono.error(ProviderException.http(ProviderId.ADZUNA, 429, null)));

            List<SearchEvent> events = collect(request());

            assertThat(events).filteredOn(e -> e instanceof ScraperError)
                    .extracting(e -> ((ScraperError) e).message())
                    .containsExactlyInAnyOrder(
                            "Theirstack is temporarily unavailable",
                            "Adzuna rate limit reached, try again later");
            UserMessage warning = (UserMessage) events.get(events.size() - 2);
            assertThat(warning.title()).isEqualTo("Job providers unavailable");
            assertThat(warning.severity()).isEqualTo(UserMessage.Severity.WARNING);
            assertThat(completion(events).totalCount()).isZero();
            assertThat(meterRegistry.counter("job_matcher_provider_failures_total",
                    "provider", "Adzuna", "kind", "http").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should stop querying a provider that rejects its credentials")
        void shouldShortCircuitUnauthorized() {
            theirstack.respond(query -> Mono.error(ProviderException.http(ProviderId.THEIRSTACK, 401, null)));
            adzuna.configured = false;

            List<SearchEvent> events = collect(request());

            assertThat(theirstack.calls.get()).isEqualTo(1);
            ScraperError error = (ScraperError) events.get(1);
            assertThat(error.kind()).isEqualTo(ProviderException.Kind.UNAUTHORIZED);
            assertThat(completion(events).providers())
                    .filteredOn(s -> s.getProvider() == ProviderId.THEIRSTACK)
                    .extracting(ProviderStatus::getState)
                    .containsExactly(ProviderState.FAILED);
        }

        @Test
        @DisplayName("Should keep results when only some queries fail")
        void shouldToleratePartialQueryFailures() {
            AtomicInteger seen = new AtomicInteger();
            theirstack.respond(query -> seen.getAndIncrement() == 0
                    ? Mono.error(ProviderException.http(ProviderId.THEIRSTACK, 500, null))
                    : Mono.just(List.of(listing("Java Engineer", ProviderId.THEIRSTACK))));
            adzuna.configured = false;

            List<SearchEvent> events = collect(request());

            assertThat(events.get(1)).isInstanceOf(JobsFound.class);
            assertThat(completion(events).totalCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should deliver listings unscored when scoring fails")
        void shouldDeliverUnscoredOnScoringFailure() {
            theirstack.respond(query -> Mono.just(List.of(listing("Java Engineer", ProviderId.THEIRSTACK))));
            adzuna.configured = false;
            lenient().when(matchScorer.score(any(), any()))
                    .thenReturn(Mono.error(new ScoringException("model unavailable")));

            List<SearchEvent> events = collect(request());

            Listing delivered = ((JobsFound) events.get(1)).listings().get(0);
            assertThat(delivered.isScored()).isFalse();
            assertThat(meterRegistry.counter("job_matcher_scoring_failures_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should deliver slowly scored listings unscored before the deadline")
        void shouldDeliverSlowScoringUnscoredBeforeDeadline() {
            searchConfig.setGlobalTimeout(Duration.ofSeconds(2));
            theirstack.respond(query -> Mono.just(List.of(listing("Java Engineer", ProviderId.THEIRSTACK))));
            adzuna.respond(query -> Mono.just(List.of(listing("Slow Engineer", ProviderId.ADZUNA))));
            lenient().when(matchScorer.score(any(), any())).thenAnswer(inv -> {
                Listing listing = inv.getArgument(0);
                return listing.getSource() == ProviderId.ADZUNA ? Mono.never() : Mono.just(match(70));
            });

            List<SearchEvent> events = collect(request());

            assertThat(events).hasSize(4);
            assertThat(events).filteredOn(UserMessage.class::isInstance).isEmpty();
            JobsFound slow = (JobsFound) events.get(2);
            assertThat(slow.provider()).isEqualTo(ProviderId.ADZUNA);
            assertThat(slow.listings().get(0).isScored()).isFalse();
            SearchComplete complete = completion(events);
            assertThat(complete.totalCount()).isEqualTo(2);
            assertThat(complete.listings()).extracting(Listing::getTitle)
                    .containsExactly("Java Engineer", "Slow Engineer");
            assertThat(complete.providers())
                    .filteredOn(s -> s.getProvider() == ProviderId.ADZUNA)
                    .extracting(ProviderStatus::getState)
                    .containsExactly(ProviderState.SUCCEEDED);
        }

        @Test
        @DisplayName("Should keep fetched listings when the deadline interrupts scoring")
        void shouldKeepFetchedListingsWhenDeadlineInterruptsScoring() {
            searchConfig.setGlobalTimeout(Duration.ofSeconds(1));
            theirstack.respond(query -> Mono.just(List.of(listing("Java Engineer", ProviderId.THEIRSTACK)))
                    .subscribeOn(Schedulers.boundedElastic()));
            adzuna.configured = false;
            lenient().when(matchScorer.score(any(), any())).thenAnswer(inv -> {
                pause(Duration.ofMillis(1500));
                return Mono.just(match(70));
            });

            List<SearchEvent> events = collect(request());

            assertThat(events).hasSize(4);
            JobsFound kept = (JobsFound) events.get(1);
            assertThat(kept.provider()).isEqualTo(ProviderId.THEIRSTACK);
            assertThat(kept.listings()).extracting(Listing::getTitle).containsExactly("Java Engineer");
            UserMessage warning = (UserMessage) events.get(2);
            assertThat(warning.title()).isEqualTo("Search time limit reached");
            assertThat(warning.message()).contains("Theirstack").contains("without a match score");
            SearchComplete complete = completion(events);
            assertThat(complete.totalCount()).isEqualTo(1);
            assertThat(complete.providers())
                    .filteredOn(s -> s.getProvider() == ProviderId.THEIRSTACK)
                    .extracting(ProviderStatus::getState)
                    .containsExactly(ProviderState.SUCCEEDED);
            assertThat(meterRegistry.counter("job_matcher_deadline_exceeded_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should emit exactly one terminal event, last")
        void shouldEmitSingleTerminalEvent() {
            theirstack.respond(query -> Mono.just(List.of(listing("Java Engineer", ProviderId.THEIRSTACK))));
            adzuna.respond(query -> Mono.error(ProviderException.parse(ProviderId.ADZUNA, "missing results")));

            List<SearchEvent> events = collect(request());

            assertThat(events).filteredOn(SearchEvent::terminal).hasSize(1);
            assertThat(events.get(events.size() - 1).terminal()).isTrue();
        }
    }

    /**
     * Provider double with a configurable response per query.
     */
    private static final class StubProvider implements JobProvider {

        private final ProviderId id;
        private final AtomicInteger calls = new AtomicInteger();
        private boolean configured = true;
        private Duration timeout = Duration.ofSeconds(5);
        private Function<String, Mono<List<Listing>>> behaviour = query -> Mono.just(List.of());

        StubProvider(ProviderId id) {
            this.id = id;
        }

        void respond(Function<String, Mono<List<Listing>>> behaviour) {
            this.behaviour = behaviour;
        }

        @Override
        public ProviderId getId() {
            return id;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public Duration getTimeout() {
            return timeout;
        }

        @Override
        public Mono<List<Listing>> search(String query, SearchFilters filters) {
            calls.incrementAndGet();
            return behaviour.apply(query);
        }
    }
}
