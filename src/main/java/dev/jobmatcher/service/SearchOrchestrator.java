package dev.jobmatcher.service;

import dev.jobmatcher.config.SearchConfig;
import dev.jobmatcher.event.JobsFound;
import dev.jobmatcher.event.ScraperComplete;
import dev.jobmatcher.event.ScraperError;
import dev.jobmatcher.event.ScraperStart;
import dev.jobmatcher.event.SearchComplete;
import dev.jobmatcher.event.SearchError;
import dev.jobmatcher.event.SearchEvent;
import dev.jobmatcher.event.SearchStarted;
import dev.jobmatcher.event.UserMessage;
import dev.jobmatcher.exception.NoProvidersConfiguredException;
import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.exception.SearchValidationException;
import dev.jobmatcher.metrics.SearchMetrics;
import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.ProviderId;
import dev.jobmatcher.model.ProviderState;
import dev.jobmatcher.model.SearchFilters;
import dev.jobmatcher.model.SearchRequest;
import dev.jobmatcher.provider.JobProvider;
import dev.jobmatcher.scoring.MatchScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fans a search out to every configured provider and turns the results into
 * an ordered stream of search events ending in exactly one terminal event.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchOrchestrator {

    private static final String SEPARATOR = "========================================";

    static final String INSUFFICIENT_PROFILE_MESSAGE = "Unable to extract sufficient information from resume "
            + "for job matching. Please ensure your resume contains clear work experience, skills, "
            + "or responsibilities.";
    static final String NO_PROVIDERS_MESSAGE = "No job search APIs are configured";
    static final String NO_RESULTS_SUMMARY = "No remote jobs found matching your profile. Try broadening "
            + "your search criteria or updating your resume with more common industry terms.";

    private final List<JobProvider> providers;
    private final QueryPlanner queryPlanner;
    private final FilterService filterService;
    private final MatchScorer matchScorer;
    private final SearchConfig searchConfig;
    private final SearchMetrics metrics;

    /**
     * Validate the request and open the event stream.
     *
     * @throws SearchValidationException      when the profile carries no usable signal
     * @throws NoProvidersConfiguredException when no provider has credentials
     */
    public Flux<SearchEvent> search(SearchRequest request) {
        CandidateProfile profile = request != null ? request.profile() : null;
        if (profile == null || !profile.hasSignal()) {
            throw new SearchValidationException(INSUFFICIENT_PROFILE_MESSAGE);
        }

        List<JobProvider> configured = configuredProviders();
        if (configured.isEmpty()) {
            throw new NoProvidersConfiguredException(NO_PROVIDERS_MESSAGE);
        }

        SearchFilters filters = request.filters() != null ? request.filters() : SearchFilters.none();
        List<String> queries = queryPlanner.plan(profile).stream()
                .limit(searchConfig.getMaxQueriesPerProvider())
                .toList();

        return Flux.defer(() -> run(configured, queries, profile, filters));
    }

    public List<JobProvider> configuredProviders() {
        return providers.stream().filter(JobProvider::isConfigured).toList();
    }

    public List<JobProvider> getProviders() {
        return providers;
    }

    private Flux<SearchEvent> run(List<JobProvider> configured, List<String> queries,
            CandidateProfile profile, SearchFilters filters) {
        List<ProviderId> ids = configured.stream().map(JobProvider::getId).toList();
        SearchSession session = new SearchSession(Instant.now(), searchConfig.getGlobalTimeout(), ids);

        log.info(SEPARATOR);
        log.info("Search starting");
        log.info(SEPARATOR);
        log.info("Providers configured: {} {}", ids.size(), ids);
        log.info("Queries per provider: {}", queries);
        log.info("Global deadline: {}s (at {}), scorer: {}", searchConfig.getGlobalTimeout().toSeconds(),
                session.getDeadline(), matchScorer.getName());
        metrics.recordSessionStarted();

        Flux<SearchEvent> started = Flux.just(new SearchStarted(
                "Searching " + ids.size() + " job providers for remote roles matching your profile", ids));

        Flux<SearchEvent> announced = searchConfig.isAnnounceProviders()
                ? Flux.fromIterable(ids).map(ScraperStart::new)
                : Flux.empty();

        Flux<SearchEvent> settled = Flux.fromIterable(configured)
                .flatMap(provider -> runProvider(provider, queries, profile, filters, session))
                .takeUntilOther(Mono.delay(searchConfig.getGlobalTimeout())
                        .doOnNext(tick -> log.warn("Global deadline of {}s reached",
                                searchConfig.getGlobalTimeout().toSeconds())))
                .map(outcome -> settle(session, outcome));

        return Flux.concat(started, announced, settled, Flux.defer(() -> finish(session)))
                .onErrorResume(e -> {
                    log.error("Search failed after the stream opened: {}", e.getMessage(), e);
                    metrics.recordSessionFailed();
                    session.terminate();
                    return Mono.just(new SearchError("Search failed: " + e.getMessage(),
                            SearchError.CODE_SEARCH_ERROR));
                })
                .doFinally(signal -> {
                    metrics.recordSessionClosed();
                    log.info("Search stream closed ({})", signal);
                });
    }

    /**
     * Run the planned queries against one provider, then filter, dedupe and score the batch.
     * The filtered batch is staged on the session before scoring starts.
     * Always completes with a single outcome; failures are carried, never thrown.
     */
    private Mono<ProviderOutcome> runProvider(JobProvider provider, List<String> queries,
            CandidateProfile profile, SearchFilters filters, SearchSession session) {
        ProviderId id = provider.getId();
        Duration timeout = searchConfig.capProviderTimeout(provider.getTimeout());

        return fetchAll(provider, queries, filters)
                .timeout(timeout)
                .map(listings -> filterService.apply(dedupe(listings), filters))
                .doOnNext(listings -> session.stageFetched(id, listings))
                .flatMap(listings -> scoreAll(listings, profile, session))
                .map(this::applyMinimumMatch)
                .map(listings -> ProviderOutcome.success(id, listings, elapsedMillis(session)))
                .onErrorResume(e -> {
                    ProviderException error = ProviderException.classify(id, e);
                    log.warn("Provider {} failed ({}): {}", id, error.getKind(), error.getMessage());
                    return Mono.just(ProviderOutcome.failure(id, error, elapsedMillis(session)));
                });
    }

    private Mono<List<Listing>> fetchAll(JobProvider provider, List<String> queries, SearchFilters filters) {
        ProviderId id = provider.getId();
        return Mono.defer(() -> {
            AtomicReference<ProviderException> firstError = new AtomicReference<>();
            AtomicInteger answered = new AtomicInteger();

            return Flux.fromIterable(queries)
                    .concatMap(query -> provider.search(query, filters)
                            .doOnNext(batch -> {
                                answered.incrementAndGet();
                                log.debug("{} '{}' returned {} listings", id, query, batch.size());
                            })
                            .onErrorResume(e -> {
                                ProviderException error = ProviderException.classify(id, e);
                                if (error.getKind() == ProviderException.Kind.UNAUTHORIZED) {
                                    return Mono.error(error);
                                }
                                log.warn("{} query '{}' failed: {}", id, query, error.getMessage());
                                firstError.compareAndSet(null, error);
                                return Mono.empty();
                            }))
                    .collectList()
                    .flatMap(batches -> {
                        if (answered.get() == 0 && firstError.get() != null) {
                            return Mono.error(firstError.get());
                        }
                        List<Listing> all = new ArrayList<>();
                        batches.forEach(all::addAll);
                        return Mono.just(all);
                    });
        });
    }

    private List<Listing> dedupe(List<Listing> listings) {
        Map<String, Listing> unique = new LinkedHashMap<>();
        for (Listing listing : listings) {
            unique.putIfAbsent(listing.identityKey(), listing);
        }
        return new ArrayList<>(unique.values());
    }

    private Mono<List<Listing>> scoreAll(List<Listing> listings, CandidateProfile profile, SearchSession session) {
        if (listings.isEmpty()) {
            return Mono.just(listings);
        }
        return Flux.fromIterable(listings)
                .flatMapSequential(listing -> scoreOne(listing, profile, session),
                        searchConfig.getScoringConcurrency())
                .collectList();
    }

    private Mono<Listing> scoreOne(Listing listing, CandidateProfile profile, SearchSession session) {
        return Mono.defer(() -> {
            Duration budget = searchConfig.capScoringTimeout(Duration.between(Instant.now(), session.getDeadline()));
            if (budget.isZero()) {
                log.debug("No time left to score '{}' ({}) - delivering unscored",
                        listing.getTitle(), listing.getSource());
                return Mono.just(listing);
            }
            return matchScorer.score(listing, profile)
                    .timeout(budget)
                    .map(result -> {
                        listing.applyMatch(result);
                        return listing;
                    })
                    .onErrorResume(e -> {
                        log.warn("Scoring failed for '{}' ({}): {} - delivering unscored",
                                listing.getTitle(), listing.getSource(), e.getMessage());
                        metrics.recordScoringFailure();
                        return Mono.just(listing);
                    })
                    .defaultIfEmpty(listing);
        });
    }

    private List<Listing> applyMinimumMatch(List<Listing> listings) {
        int minimum = searchConfig.getMinMatchPercentage();
        if (minimum <= 0) {
            return listings;
        }
        return listings.stream()
                .filter(l -> !l.isScored() || l.getMatchPercentage() >= minimum)
                .toList();
    }

    /**
     * Apply one provider outcome to the session and describe it as exactly one event.
     */
    private SearchEvent settle(SearchSession session, ProviderOutcome outcome) {
        ProviderId id = outcome.provider();
        metrics.recordProviderLatency(id, outcome.elapsedMillis());

        if (outcome.failed()) {
            ProviderException error = outcome.error();
            ProviderState state = error.getKind() == ProviderException.Kind.TIMEOUT
                    ? ProviderState.TIMED_OUT
                    : ProviderState.FAILED;
            String message = ErrorMessages.forProviderFailure(id, error);
            session.markFailed(id, state, message, outcome.elapsedMillis());
            metrics.recordProviderFailure(id, error.getKind());
            log.info("{} settled: {} ({})", id, state, error.getKind());
            return new ScraperError(id, message, error.getKind());
        }

        List<Listing> fresh = session.acceptNew(outcome.listings());
        session.markSucceeded(id, fresh.size(), outcome.elapsedMillis());
        log.info("{} settled: {} listings, running total {}", id, fresh.size(), session.getRunningTotal());

        if (fresh.isEmpty()) {
            return new ScraperComplete(id, 0);
        }
        metrics.recordListingsDelivered(id, fresh.size());
        return new JobsFound(id, fresh, session.getRunningTotal(), elapsedSeconds(session));
    }

    private Flux<SearchEvent> finish(SearchSession session) {
        List<SearchEvent> events = new ArrayList<>();
        long elapsed = elapsedMillis(session);

        // Batches fetched before the deadline but still being scored go out as they are.
        List<ProviderId> unranked = new ArrayList<>();
        session.unsettledFetches().forEach((id, listings) -> {
            log.warn("{} fetched {} listings but scoring did not finish in time - delivering unscored",
                    id, listings.size());
            unranked.add(id);
            events.add(settle(session, ProviderOutcome.success(id, applyMinimumMatch(listings), elapsed)));
        });

        List<ProviderId> unfinished = session.expirePending("Stopped at the search time limit", elapsed);
        unfinished.forEach(id -> metrics.recordProviderFailure(id, ProviderException.Kind.TIMEOUT));
        if (!unranked.isEmpty()) {
            session.markDeadlineExceeded();
        }
        if (session.isDeadlineExceeded()) {
            events.add(UserMessage.warning("Search time limit reached",
                    deadlineMessage(unfinished, unranked, session.getRunningTotal())));
        }

        if (!session.anySucceeded()) {
            events.add(UserMessage.warning("Job providers unavailable",
                    "None of the job providers returned results. Please try again in a few minutes."));
        }

        List<Listing> listings = session.sortedListings();
        String summary = listings.isEmpty()
                ? NO_RESULTS_SUMMARY
                : "Found " + listings.size() + " remote jobs matching your profile";

        events.add(new SearchComplete(listings, listings.size(), elapsedSeconds(session), summary,
                searchConfig.getInitialPageSize(), session.statusSnapshot()));
        session.terminate();
        metrics.recordSessionCompleted(session.isDeadlineExceeded());

        log.info(SEPARATOR);
        log.info("SEARCH SUMMARY: {} listings in {}s{}", listings.size(), elapsedSeconds(session),
                session.isDeadlineExceeded() ? " (deadline reached)" : "");
        log.info(SEPARATOR);
        return Flux.fromIterable(events);
    }

    private static String deadlineMessage(List<ProviderId> unfinished, List<ProviderId> unranked, int found) {
        StringBuilder message = new StringBuilder();
        if (!unfinished.isEmpty()) {
            message.append("Some providers did not respond in time (").append(joinNames(unfinished)).append("). ");
        }
        if (!unranked.isEmpty()) {
            message.append("Results from ").append(joinNames(unranked))
                    .append(" could not be ranked in time and are shown without a match score. ");
        }
        return message.append("Showing the ").append(found).append(" results found so far.").toString();
    }

    private static String joinNames(List<ProviderId> ids) {
        return String.join(", ", ids.stream().map(ProviderId::getDisplayName).toList());
    }

    private static long elapsedMillis(SearchSession session) {
        return session.elapsed(Instant.now()).toMillis();
    }

    private static double elapsedSeconds(SearchSession session) {
        return Math.round(elapsedMillis(session) / 100.0) / 10.0;
    }
}
