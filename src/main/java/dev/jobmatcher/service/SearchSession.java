package dev.jobmatcher.service;

import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.ProviderId;
import dev.jobmatcher.model.ProviderState;
import dev.jobmatcher.model.ProviderStatus;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request-scoped state of one search. Mutated only from the serialized settle
 * and finalize steps of the orchestrator, except the fetched batches which
 * provider tasks stage before scoring.
 */
@Getter
public class SearchSession {

    private final Instant startedAt;
    private final Instant deadline;
    private final Map<ProviderId, ProviderStatus> statuses = new EnumMap<>(ProviderId.class);
    private final List<Listing> collected = new ArrayList<>();
    private final Set<String> seenKeys = new HashSet<>();
    @Getter(AccessLevel.NONE)
    private final Map<ProviderId, List<Listing>> fetched = new ConcurrentHashMap<>();
    private int runningTotal;
    private boolean deadlineExceeded;
    private boolean terminated;

    public SearchSession(Instant startedAt, Duration globalTimeout, Collection<ProviderId> dispatched) {
        this.startedAt = startedAt;
        this.deadline = startedAt.plus(globalTimeout);
        for (ProviderId id : ProviderId.values()) {
            statuses.put(id, ProviderStatus.builder()
                    .provider(id)
                    .state(dispatched.contains(id) ? ProviderState.PENDING : ProviderState.NOT_CONFIGURED)
                    .build());
        }
    }

    /**
     * Keep only listings not delivered earlier in this session and record them as delivered.
     */
    public List<Listing> acceptNew(List<Listing> batch) {
        List<Listing> fresh = new ArrayList<>();
        for (Listing listing : batch) {
            if (seenKeys.add(listing.identityKey())) {
                fresh.add(listing);
            }
        }
        collected.addAll(fresh);
        runningTotal += fresh.size();
        return fresh;
    }

    /**
     * Remember a provider's filtered batch so the deadline cannot discard it while it is being scored.
     */
    public void stageFetched(ProviderId provider, List<Listing> listings) {
        fetched.put(provider, List.copyOf(listings));
    }

    /**
     * Staged batches of providers that fetched but never settled, in provider order.
     */
    public Map<ProviderId, List<Listing>> unsettledFetches() {
        Map<ProviderId, List<Listing>> unsettled = new EnumMap<>(ProviderId.class);
        fetched.forEach((provider, listings) -> {
            if (statuses.get(provider).getState() == ProviderState.PENDING) {
                unsettled.put(provider, listings);
            }
        });
        return unsettled;
    }

    public void markDeadlineExceeded() {
        this.deadlineExceeded = true;
    }

    public void markSucceeded(ProviderId provider, int count, long elapsedMillis) {
        ProviderStatus status = statuses.get(provider);
        status.setState(ProviderState.SUCCEEDED);
        status.setCount(count);
        status.setElapsedMillis(elapsedMillis);
    }

    public void markFailed(ProviderId provider, ProviderState state, String message, long elapsedMillis) {
        ProviderStatus status = statuses.get(provider);
        status.setState(state);
        status.setMessage(message);
        status.setElapsedMillis(elapsedMillis);
    }

    /**
     * Mark every provider still pending as timed out.
     *
     * @return the providers that were still in flight
     */
    public List<ProviderId> expirePending(String message, long elapsedMillis) {
        List<ProviderId> expired = new ArrayList<>();
        for (ProviderStatus status : statuses.values()) {
            if (status.getState() == ProviderState.PENDING) {
                markFailed(status.getProvider(), ProviderState.TIMED_OUT, message, elapsedMillis);
                expired.add(status.getProvider());
            }
        }
        if (!expired.isEmpty()) {
            deadlineExceeded = true;
        }
        return expired;
    }

    public boolean anySucceeded() {
        return statuses.values().stream().anyMatch(s -> s.getState() == ProviderState.SUCCEEDED);
    }

    /**
     * Collected listings, best match first and unscored last. Ties keep delivery order.
     */
    public List<Listing> sortedListings() {
        List<Listing> sorted = new ArrayList<>(collected);
        sorted.sort(Comparator.comparing(Listing::getMatchPercentage,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return sorted;
    }

    public List<ProviderStatus> statusSnapshot() {
        return statuses.values().stream()
                .map(s -> ProviderStatus.builder()
                        .provider(s.getProvider())
                        .state(s.getState())
                        .count(s.getCount())
                        .elapsedMillis(s.getElapsedMillis())
                        .message(s.getMessage())
                        .build())
                .toList();
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, now);
    }

    public void terminate() {
        this.terminated = true;
    }
}
