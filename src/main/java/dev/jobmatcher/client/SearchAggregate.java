package dev.jobmatcher.client;

import dev.jobmatcher.event.JobsFound;
import dev.jobmatcher.event.ScraperComplete;
import dev.jobmatcher.event.ScraperError;
import dev.jobmatcher.event.SearchComplete;
import dev.jobmatcher.event.SearchError;
import dev.jobmatcher.event.SearchEvent;
import dev.jobmatcher.event.SearchStarted;
import dev.jobmatcher.event.UserMessage;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.ProviderId;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Client-side view of one search, built only from the frames received.
 * The total is the size of the locally collected listings; totals reported by
 * the server are kept for display only. Collections are exposed read-only.
 */
@Slf4j
@Getter
public class SearchAggregate {

    private final List<Listing> listings = new ArrayList<>();
    private final Set<ProviderId> availableProviders = new LinkedHashSet<>();
    private final Set<ProviderId> completedProviders = new LinkedHashSet<>();
    private final List<ScraperError> providerErrors = new ArrayList<>();
    private final List<UserMessage> messages = new ArrayList<>();
    private SearchComplete completion;
    private SearchError error;
    private Integer lastServerTotal;
    private boolean terminal;
    private boolean interrupted;
    private StreamTransportException transportFailure;

    /**
     * Apply one decoded event. Events after the terminal one are ignored.
     */
    public void apply(SearchEvent event) {
        if (terminal) {
            log.debug("Ignoring {} after terminal event", event.type());
            return;
        }
        if (event instanceof SearchStarted) {
            availableProviders.addAll(((SearchStarted) event).availableProviders());
        } else if (event instanceof JobsFound) {
            JobsFound found = (JobsFound) event;
            listings.addAll(found.listings());
            completedProviders.add(found.provider());
            lastServerTotal = found.runningTotal();
            if (found.runningTotal() != listings.size()) {
                log.debug("Server total {} differs from local total {}", found.runningTotal(), listings.size());
            }
        } else if (event instanceof ScraperComplete) {
            completedProviders.add(((ScraperComplete) event).provider());
        } else if (event instanceof ScraperError) {
            ScraperError failed = (ScraperError) event;
            providerErrors.add(failed);
            completedProviders.add(failed.provider());
        } else if (event instanceof UserMessage) {
            messages.add((UserMessage) event);
        } else if (event instanceof SearchComplete) {
            completion = (SearchComplete) event;
            lastServerTotal = completion.totalCount();
        } else if (event instanceof SearchError) {
            error = (SearchError) event;
        }
        if (event.terminal()) {
            terminal = true;
        }
    }

    public List<Listing> getListings() {
        return Collections.unmodifiableList(listings);
    }

    public Set<ProviderId> getAvailableProviders() {
        return Collections.unmodifiableSet(availableProviders);
    }

    public Set<ProviderId> getCompletedProviders() {
        return Collections.unmodifiableSet(completedProviders);
    }

    public List<ScraperError> getProviderErrors() {
        return Collections.unmodifiableList(providerErrors);
    }

    public List<UserMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public int getTotal() {
        return listings.size();
    }

    /**
     * Collected listings, best match first with unscored listings last.
     */
    public List<Listing> sortedListings() {
        List<Listing> sorted = new ArrayList<>(listings);
        sorted.sort(Comparator.comparing(Listing::getMatchPercentage,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return sorted;
    }

    public boolean isSuccessful() {
        return completion != null && !interrupted;
    }

    void markInterrupted(StreamTransportException failure) {
        this.interrupted = true;
        this.transportFailure = failure;
    }
}
