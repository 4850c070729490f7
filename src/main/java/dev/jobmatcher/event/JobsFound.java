package dev.jobmatcher.event;

import com.fasterxml.jackson.annotation.JsonTypeName;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.ProviderId;

import java.util.List;

/**
 * One provider batch. {@code runningTotal} is the server's sum of delivered batches,
 * informational only for clients.
 */
@JsonTypeName(SearchEvent.JOBS_FOUND)
public record JobsFound(ProviderId provider, List<Listing> listings, int runningTotal, double elapsedSeconds)
        implements SearchEvent {

    public JobsFound {
        listings = listings != null ? listings : List.of();
    }

    @Override
    public String type() {
        return JOBS_FOUND;
    }
}
