package dev.jobmatcher.event;

import com.fasterxml.jackson.annotation.JsonTypeName;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.ProviderStatus;

import java.util.List;

@JsonTypeName(SearchEvent.SEARCH_COMPLETE)
public record SearchComplete(
        List<Listing> listings,
        int totalCount,
        double elapsedSeconds,
        String summary,
        int initialPageSize,
        List<ProviderStatus> providers
) implements SearchEvent {

    public SearchComplete {
        listings = listings != null ? listings : List.of();
        providers = providers != null ? providers : List.of();
    }

    @Override
    public String type() {
        return SEARCH_COMPLETE;
    }

    @Override
    public boolean terminal() {
        return true;
    }
}
