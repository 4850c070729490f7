package dev.jobmatcher.event;

import com.fasterxml.jackson.annotation.JsonTypeName;
import dev.jobmatcher.model.ProviderId;

import java.util.List;

@JsonTypeName(SearchEvent.SEARCH_STARTED)
public record SearchStarted(String message, List<ProviderId> availableProviders) implements SearchEvent {

    @Override
    public String type() {
        return SEARCH_STARTED;
    }
}
