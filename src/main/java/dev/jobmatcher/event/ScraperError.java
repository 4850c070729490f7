package dev.jobmatcher.event;

import com.fasterxml.jackson.annotation.JsonTypeName;
import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.model.ProviderId;

@JsonTypeName(SearchEvent.SCRAPER_ERROR)
public record ScraperError(ProviderId provider, String message, ProviderException.Kind kind) implements SearchEvent {

    @Override
    public String type() {
        return SCRAPER_ERROR;
    }
}
