package dev.jobmatcher.event;

import com.fasterxml.jackson.annotation.JsonTypeName;
import dev.jobmatcher.model.ProviderId;

@JsonTypeName(SearchEvent.SCRAPER_COMPLETE)
public record ScraperComplete(ProviderId provider, int count) implements SearchEvent {

    @Override
    public String type() {
        return SCRAPER_COMPLETE;
    }
}
