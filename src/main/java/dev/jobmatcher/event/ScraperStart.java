package dev.jobmatcher.event;

import com.fasterxml.jackson.annotation.JsonTypeName;
import dev.jobmatcher.model.ProviderId;

@JsonTypeName(SearchEvent.SCRAPER_START)
public record ScraperStart(ProviderId provider) implements SearchEvent {

    @Override
    public String type() {
        return SCRAPER_START;
    }
}
