package dev.jobmatcher.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Set;

/**
 * One message on the search stream. Serialized with a {@code type} discriminator
 * that also becomes the SSE event name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SearchStarted.class, name = SearchEvent.SEARCH_STARTED),
        @JsonSubTypes.Type(value = ScraperStart.class, name = SearchEvent.SCRAPER_START),
        @JsonSubTypes.Type(value = JobsFound.class, name = SearchEvent.JOBS_FOUND),
        @JsonSubTypes.Type(value = ScraperError.class, name = SearchEvent.SCRAPER_ERROR),
        @JsonSubTypes.Type(value = ScraperComplete.class, name = SearchEvent.SCRAPER_COMPLETE),
        @JsonSubTypes.Type(value = UserMessage.class, name = SearchEvent.USER_MESSAGE),
        @JsonSubTypes.Type(value = SearchComplete.class, name = SearchEvent.SEARCH_COMPLETE),
        @JsonSubTypes.Type(value = SearchError.class, name = SearchEvent.ERROR)
})
public interface SearchEvent {

    String SEARCH_STARTED = "search_started";
    String SCRAPER_START = "scraper_start";
    String JOBS_FOUND = "jobs_found";
    String SCRAPER_ERROR = "scraper_error";
    String SCRAPER_COMPLETE = "scraper_complete";
    String USER_MESSAGE = "user_message";
    String SEARCH_COMPLETE = "search_complete";
    String ERROR = "error";

    Set<String> KNOWN_TYPES = Set.of(SEARCH_STARTED, SCRAPER_START, JOBS_FOUND, SCRAPER_ERROR,
            SCRAPER_COMPLETE, USER_MESSAGE, SEARCH_COMPLETE, ERROR);

    @JsonIgnore
    String type();

    /**
     * Terminal events close the stream; exactly one is sent per session.
     */
    @JsonIgnore
    default boolean terminal() {
        return false;
    }
}
