package dev.jobmatcher.event;

import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Terminal failure after the stream opened.
 */
@JsonTypeName(SearchEvent.ERROR)
public record SearchError(String message, String code) implements SearchEvent {

    public static final String CODE_SEARCH_ERROR = "SEARCH_ERROR";
    public static final String CODE_SERIALIZATION = "SERIALIZATION_ERROR";

    @Override
    public String type() {
        return ERROR;
    }

    @Override
    public boolean terminal() {
        return true;
    }
}
