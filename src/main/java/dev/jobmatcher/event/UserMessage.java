package dev.jobmatcher.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

@JsonTypeName(SearchEvent.USER_MESSAGE)
public record UserMessage(String title, String message, Severity severity) implements SearchEvent {

    public enum Severity {
        INFO,
        WARNING,
        ERROR;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Severity fromValue(String value) {
            return valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    public static UserMessage warning(String title, String message) {
        return new UserMessage(title, message, Severity.WARNING);
    }

    @Override
    public String type() {
        return USER_MESSAGE;
    }
}
