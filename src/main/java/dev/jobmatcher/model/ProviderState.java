package dev.jobmatcher.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProviderState {
    NOT_CONFIGURED,
    PENDING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProviderState fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
