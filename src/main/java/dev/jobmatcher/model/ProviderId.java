package dev.jobmatcher.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * External job listing providers. Serialized by display name.
 */
public enum ProviderId {

    THEIRSTACK("Theirstack"),
    ADZUNA("Adzuna"),
    THE_MUSE("TheMuse"),
    REED("Reed"),
    JSEARCH("JSearch-RapidAPI"),
    RAPIDAPI_JOBS("RapidAPI-Jobs");

    private final String displayName;

    ProviderId(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static ProviderId fromDisplayName(String value) {
        return Arrays.stream(values())
                .filter(id -> id.displayName.equalsIgnoreCase(value) || id.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + value));
    }

    @Override
    public String toString() {
        return displayName;
    }
}
