package dev.jobmatcher.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SeniorityLevel {
    ENTRY,
    MID,
    SENIOR,
    LEAD,
    EXECUTIVE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse; unknown or blank values fall back to {@link #MID}.
     */
    @JsonCreator
    public static SeniorityLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MID;
        }
        for (SeniorityLevel level : values()) {
            if (level.name().equalsIgnoreCase(value.trim())) {
                return level;
            }
        }
        return MID;
    }
}
