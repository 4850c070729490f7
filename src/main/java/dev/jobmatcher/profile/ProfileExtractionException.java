package dev.jobmatcher.profile;

import lombok.Getter;

@Getter
public class ProfileExtractionException extends RuntimeException {

    public enum Reason {
        TOO_SHORT,
        SERVICE_UNAVAILABLE,
        RATE_LIMITED
    }

    private final Reason reason;

    public ProfileExtractionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ProfileExtractionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
