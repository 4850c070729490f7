package dev.jobmatcher.document;

import lombok.Getter;

@Getter
public class DocumentExtractionException extends RuntimeException {

    public enum Reason {
        UNSUPPORTED_FORMAT,
        NO_EXTRACTABLE_TEXT,
        CORRUPTED,
        TIMEOUT
    }

    private final Reason reason;

    public DocumentExtractionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DocumentExtractionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
