package dev.jobmatcher.exception;

/**
 * Search request rejected before any stream is opened.
 */
public class SearchValidationException extends RuntimeException {

    public SearchValidationException(String message) {
        super(message);
    }
}
