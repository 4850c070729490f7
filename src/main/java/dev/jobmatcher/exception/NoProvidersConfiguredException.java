package dev.jobmatcher.exception;

/**
 * No provider has credentials configured, so a search cannot start.
 */
public class NoProvidersConfiguredException extends RuntimeException {

    public NoProvidersConfiguredException(String message) {
        super(message);
    }
}
