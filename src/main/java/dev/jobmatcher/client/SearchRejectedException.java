package dev.jobmatcher.client;

import lombok.Getter;

/**
 * The server refused to open a search stream (validation or configuration error).
 */
@Getter
public class SearchRejectedException extends RuntimeException {

    private final int status;
    private final String body;

    public SearchRejectedException(int status, String body) {
        super("Search rejected with HTTP " + status + ": " + body);
        this.status = status;
        this.body = body;
    }
}
