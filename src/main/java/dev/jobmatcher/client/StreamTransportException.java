package dev.jobmatcher.client;

/**
 * The search stream broke off before its terminal event.
 */
public class StreamTransportException extends RuntimeException {

    public StreamTransportException(String message) {
        super(message);
    }

    public StreamTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
