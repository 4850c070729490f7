package dev.jobmatcher.stream;

/**
 * A complete frame whose payload could not be decoded.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
