package dev.jobmatcher.stream;

public class FrameEncodingException extends RuntimeException {

    public FrameEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
