package dev.jobmatcher.web;

import dev.jobmatcher.document.DocumentExtractionException;
import dev.jobmatcher.exception.NoProvidersConfiguredException;
import dev.jobmatcher.exception.SearchValidationException;
import dev.jobmatcher.profile.ProfileExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps failures that happen before a response body is written to
 * {@code {error, message}} JSON.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SearchValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(SearchValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(NoProvidersConfiguredException.class)
    public ResponseEntity<Map<String, String>> handleNoProviders(NoProvidersConfiguredException ex) {
        log.warn("Search rejected: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "NO_PROVIDERS", ex.getMessage());
    }

    @ExceptionHandler(ProfileExtractionException.class)
    public ResponseEntity<Map<String, String>> handleProfile(ProfileExtractionException ex) {
        HttpStatus status;
        switch (ex.getReason()) {
            case TOO_SHORT:
                status = HttpStatus.BAD_REQUEST;
                break;
            case RATE_LIMITED:
                status = HttpStatus.TOO_MANY_REQUESTS;
                break;
            case SERVICE_UNAVAILABLE:
            default:
                status = HttpStatus.SERVICE_UNAVAILABLE;
        }
        return error(status, ex.getReason().name(), ex.getMessage());
    }

    @ExceptionHandler(DocumentExtractionException.class)
    public ResponseEntity<Map<String, String>> handleDocument(DocumentExtractionException ex) {
        HttpStatus status;
        switch (ex.getReason()) {
            case UNSUPPORTED_FORMAT:
                status = HttpStatus.UNSUPPORTED_MEDIA_TYPE;
                break;
            case TIMEOUT:
                status = HttpStatus.GATEWAY_TIMEOUT;
                break;
            case NO_EXTRACTABLE_TEXT:
            case CORRUPTED:
            default:
                status = HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return error(status, ex.getReason().name(), ex.getMessage());
    }

    @ExceptionHandler(DataBufferLimitException.class)
    public ResponseEntity<Map<String, String>> handleTooLarge(DataBufferLimitException ex) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE",
                "File exceeds the " + DocumentController.MAX_UPLOAD_BYTES / (1024 * 1024) + "MB upload limit");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", code, "message", message));
    }
}
