package dev.jobmatcher.document;

import reactor.core.publisher.Mono;

/**
 * Extracts plain text from an uploaded document.
 */
public interface DocumentTextExtractor {

    /**
     * @param content     raw file bytes
     * @param filename    original file name, may be null
     * @param contentType declared media type, may be null
     * @return Mono with the extracted text, or a {@link DocumentExtractionException}
     */
    Mono<String> extractText(byte[] content, String filename, String contentType);
}
