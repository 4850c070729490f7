package dev.jobmatcher.web;

import dev.jobmatcher.document.DocumentTextExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    static final int MAX_UPLOAD_BYTES = 5 * 1024 * 1024;

    private final DocumentTextExtractor textExtractor;

    public record DocumentTextResponse(String filename, String text, int characterCount) {
    }

    @PostMapping(value = "/text", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<DocumentTextResponse> extractText(@RequestPart("file") FilePart file) {
        String contentType = file.headers().getContentType() != null
                ? file.headers().getContentType().toString()
                : null;
        log.info("Extracting text from upload {} ({})", file.filename(), contentType);

        return DataBufferUtils.join(file.content(), MAX_UPLOAD_BYTES)
                .map(buffer -> {
                    try {
                        byte[] bytes = new byte[buffer.readableByteCount()];
                        buffer.read(bytes);
                        return bytes;
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .flatMap(bytes -> textExtractor.extractText(bytes, file.filename(), contentType))
                .map(text -> new DocumentTextResponse(file.filename(), text, text.length()));
    }
}
