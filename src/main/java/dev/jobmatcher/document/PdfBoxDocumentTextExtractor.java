package dev.jobmatcher.document;

import dev.jobmatcher.document.DocumentExtractionException.Reason;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * PDF extraction via PDFBox, plain text passed through.
 */
@Slf4j
@Service
public class PdfBoxDocumentTextExtractor implements DocumentTextExtractor {

    private static final int MIN_TEXT_LENGTH = 10;
    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final Duration timeout;

    public PdfBoxDocumentTextExtractor(@Value("${documents.extraction-timeout:20s}") Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public Mono<String> extractText(byte[] content, String filename, String contentType) {
        if (content == null || content.length == 0) {
            return Mono.error(new DocumentExtractionException(Reason.NO_EXTRACTABLE_TEXT, "Uploaded file is empty"));
        }

        if (isPdf(content, filename, contentType)) {
            return Mono.fromCallable(() -> extractPdf(content, filename))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> new DocumentExtractionException(Reason.TIMEOUT,
                            "Text extraction took longer than " + timeout.toSeconds() + "s", e));
        }
        if (isPlainText(filename, contentType)) {
            return Mono.fromCallable(() -> requireText(new String(content, StandardCharsets.UTF_8), filename));
        }
        return Mono.error(new DocumentExtractionException(Reason.UNSUPPORTED_FORMAT,
                "Unsupported file type: " + (contentType != null ? contentType : filename)
                        + ". Please upload a PDF or plain text file."));
    }

    private String extractPdf(byte[] content, String filename) {
        try (PDDocument document = Loader.loadPDF(content)) {
            String text = new PDFTextStripper().getText(document);
            log.info("Extracted {} characters from {} ({} pages)", text.length(), filename, document.getNumberOfPages());
            return requireText(text, filename);
        } catch (IOException e) {
            throw new DocumentExtractionException(Reason.CORRUPTED,
                    "The PDF could not be read. It may be corrupted or password protected.", e);
        }
    }

    private String requireText(String text, String filename) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.length() < MIN_TEXT_LENGTH) {
            log.warn("No usable text in {}", filename);
            throw new DocumentExtractionException(Reason.NO_EXTRACTABLE_TEXT,
                    "No text could be extracted. Scanned documents need to be converted to text first.");
        }
        return trimmed;
    }

    static boolean isPdf(byte[] content, String filename, String contentType) {
        if (content.length >= PDF_MAGIC.length) {
            boolean magic = true;
            for (int i = 0; i < PDF_MAGIC.length; i++) {
                if (content[i] != PDF_MAGIC[i]) {
                    magic = false;
                    break;
                }
            }
            if (magic) {
                return true;
            }
        }
        return (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("pdf"))
                || (filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".pdf"));
    }

    private static boolean isPlainText(String filename, String contentType) {
        return (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("text/plain"))
                || (filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".txt"));
    }
}
