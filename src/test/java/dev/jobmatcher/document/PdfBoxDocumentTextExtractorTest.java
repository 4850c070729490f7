package dev.jobmatcher.document;

import dev.jobmatcher.document.DocumentExtractionException.Reason;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PdfBoxDocumentTextExtractorTest {

    private PdfBoxDocumentTextExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new PdfBoxDocumentTextExtractor(Duration.ofSeconds(10));
    }

    private static byte[] pdfWithText(String line) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(72, 700);
                content.showText(line);
                content.endText();
            }
            document.save(out);
            return out.toByteArray();
        }
    }

    private static byte[] emptyPdf() throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.addPage(new PDPage());
            document.save(out);
            return out.toByteArray();
        }
    }

    private static void assertReason(Throwable error, Reason reason) {
        assertThat(error).isInstanceOf(DocumentExtractionException.class);
        assertThat(((DocumentExtractionException) error).getReason()).isEqualTo(reason);
    }

    @Test
    @DisplayName("Should extract text from a PDF")
    void shouldExtractPdfText() throws IOException {
        byte[] pdf = pdfWithText("Senior Java Developer with Spring Boot experience");

        StepVerifier.create(extractor.extractText(pdf, "resume.pdf", "application/pdf"))
                .assertNext(text -> assertThat(text).isEqualTo("Senior Java Developer with Spring Boot experience"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should detect a PDF by its header when the name and type are missing")
    void shouldDetectPdfByMagicBytes() throws IOException {
        assertThat(PdfBoxDocumentTextExtractor.isPdf(pdfWithText("Hello PDF world"), null, null)).isTrue();
        assertThat(PdfBoxDocumentTextExtractor.isPdf("plain".getBytes(StandardCharsets.UTF_8), "cv.txt", "text/plain"))
                .isFalse();
    }

    @Test
    @DisplayName("Should reject a PDF without text")
    void shouldRejectImageOnlyPdf() throws IOException {
        StepVerifier.create(extractor.extractText(emptyPdf(), "scan.pdf", "application/pdf"))
                .expectErrorSatisfies(error -> assertReason(error, Reason.NO_EXTRACTABLE_TEXT))
                .verify();
    }

    @Test
    @DisplayName("Should report a corrupted PDF")
    void shouldReportCorruptedPdf() {
        byte[] broken = "%PDF-1.7 this is not really a pdf".getBytes(StandardCharsets.US_ASCII);

        StepVerifier.create(extractor.extractText(broken, "broken.pdf", "application/pdf"))
                .expectErrorSatisfies(error -> assertReason(error, Reason.CORRUPTED))
                .verify();
    }

    @Test
    @DisplayName("Should pass plain text through")
    void shouldPassPlainTextThrough() {
        byte[] text = "  Product Manager, 8 years in SaaS  ".getBytes(StandardCharsets.UTF_8);

        StepVerifier.create(extractor.extractText(text, "resume.txt", null))
                .expectNext("Product Manager, 8 years in SaaS")
                .verifyComplete();
    }

    @Test
    @DisplayName("Should reject unsupported and empty uploads")
    void shouldRejectUnsupportedAndEmpty() {
        byte[] docx = {0x50, 0x4B, 0x03, 0x04};

        StepVerifier.create(extractor.extractText(docx, "resume.docx",
                        "application/vnd.openxmlformats-officedocument.wordprocessingml.document"))
                .expectErrorSatisfies(error -> assertReason(error, Reason.UNSUPPORTED_FORMAT))
                .verify();
        StepVerifier.create(extractor.extractText(new byte[0], "resume.pdf", "application/pdf"))
                .expectErrorSatisfies(error -> assertReason(error, Reason.NO_EXTRACTABLE_TEXT))
                .verify();
    }
}
