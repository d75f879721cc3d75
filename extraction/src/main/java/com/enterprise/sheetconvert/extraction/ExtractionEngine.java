package com.enterprise.sheetconvert.extraction;

import com.enterprise.sheetconvert.extraction.ocr.RecognitionTableExtractor;
import com.enterprise.sheetconvert.extraction.pdf.StructuredTableExtractor;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns PDF bytes into tables.
 *
 * Structured extraction runs first. When it finds nothing, or the tables it finds are
 * mostly empty cells (aggregate fill ratio below the configured minimum), the pages
 * are rendered and sent through optical recognition. Recognised tables win; low
 * confidence structured tables are kept only when recognition finds nothing.
 *
 * Document problems come back as a failed {@link ExtractionOutcome}. This class does
 * not throw for bad input.
 */
public class ExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

    public static final double DEFAULT_MIN_FILL_RATIO = 0.30d;

    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);
    // PDF readers tolerate junk before the header within the first kilobyte
    private static final int HEADER_SEARCH_LIMIT = 1024;

    private final StructuredTableExtractor structuredExtractor;
    private final RecognitionTableExtractor recognitionExtractor;
    private final double minFillRatio;

    /**
     * @param recognitionExtractor {@code null} disables the recognition fallback
     */
    public ExtractionEngine(StructuredTableExtractor structuredExtractor,
            RecognitionTableExtractor recognitionExtractor, double minFillRatio) {
        this.structuredExtractor = structuredExtractor;
        this.recognitionExtractor = recognitionExtractor;
        this.minFillRatio = minFillRatio;
    }

    public ExtractionOutcome extract(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            return ExtractionOutcome.failure(FailureKind.UNPARSABLE_DOCUMENT, "The document is empty.");
        }
        if (!hasPdfHeader(pdfBytes)) {
            return ExtractionOutcome.failure(FailureKind.UNPARSABLE_DOCUMENT, "The file is not a PDF document.");
        }

        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            if (document.getNumberOfPages() == 0) {
                return ExtractionOutcome.failure(FailureKind.UNPARSABLE_DOCUMENT, "The document has no pages.");
            }
            return extract(document);
        } catch (InvalidPasswordException e) {
            log.info("Rejecting password-protected document: {}", e.getMessage());
            return ExtractionOutcome.failure(FailureKind.UNPARSABLE_DOCUMENT, "The document is password protected.");
        } catch (TransientExtractionException e) {
            log.warn("Transient extraction failure: {}", e.getMessage());
            return ExtractionOutcome.failure(FailureKind.TRANSIENT, e.getMessage());
        } catch (IOException e) {
            log.info("Document could not be parsed: {}", e.getMessage());
            return ExtractionOutcome.failure(FailureKind.UNPARSABLE_DOCUMENT,
                    "The document could not be read: " + e.getMessage());
        } catch (RuntimeException e) {
            // PDFBox surfaces some malformed structures as unchecked exceptions
            log.warn("Unexpected error reading document", e);
            return ExtractionOutcome.failure(FailureKind.UNPARSABLE_DOCUMENT,
                    "The document could not be read: " + e.getClass().getSimpleName());
        }
    }

    private ExtractionOutcome extract(PDDocument document) throws IOException {
        List<String> warnings = new ArrayList<>();
        List<ExtractedTable> structured = structuredExtractor.extract(document);
        double fillRatio = aggregateFillRatio(structured);

        if (!structured.isEmpty() && fillRatio >= minFillRatio) {
            log.info("Using {} structured table(s), fill ratio {}", structured.size(), format(fillRatio));
            return ExtractionOutcome.success(new ExtractionResult(structured, warnings, ExtractionStrategy.STRUCTURED));
        }
        log.info("Structured extraction insufficient ({} table(s), fill ratio {}), falling back to recognition",
                structured.size(), format(fillRatio));

        List<ExtractedTable> recognized = new ArrayList<>();
        if (recognitionExtractor == null) {
            log.warn("Recognition fallback is disabled");
            warnings.add("Optical recognition is disabled; scanned pages were not analysed.");
        } else {
            recognized = recognitionExtractor.extract(document, warnings);
        }

        if (!recognized.isEmpty()) {
            return ExtractionOutcome.success(new ExtractionResult(recognized, warnings, ExtractionStrategy.RECOGNITION));
        }
        if (!structured.isEmpty()) {
            warnings.add(String.format("Detected tables are sparse (%.0f%% of cells filled); check the output.",
                    fillRatio * 100));
            return ExtractionOutcome.success(new ExtractionResult(structured, warnings, ExtractionStrategy.STRUCTURED));
        }
        return ExtractionOutcome.failure(FailureKind.NO_TABLES_FOUND, "No tables were found in the document.");
    }

    static double aggregateFillRatio(List<ExtractedTable> tables) {
        long filled = 0;
        long total = 0;
        for (ExtractedTable table : tables) {
            filled += table.filledCells();
            total += table.totalCells();
        }
        return total == 0 ? 0d : (double) filled / total;
    }

    private static boolean hasPdfHeader(byte[] bytes) {
        int limit = Math.min(bytes.length, HEADER_SEARCH_LIMIT) - PDF_MAGIC.length;
        for (int i = 0; i <= limit; i++) {
            boolean match = true;
            for (int j = 0; j < PDF_MAGIC.length; j++) {
                if (bytes[i + j] != PDF_MAGIC[j]) {
                    match = false;
                    break;
                }
            }
            if (match) {
                return true;
            }
        }
        return false;
    }

    private static String format(double ratio) {
        return String.format("%.2f", ratio);
    }
}
