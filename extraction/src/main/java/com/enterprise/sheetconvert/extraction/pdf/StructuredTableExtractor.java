package com.enterprise.sheetconvert.extraction.pdf;

import com.enterprise.sheetconvert.extraction.ExtractedTable;
import com.enterprise.sheetconvert.extraction.layout.PositionedToken;
import com.enterprise.sheetconvert.extraction.layout.Ruling;
import com.enterprise.sheetconvert.extraction.layout.TableLayoutAnalyzer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Detects tables from the text layer and vector graphics of a PDF, page by page.
 * Pages without a text layer (scans) simply contribute nothing.
 */
public class StructuredTableExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructuredTableExtractor.class);

    private final TableLayoutAnalyzer analyzer;

    public StructuredTableExtractor(TableLayoutAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public List<ExtractedTable> extract(PDDocument document) throws IOException {
        PositionedTextStripper stripper = new PositionedTextStripper();
        List<ExtractedTable> tables = new ArrayList<>();
        int pageNumber = 0;
        for (PDPage page : document.getPages()) {
            pageNumber++;
            List<PositionedToken> tokens = stripper.tokens(document, pageNumber);
            if (tokens.isEmpty()) {
                log.debug("Page {} has no text layer", pageNumber);
                continue;
            }
            List<Ruling> rulings = new RulingCollector(page).collect();
            tables.addAll(analyzer.analyze(pageNumber, tokens, rulings));
        }
        log.info("Structured extraction: {} page(s), {} table(s)", pageNumber, tables.size());
        return tables;
    }
}
