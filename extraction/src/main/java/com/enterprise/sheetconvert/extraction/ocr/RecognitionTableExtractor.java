package com.enterprise.sheetconvert.extraction.ocr;

import com.enterprise.sheetconvert.extraction.ExtractedTable;
import com.enterprise.sheetconvert.extraction.layout.PositionedToken;
import com.enterprise.sheetconvert.extraction.layout.TableLayoutAnalyzer;
import com.enterprise.sheetconvert.extraction.pdf.PageRasterizer;
import com.enterprise.sheetconvert.extraction.pdf.PageRasterizer.RenderedPage;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recognition fallback: renders every page, hands the image to a {@link TextRecognizer}
 * and turns what comes back into tables in page coordinates (points, origin top-left).
 */
public class RecognitionTableExtractor {

    private static final Logger log = LoggerFactory.getLogger(RecognitionTableExtractor.class);

    private final PageRasterizer rasterizer;
    private final TextRecognizer recognizer;
    private final TableLayoutAnalyzer analyzer;

    public RecognitionTableExtractor(PageRasterizer rasterizer, TextRecognizer recognizer, TableLayoutAnalyzer analyzer) {
        this.rasterizer = rasterizer;
        this.recognizer = recognizer;
        this.analyzer = analyzer;
    }

    /**
     * @param warnings receives per-page problems that did not stop extraction
     */
    public List<ExtractedTable> extract(PDDocument document, List<String> warnings) throws IOException {
        List<ExtractedTable> tables = new ArrayList<>();
        for (int pageNumber = 1; pageNumber <= document.getNumberOfPages(); pageNumber++) {
            RenderedPage rendered = rasterizer.render(document, pageNumber);
            RecognizedPage page = recognizer.recognize(pageNumber, rendered.png());
            warnings.addAll(page.warnings());
            tables.addAll(toTables(page, rendered.widthPt(), rendered.heightPt()));
        }
        log.info("Recognition extraction: {} page(s) at {} dpi, {} table(s)",
                document.getNumberOfPages(), rasterizer.dpi(), tables.size());
        return tables;
    }

    List<ExtractedTable> toTables(RecognizedPage page, float widthPt, float heightPt) {
        if (!page.tables().isEmpty()) {
            List<ExtractedTable> tables = new ArrayList<>(page.tables().size());
            for (RecognizedPage.Table table : page.tables()) {
                tables.add(new ExtractedTable(page.pageNumber(), table.top() * heightPt, table.rows()));
            }
            return tables;
        }
        if (page.words().isEmpty()) {
            return Collections.emptyList();
        }
        List<PositionedToken> tokens = new ArrayList<>(page.words().size());
        for (RecognizedPage.Word word : page.words()) {
            float x = word.left() * widthPt;
            float endX = (word.left() + word.width()) * widthPt;
            float height = word.height() * heightPt;
            float baseline = (word.top() * heightPt) + height;
            tokens.add(new PositionedToken(x, endX, baseline, height, word.text()));
        }
        log.debug("Page {}: no recognised table, analysing {} word boxes", page.pageNumber(), tokens.size());
        return analyzer.analyze(page.pageNumber(), tokens, Collections.emptyList());
    }
}
