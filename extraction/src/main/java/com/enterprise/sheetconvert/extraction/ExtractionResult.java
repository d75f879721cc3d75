package com.enterprise.sheetconvert.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tables found in a document, in document order, plus the strategy that found them.
 */
public final class ExtractionResult {

    private final List<ExtractedTable> tables;
    private final List<String> warnings;
    private final ExtractionStrategy strategy;

    public ExtractionResult(List<ExtractedTable> tables, List<String> warnings, ExtractionStrategy strategy) {
        List<ExtractedTable> ordered = new ArrayList<>(tables);
        ordered.sort(ExtractedTable.DOCUMENT_ORDER);
        this.tables = Collections.unmodifiableList(ordered);
        this.warnings = List.copyOf(warnings);
        this.strategy = strategy;
    }

    public List<ExtractedTable> tables() {
        return tables;
    }

    public List<String> warnings() {
        return warnings;
    }

    public ExtractionStrategy strategy() {
        return strategy;
    }
}
