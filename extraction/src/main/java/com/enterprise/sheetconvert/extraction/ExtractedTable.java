package com.enterprise.sheetconvert.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * One table detected in a document: a rectangular grid of cell texts plus the
 * position it was found at. Rows are padded so every row has the same width.
 */
public final class ExtractedTable {

    /** Page order first, then top-to-bottom within a page. */
    public static final Comparator<ExtractedTable> DOCUMENT_ORDER =
            Comparator.comparingInt(ExtractedTable::pageNumber).thenComparingDouble(ExtractedTable::top);

    private final int pageNumber;
    private final float top;
    private final List<List<String>> rows;
    private final int columnCount;

    public ExtractedTable(int pageNumber, float top, List<List<String>> rows) {
        this.pageNumber = pageNumber;
        this.top = top;
        int width = 0;
        for (List<String> row : rows) {
            width = Math.max(width, row.size());
        }
        List<List<String>> padded = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> copy = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                String value = c < row.size() ? row.get(c) : null;
                copy.add(value == null ? "" : value.strip());
            }
            padded.add(Collections.unmodifiableList(copy));
        }
        this.rows = Collections.unmodifiableList(padded);
        this.columnCount = width;
    }

    /** 1-based page number. */
    public int pageNumber() {
        return pageNumber;
    }

    public float top() {
        return top;
    }

    public List<List<String>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columnCount;
    }

    public int totalCells() {
        return rowCount() * columnCount;
    }

    public int filledCells() {
        int filled = 0;
        for (List<String> row : rows) {
            for (String cell : row) {
                if (!cell.isEmpty()) {
                    filled++;
                }
            }
        }
        return filled;
    }

    public double fillRatio() {
        int total = totalCells();
        return total == 0 ? 0d : (double) filledCells() / total;
    }

    @Override
    public String toString() {
        return "ExtractedTable[page=" + pageNumber + ", rows=" + rowCount() + ", columns=" + columnCount + "]";
    }
}
