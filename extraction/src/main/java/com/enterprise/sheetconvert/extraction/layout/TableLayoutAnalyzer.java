package com.enterprise.sheetconvert.extraction.layout;

import com.enterprise.sheetconvert.extraction.ExtractedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Finds tabular regions in positioned text on a single page.
 *
 * Lines holding at least two separated phrases are grouped into blocks; each block
 * is split into columns using vertical rulings when the page draws them, otherwise
 * using the horizontal projection of the phrases. Shared by the structured strategy
 * (glyph positions from the PDF) and the recognition fallback (word boxes).
 */
public class TableLayoutAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TableLayoutAnalyzer.class);

    public static final float DEFAULT_PHRASE_GAP_FACTOR = 0.8f;
    public static final float DEFAULT_BLOCK_GAP_FACTOR = 2.0f;

    private static final float BASELINE_TOLERANCE = 2f;
    private static final float RULING_MERGE_DISTANCE = 2f;
    private static final float PROJECTION_TOLERANCE = 1f;
    private static final int MIN_ROWS = 2;
    private static final int MIN_COLUMNS = 2;

    private final float phraseGapFactor;
    private final float blockGapFactor;

    public TableLayoutAnalyzer() {
        this(DEFAULT_PHRASE_GAP_FACTOR, DEFAULT_BLOCK_GAP_FACTOR);
    }

    public TableLayoutAnalyzer(float phraseGapFactor, float blockGapFactor) {
        this.phraseGapFactor = phraseGapFactor;
        this.blockGapFactor = blockGapFactor;
    }

    public List<ExtractedTable> analyze(int pageNumber, List<PositionedToken> tokens, List<Ruling> rulings) {
        if (tokens.isEmpty()) {
            return Collections.emptyList();
        }
        List<TextLine> lines = groupLines(tokens);
        List<ExtractedTable> tables = new ArrayList<>();
        for (List<List<PositionedToken>> block : findBlocks(lines)) {
            ExtractedTable table = toTable(pageNumber, block, rulings);
            if (table != null) {
                tables.add(table);
            }
        }
        log.debug("Page {}: {} lines, {} rulings, {} table(s)", pageNumber, lines.size(), rulings.size(), tables.size());
        return tables;
    }

    // ─── Lines ─────────────────────────────────────────────────────────────
    private List<TextLine> groupLines(List<PositionedToken> tokens) {
        List<PositionedToken> sorted = new ArrayList<>(tokens);
        sorted.sort(Comparator.comparingDouble(PositionedToken::y).thenComparingDouble(PositionedToken::x));
        List<TextLine> lines = new ArrayList<>();
        TextLine current = null;
        for (PositionedToken token : sorted) {
            if (token.text().isBlank()) {
                continue;
            }
            if (current != null && current.accepts(token, BASELINE_TOLERANCE)) {
                current.add(token);
            } else {
                current = new TextLine(token);
                lines.add(current);
            }
        }
        return lines;
    }

    // ─── Blocks ────────────────────────────────────────────────────────────
    private List<List<List<PositionedToken>>> findBlocks(List<TextLine> lines) {
        List<List<List<PositionedToken>>> blocks = new ArrayList<>();
        List<List<PositionedToken>> block = new ArrayList<>();
        TextLine previous = null;
        for (TextLine line : lines) {
            List<PositionedToken> phrases = line.phrases(phraseGapFactor);
            boolean tabular = phrases.size() >= MIN_COLUMNS;
            boolean adjacent = previous != null
                    && (line.top() - previous.baseline()) <= blockGapFactor * Math.max(line.height(), previous.height());
            if (!tabular || !adjacent) {
                closeBlock(blocks, block);
                block = new ArrayList<>();
            }
            if (tabular) {
                block.add(phrases);
                previous = line;
            } else {
                previous = null;
            }
        }
        closeBlock(blocks, block);
        return blocks;
    }

    private static void closeBlock(List<List<List<PositionedToken>>> blocks, List<List<PositionedToken>> block) {
        if (block.size() >= MIN_ROWS) {
            blocks.add(block);
        }
    }

    // ─── Columns ───────────────────────────────────────────────────────────
    private ExtractedTable toTable(int pageNumber, List<List<PositionedToken>> block, List<Ruling> rulings) {
        float top = Float.MAX_VALUE;
        float bottom = -Float.MAX_VALUE;
        for (List<PositionedToken> row : block) {
            for (PositionedToken phrase : row) {
                top = Math.min(top, phrase.top());
                bottom = Math.max(bottom, phrase.y());
            }
        }

        List<float[]> columns = columnsFromRulings(rulings, top, bottom);
        if (columns.size() < MIN_COLUMNS) {
            columns = columnsFromProjection(block);
        }

        List<List<String>> grid = new ArrayList<>(block.size());
        boolean[] used = new boolean[columns.size()];
        for (List<PositionedToken> row : block) {
            String[] cells = new String[columns.size()];
            for (PositionedToken phrase : row) {
                int column = columnFor(columns, phrase.center());
                cells[column] = cells[column] == null ? phrase.text() : cells[column] + " " + phrase.text();
                used[column] = true;
            }
            List<String> values = new ArrayList<>(columns.size());
            for (String cell : cells) {
                values.add(cell);
            }
            grid.add(values);
        }

        int kept = 0;
        for (boolean u : used) {
            if (u) {
                kept++;
            }
        }
        if (kept < MIN_COLUMNS) {
            return null;
        }

        List<List<String>> rows = new ArrayList<>(grid.size());
        for (List<String> values : grid) {
            List<String> row = new ArrayList<>(kept);
            for (int c = 0; c < values.size(); c++) {
                if (used[c]) {
                    row.add(values.get(c));
                }
            }
            rows.add(row);
        }
        return new ExtractedTable(pageNumber, top, rows);
    }

    /**
     * Columns bounded by vertical rulings that cover at least half of the block height.
     * The areas left of the first and right of the last ruling are columns too; they
     * are dropped later if nothing lands in them.
     */
    private List<float[]> columnsFromRulings(List<Ruling> rulings, float top, float bottom) {
        float minOverlap = (bottom - top) / 2f;
        List<Float> xs = new ArrayList<>();
        for (Ruling ruling : rulings) {
            if (ruling.isVertical() && ruling.verticalOverlap(top, bottom) >= minOverlap) {
                xs.add(ruling.x());
            }
        }
        Collections.sort(xs);
        List<Float> distinct = new ArrayList<>();
        for (Float x : xs) {
            if (distinct.isEmpty() || x - distinct.get(distinct.size() - 1) > RULING_MERGE_DISTANCE) {
                distinct.add(x);
            }
        }
        if (distinct.size() < 2) {
            return Collections.emptyList();
        }
        List<float[]> columns = new ArrayList<>();
        columns.add(new float[] { -Float.MAX_VALUE, distinct.get(0) });
        for (int i = 1; i < distinct.size(); i++) {
            columns.add(new float[] { distinct.get(i - 1), distinct.get(i) });
        }
        columns.add(new float[] { distinct.get(distinct.size() - 1), Float.MAX_VALUE });
        return columns;
    }

    private static List<float[]> columnsFromProjection(List<List<PositionedToken>> block) {
        List<float[]> extents = new ArrayList<>();
        for (List<PositionedToken> row : block) {
            for (PositionedToken phrase : row) {
                extents.add(new float[] { phrase.x(), phrase.endX() });
            }
        }
        extents.sort(Comparator.comparingDouble(e -> e[0]));
        List<float[]> merged = new ArrayList<>();
        for (float[] extent : extents) {
            float[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && extent[0] <= last[1] + PROJECTION_TOLERANCE) {
                last[1] = Math.max(last[1], extent[1]);
            } else {
                merged.add(new float[] { extent[0], extent[1] });
            }
        }
        return merged;
    }

    private static int columnFor(List<float[]> columns, float center) {
        int nearest = 0;
        float best = Float.MAX_VALUE;
        for (int i = 0; i < columns.size(); i++) {
            float[] column = columns.get(i);
            if (center >= column[0] && center <= column[1]) {
                return i;
            }
            float distance = Math.min(Math.abs(center - column[0]), Math.abs(center - column[1]));
            if (distance < best) {
                best = distance;
                nearest = i;
            }
        }
        return nearest;
    }
}
