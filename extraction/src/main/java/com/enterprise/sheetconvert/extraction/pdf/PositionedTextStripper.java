package com.enterprise.sheetconvert.extraction.pdf;

import com.enterprise.sheetconvert.extraction.layout.PositionedToken;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects word-level tokens with their positions instead of plain text.
 * Glyph runs are split on blank glyphs and on horizontal jumps wider than half
 * the glyph height, so words placed by absolute positioning stay apart.
 */
class PositionedTextStripper extends PDFTextStripper {

    private static final float SPLIT_GAP_FACTOR = 0.5f;

    private final List<PositionedToken> tokens = new ArrayList<>();

    PositionedTextStripper() {
        setSortByPosition(true);
    }

    /**
     * @param pageNumber 1-based
     */
    List<PositionedToken> tokens(PDDocument document, int pageNumber) throws IOException {
        tokens.clear();
        setStartPage(pageNumber);
        setEndPage(pageNumber);
        getText(document);
        return new ArrayList<>(tokens);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        List<TextPosition> word = new ArrayList<>();
        TextPosition previous = null;
        for (TextPosition position : textPositions) {
            String unicode = position.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                flush(word);
                previous = null;
                continue;
            }
            if (previous != null) {
                float gap = position.getXDirAdj() - (previous.getXDirAdj() + previous.getWidthDirAdj());
                if (gap > SPLIT_GAP_FACTOR * height(previous)) {
                    flush(word);
                }
            }
            word.add(position);
            previous = position;
        }
        flush(word);
        super.writeString(text, textPositions);
    }

    private void flush(List<TextPosition> word) {
        if (word.isEmpty()) {
            return;
        }
        StringBuilder text = new StringBuilder();
        float x = Float.MAX_VALUE;
        float endX = -Float.MAX_VALUE;
        float baseline = -Float.MAX_VALUE;
        float height = 0f;
        for (TextPosition position : word) {
            text.append(position.getUnicode());
            x = Math.min(x, position.getXDirAdj());
            endX = Math.max(endX, position.getXDirAdj() + Math.max(position.getWidthDirAdj(), 0.5f));
            baseline = Math.max(baseline, position.getYDirAdj());
            height = Math.max(height, height(position));
        }
        tokens.add(new PositionedToken(x, endX, baseline, height, text.toString()));
        word.clear();
    }

    private static float height(TextPosition position) {
        return Math.max(position.getHeightDir(), 1f);
    }
}
