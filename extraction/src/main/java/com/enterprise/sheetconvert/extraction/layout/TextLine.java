package com.enterprise.sheetconvert.extraction.layout;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tokens sharing a baseline, kept left to right.
 */
final class TextLine {

    private final List<PositionedToken> tokens = new ArrayList<>();
    private float baseline;
    private float height;

    TextLine(PositionedToken first) {
        add(first);
    }

    void add(PositionedToken token) {
        tokens.add(token);
        // running mean keeps slightly jittered baselines together
        baseline = baseline + ((token.y() - baseline) / tokens.size());
        height = Math.max(height, token.height());
    }

    boolean accepts(PositionedToken token, float tolerance) {
        return Math.abs(token.y() - baseline) <= Math.max(tolerance, 0.5f * Math.min(height, token.height()));
    }

    float baseline() {
        return baseline;
    }

    float height() {
        return height;
    }

    float top() {
        return baseline - height;
    }

    /**
     * Merges neighbouring tokens into phrases when the horizontal gap between them is
     * at most {@code gapFactor} times the text height.
     */
    List<PositionedToken> phrases(float gapFactor) {
        List<PositionedToken> sorted = new ArrayList<>(tokens);
        sorted.sort(Comparator.comparingDouble(PositionedToken::x));
        List<PositionedToken> phrases = new ArrayList<>();
        PositionedToken current = null;
        for (PositionedToken token : sorted) {
            if (current == null) {
                current = token;
                continue;
            }
            float gap = token.x() - current.endX();
            if (gap <= gapFactor * Math.max(current.height(), token.height())) {
                current = current.merge(token);
            } else {
                phrases.add(current);
                current = token;
            }
        }
        if (current != null) {
            phrases.add(current);
        }
        return phrases;
    }
}
