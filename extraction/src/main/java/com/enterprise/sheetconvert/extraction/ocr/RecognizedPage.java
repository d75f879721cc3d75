package com.enterprise.sheetconvert.extraction.ocr;

import java.util.List;

/**
 * What a {@link TextRecognizer} saw on one page. Coordinates are fractions of the
 * page size (0..1), origin top-left.
 */
public final class RecognizedPage {

    private final int pageNumber;
    private final List<Table> tables;
    private final List<Word> words;
    private final List<String> warnings;

    public RecognizedPage(int pageNumber, List<Table> tables, List<Word> words, List<String> warnings) {
        this.pageNumber = pageNumber;
        this.tables = List.copyOf(tables);
        this.words = List.copyOf(words);
        this.warnings = List.copyOf(warnings);
    }

    public static RecognizedPage empty(int pageNumber, String warning) {
        return new RecognizedPage(pageNumber, List.of(), List.of(), List.of(warning));
    }

    public int pageNumber() {
        return pageNumber;
    }

    public List<Table> tables() {
        return tables;
    }

    public List<Word> words() {
        return words;
    }

    public List<String> warnings() {
        return warnings;
    }

    public static final class Table {

        private final float top;
        private final List<List<String>> rows;

        public Table(float top, List<List<String>> rows) {
            this.top = top;
            this.rows = rows;
        }

        public float top() {
            return top;
        }

        public List<List<String>> rows() {
            return rows;
        }
    }

    public static final class Word {

        private final float left;
        private final float top;
        private final float width;
        private final float height;
        private final String text;

        public Word(float left, float top, float width, float height, String text) {
            this.left = left;
            this.top = top;
            this.width = width;
            this.height = height;
            this.text = text;
        }

        public float left() {
            return left;
        }

        public float top() {
            return top;
        }

        public float width() {
            return width;
        }

        public float height() {
            return height;
        }

        public String text() {
            return text;
        }
    }
}
