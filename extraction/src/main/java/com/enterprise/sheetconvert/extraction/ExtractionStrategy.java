package com.enterprise.sheetconvert.extraction;

/**
 * Which strategy produced the tables of a successful extraction.
 */
public enum ExtractionStrategy {
    STRUCTURED,
    RECOGNITION
}
