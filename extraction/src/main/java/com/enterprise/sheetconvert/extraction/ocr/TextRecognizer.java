package com.enterprise.sheetconvert.extraction.ocr;

/**
 * Optical recognition of a single rendered page.
 *
 * Implementations throw {@link com.enterprise.sheetconvert.extraction.TransientExtractionException}
 * for failures worth retrying and report anything else about the page as a warning
 * on the returned {@link RecognizedPage}.
 */
public interface TextRecognizer {

    RecognizedPage recognize(int pageNumber, byte[] png);
}
