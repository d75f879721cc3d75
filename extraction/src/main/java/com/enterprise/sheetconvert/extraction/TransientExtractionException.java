package com.enterprise.sheetconvert.extraction;

/**
 * Raised when extraction failed for a reason that may go away on a later attempt:
 * recognition service throttling, timeouts, server-side errors or running out of
 * memory while rendering a page.
 */
public class TransientExtractionException extends RuntimeException {

    public TransientExtractionException(String message) {
        super(message);
    }

    public TransientExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
