package com.enterprise.sheetconvert.exception;

import com.enterprise.sheetconvert.model.ErrorKind;

/**
 * A request-path failure with a known {@link ErrorKind}; the exception handler turns it
 * into the matching HTTP status.
 */
public class ConversionException extends RuntimeException {

    private final ErrorKind kind;

    public ConversionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
