package com.enterprise.sheetconvert.exception;

/**
 * The job or quota store could not be read or written.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
