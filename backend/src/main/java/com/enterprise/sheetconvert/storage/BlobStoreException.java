package com.enterprise.sheetconvert.storage;

public class BlobStoreException extends RuntimeException {

    public BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
