package com.enterprise.sheetconvert.model;

import org.springframework.http.HttpStatus;

/**
 * Every failure the conversion pipeline can report, with the HTTP status it maps to
 * and the category shown to users. {@link #code()} is the stable identifier stored on
 * failed jobs and returned in error responses.
 */
public enum ErrorKind {

    INVALID_REQUEST("InvalidRequest", HttpStatus.BAD_REQUEST, Category.REQUEST),
    UNSUPPORTED_TYPE("UnsupportedType", HttpStatus.UNPROCESSABLE_ENTITY, Category.DOCUMENT),
    FORBIDDEN("Forbidden", HttpStatus.FORBIDDEN, Category.REQUEST),
    NOT_FOUND("NotFound", HttpStatus.NOT_FOUND, Category.REQUEST),
    UNAUTHENTICATED("Unauthenticated", HttpStatus.UNAUTHORIZED, Category.REQUEST),
    INVALID_STATE("InvalidState", HttpStatus.CONFLICT, Category.REQUEST),
    NOT_READY("NotReady", HttpStatus.CONFLICT, Category.REQUEST),
    QUOTA_EXCEEDED("QuotaExceeded", HttpStatus.TOO_MANY_REQUESTS, Category.QUOTA),
    NO_TABLES_FOUND("NoTablesFound", HttpStatus.UNPROCESSABLE_ENTITY, Category.DOCUMENT),
    UNPARSABLE_DOCUMENT("UnparsableDocument", HttpStatus.UNPROCESSABLE_ENTITY, Category.DOCUMENT),
    FILE_TOO_LARGE("FileTooLarge", HttpStatus.PAYLOAD_TOO_LARGE, Category.DOCUMENT),
    SOURCE_MISSING("SourceMissing", HttpStatus.CONFLICT, Category.SYSTEM),
    TRANSIENT("Transient", HttpStatus.SERVICE_UNAVAILABLE, Category.SYSTEM),
    RETRIES_EXHAUSTED("RetriesExhausted", HttpStatus.SERVICE_UNAVAILABLE, Category.SYSTEM);

    /**
     * How a failure is explained to the user.
     */
    public enum Category {
        /** This document isn't convertible. */
        DOCUMENT,
        /** Try again later. */
        SYSTEM,
        /** Bad request, wrong owner or wrong state. */
        REQUEST,
        /** Upgrade or wait for the allotment to reset. */
        QUOTA
    }

    private final String code;
    private final HttpStatus httpStatus;
    private final Category category;

    ErrorKind(String code, HttpStatus httpStatus, Category category) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.category = category;
    }

    public String code() {
        return code;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }

    public Category category() {
        return category;
    }

    public static ErrorKind fromCode(String code) {
        for (ErrorKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown error kind: " + code);
    }
}
