package com.enterprise.sheetconvert.controller.error;

import lombok.Value;

import java.time.Instant;

@Value
public class ErrorResponse {
    Instant timestamp;
    int status;
    String error;
    String message;
    String path;

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path);
    }
}
