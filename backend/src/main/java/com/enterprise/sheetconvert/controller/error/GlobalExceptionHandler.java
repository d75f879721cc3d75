package com.enterprise.sheetconvert.controller.error;

import com.enterprise.sheetconvert.exception.ConversionException;
import com.enterprise.sheetconvert.exception.StoreException;
import com.enterprise.sheetconvert.storage.BlobStoreException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ConversionException.class)
    public ResponseEntity<ErrorResponse> handleConversion(ConversionException e, HttpServletRequest request) {
        HttpStatus status = e.getKind().httpStatus();
        if (status.is5xxServerError()) {
            log.warn("{} {} failed: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        } else {
            log.debug("{} {} rejected: {} {}", request.getMethod(), request.getRequestURI(), e.getKind().code(), e.getMessage());
        }
        return respond(status, e.getKind().code(), e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, "ValidationFailed", message, request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "BadRequest", "Malformed request: " + e.getMessage(), request);
    }

    @ExceptionHandler({BlobStoreException.class, StoreException.class})
    public ResponseEntity<ErrorResponse> handleInfrastructure(RuntimeException e, HttpServletRequest request) {
        log.error("Infrastructure failure on {} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR",
                "A storage service is unavailable. Try again later.", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        if (e instanceof org.springframework.web.ErrorResponse) {
            // framework errors such as unknown paths or methods keep their own status
            HttpStatus status = HttpStatus.valueOf(((org.springframework.web.ErrorResponse) e).getStatusCode().value());
            return respond(status, status.name(), e.getMessage(), request);
        }
        log.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "An unexpected error occurred.", request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
            HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.value(), error, message, request.getRequestURI()));
    }
}
