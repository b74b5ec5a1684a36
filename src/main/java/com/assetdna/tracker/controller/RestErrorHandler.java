package com.assetdna.tracker.controller;

import com.assetdna.tracker.dto.ErrorResponse;
import com.assetdna.tracker.exception.AssetDnaException;
import com.assetdna.tracker.exception.CyclicHierarchyException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.List;

/**
 * Maps registry errors to HTTP statuses with a uniform JSON body.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class RestErrorHandler {

    private final Clock clock;

    @ExceptionHandler(AssetDnaException.class)
    public ResponseEntity<ErrorResponse> handleRegistryError(AssetDnaException ex, WebRequest request) {
        HttpStatus status = statusFor(ex);
        List<String> details = ex instanceof CyclicHierarchyException cyclic ? cyclic.getCycle() : null;
        log.warn("Request rejected with {}: {}", ex.getErrorCode(), ex.getMessage());
        return build(status, ex.getErrorCode().name(), ex.getMessage(), details, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, WebRequest request) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation failed", details, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null, request);
    }

    static HttpStatus statusFor(AssetDnaException ex) {
        return switch (ex.getErrorCode()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_BOM_ITEM, NON_MONOTONIC_SNAPSHOT, CYCLIC_HIERARCHY, AMBIGUOUS_PARENT -> HttpStatus.CONFLICT;
            case INVALID_HIERARCHY, ORPHAN_ASSET -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_RECORD, UNSUPPORTED_FORMAT -> HttpStatus.BAD_REQUEST;
        };
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                List<String> details, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(clock.instant())
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .path(path)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
