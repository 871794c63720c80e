package com.diskmap.treemap.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns request problems into {@link ApiError} bodies. Scan and layout never
 * fail for filesystem reasons, so what ends up here is bad input or a bug.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e, WebRequest request) {
        Map<String, Object> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }
        log.warn("[ExceptionHandler] Invalid request: {}", fieldErrors);

        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed",
                request, fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e, WebRequest request) {
        log.warn("[ExceptionHandler] Unreadable request body: {}", e.getMessage());

        return build(HttpStatus.BAD_REQUEST, "INVALID_PAYLOAD", "Invalid request payload",
                request, Map.of("details", String.valueOf(e.getMostSpecificCause().getMessage())));
    }

    @ExceptionHandler(NoScanAvailableException.class)
    public ResponseEntity<ApiError> handleNoScan(NoScanAvailableException e, WebRequest request) {
        log.info("[ExceptionHandler] {}", e.getMessage());

        return build(HttpStatus.CONFLICT, "NO_SCAN", e.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception e, WebRequest request) {
        log.error("[ExceptionHandler] Unexpected error: ", e);

        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred: " + e.getMessage(), request, null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String code, String message,
                                           WebRequest request, Map<String, Object> details) {
        ApiError error = ApiError.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .path(getRequestPath(request))
                .details(details)
                .build();
        return ResponseEntity.status(status).body(error);
    }

    private String getRequestPath(WebRequest request) {
        if (request instanceof ServletWebRequest) {
            return ((ServletWebRequest) request).getRequest().getRequestURI();
        }
        return null;
    }
}
