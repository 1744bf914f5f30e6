package com.example.CourseRag.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized exception handling for the REST endpoints. Backend failures abort only the current
 * request and are reported with a generic message.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Rejected request: {}", message);
        return buildErrorResponse(HttpStatus.BAD_REQUEST, message, "VALIDATION_ERROR");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Request body is not valid JSON for this endpoint.",
                "MALFORMED_REQUEST");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadParameter(Exception ex) {
        log.warn("Bad request parameter: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "BAD_PARAMETER");
    }

    @ExceptionHandler(InvalidFilterException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidFilter(InvalidFilterException ex) {
        log.warn("Search rejected: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_FILTER");
    }

    /**
     * Model, index or history backend failed for this request only.
     */
    @ExceptionHandler({
            ModelUnavailableException.class,
            IndexUnavailableException.class,
            ConversationStoreUnavailableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBackendFailure(CourseRagException ex) {
        log.error("Backend failure: {}", ex.getMessage(), ex);
        String code;
        if (ex instanceof ModelUnavailableException) {
            code = "MODEL_UNAVAILABLE";
        } else if (ex instanceof ConversationStoreUnavailableException) {
            code = "HISTORY_UNAVAILABLE";
        } else {
            code = "INDEX_UNAVAILABLE";
        }
        return buildErrorResponse(
                HttpStatus.SERVICE_UNAVAILABLE,
                "The assistant is temporarily unavailable. Please try again.",
                code
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.",
                "INTERNAL_SERVER_ERROR"
        );
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(
            HttpStatus status, String message, String errorCode) {
        return ResponseEntity.status(status).body(Map.of(
                "error", message,
                "errorCode", errorCode,
                "status", status.value(),
                "timestamp", LocalDateTime.now().toString()
        ));
    }
}
