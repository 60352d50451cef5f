package com.medbook.shared.web;

import com.medbook.shared.error.ApplicationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps exceptions to {@link StdResponse} error bodies.
 *
 *   ApplicationException subtypes     → their own status, their message
 *   bean validation / unreadable body → 400
 *   missing X-Patient-Id              → 401
 *   constraint violation in Postgres  → 409
 *   other framework errors            → their own 4xx status
 *   anything else                     → 500, logged with stack trace
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String PATIENT_HEADER = "X-Patient-Id";

    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<StdResponse<Void>> handleApplication(ApplicationException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.warn("Request failed: status={}, reason={}", ex.getStatus().value(), ex.getMessage(), ex);
        } else {
            log.debug("Request rejected: status={}, reason={}", ex.getStatus().value(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(StdResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<StdResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(StdResponse.error(message.isEmpty() ? "Invalid request" : message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<StdResponse<Void>> handleUnreadable(Exception ex) {
        return ResponseEntity.badRequest().body(StdResponse.error("Malformed request"));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<StdResponse<Void>> handleMissingHeader(MissingRequestHeaderException ex) {
        if (PATIENT_HEADER.equalsIgnoreCase(ex.getHeaderName())) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(StdResponse.error("Missing patient identity"));
        }
        return ResponseEntity.badRequest().body(StdResponse.error("Missing header " + ex.getHeaderName()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<StdResponse<Void>> handleIntegrity(DataIntegrityViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(StdResponse.error("Request conflicts with existing data"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<StdResponse<Void>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework && !framework.getStatusCode().is5xxServerError()) {
            // unknown route, wrong method, unsupported media type...
            return ResponseEntity.status(framework.getStatusCode())
                    .body(StdResponse.error(framework.getBody().getTitle()));
        }
        log.error("Unhandled exception", ex);
        return ResponseEntity.internalServerError().body(StdResponse.error("Internal server error"));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
