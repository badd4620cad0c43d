package io.github.samzhu.quota.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.quota.dto.api.ErrorResponse;
import io.github.samzhu.quota.exception.QuotaConfigurationException;
import io.github.samzhu.quota.exception.QuotaConflictException;
import io.github.samzhu.quota.exception.QuotaNotFoundException;
import io.github.samzhu.quota.exception.TransientStoreException;

/**
 * API 例外處理。
 *
 * <p>將配額例外轉成統一的 {@link ErrorResponse}：
 * <ul>
 *   <li>{@link QuotaConfigurationException} → 400 {@code configuration_error}</li>
 *   <li>Bean Validation 失敗、JSON 無法解析 → 400 {@code validation_error}</li>
 *   <li>{@link QuotaNotFoundException} → 404 {@code not_found}</li>
 *   <li>{@link QuotaConflictException} → 409 {@code conflict}</li>
 *   <li>{@link TransientStoreException} → 503 {@code service_unavailable}</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String VALIDATION_ERROR = "validation_error";

    @ExceptionHandler(QuotaConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(QuotaConfigurationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(e.getCode(), "Invalid configuration", e.getMessage(), e.getErrors()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        List<String> errors = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .toList();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(VALIDATION_ERROR, "Validation failed", String.join("; ", errors), errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ErrorResponse.of(VALIDATION_ERROR, "Malformed request body", e.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(QuotaNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(QuotaNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ErrorResponse.of(e.getCode(), e.getResourceType() + " not found", e.getMessage()));
    }

    @ExceptionHandler(QuotaConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(QuotaConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(ErrorResponse.of(e.getCode(), "Conflict", e.getMessage()));
    }

    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<ErrorResponse> handleTransient(TransientStoreException e) {
        log.warn("Store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ErrorResponse.of(e.getCode(), "Service unavailable", e.getMessage()));
    }
}
