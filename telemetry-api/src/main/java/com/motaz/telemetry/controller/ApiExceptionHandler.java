package com.motaz.telemetry.controller;

import com.motaz.telemetry.dto.ErrorResponseDto;
import com.motaz.telemetry.engine.exception.BaselineConflictException;
import com.motaz.telemetry.engine.exception.BatchNotFoundException;
import com.motaz.telemetry.engine.exception.MalformedBatchException;
import com.motaz.telemetry.engine.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MalformedBatchException.class)
    public ResponseEntity<ErrorResponseDto> handleMalformed(MalformedBatchException ex) {
        log.warn("Rejected batch: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "MALFORMED_BATCH", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(BatchNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(BatchNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "BATCH_NOT_FOUND", ex.getMessage(), Map.of("key", ex.getKey()));
    }

    @ExceptionHandler(BaselineConflictException.class)
    public ResponseEntity<ErrorResponseDto> handleConflict(BaselineConflictException ex) {
        log.warn("Baseline conflict surfaced to client: {}", ex.getMessage());
        Map<String, Object> details = new HashMap<>();
        details.put("key", ex.getKey());
        details.put("expectedVersion", ex.getExpectedVersion());
        details.put("actualVersion", ex.getActualVersion());
        return build(HttpStatus.CONFLICT, "BASELINE_CONFLICT", ex.getMessage(), details);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnavailable(StoreUnavailableException ex) {
        log.error("Storage failure", ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        String reason = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of("reason", reason));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status).body(new ErrorResponseDto(code, message, details));
    }
}
