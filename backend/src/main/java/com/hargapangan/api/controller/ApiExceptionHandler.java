package com.hargapangan.api.controller;

import com.hargapangan.api.dto.ErrorBody;
import com.hargapangan.common.ServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.Optional;

/**
 * Maps validation failures to 400 and service error codes to their HTTP status, always with ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    private static final Map<String, HttpStatus> STATUS_BY_CODE = Map.ofEntries(
            Map.entry("COMMODITY_NOT_FOUND", HttpStatus.NOT_FOUND),
            Map.entry("NO_CURRENT_PRICE", HttpStatus.NOT_FOUND),
            Map.entry("OVERRIDE_NOT_FOUND", HttpStatus.NOT_FOUND),
            Map.entry("REPORT_NOT_FOUND", HttpStatus.NOT_FOUND),
            Map.entry("CUSTOM_COMMODITY_NOT_FOUND", HttpStatus.NOT_FOUND),
            Map.entry("OVERRIDE_EXISTS", HttpStatus.CONFLICT),
            Map.entry("ALREADY_PROCESSED", HttpStatus.CONFLICT),
            Map.entry("SYNC_IN_PROGRESS", HttpStatus.CONFLICT),
            Map.entry("COMMODITY_EXISTS", HttpStatus.CONFLICT),
            Map.entry("CUSTOM_COMMODITY_EXISTS", HttpStatus.CONFLICT),
            Map.entry("SELF_APPROVAL", HttpStatus.FORBIDDEN),
            Map.entry("FORBIDDEN", HttpStatus.FORBIDDEN)
    );

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank() && msg.equals(msg.toUpperCase()))
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("VALIDATION_ERROR", ex.getReason() != null ? ex.getReason() : "Invalid request"));
    }

    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<ErrorBody> handleService(ServiceException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", ex.getMessage(), ex);
        } else {
            log.debug("Request rejected {}: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    static HttpStatus statusFor(String errorCode) {
        return STATUS_BY_CODE.getOrDefault(errorCode, HttpStatus.BAD_REQUEST);
    }
}
