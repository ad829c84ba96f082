package com.spendradar.api.controller;

import com.spendradar.api.dto.ErrorBody;
import com.spendradar.learning.RuleStoreException;
import com.spendradar.session.CategorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures and categorization errors to ErrorBody responses:
 * 400 for invalid input, 503 when a confirmed correction could not be persisted.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    public static final String RULE_STORE_UNAVAILABLE = "RULE_STORE_UNAVAILABLE";

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(CategorizationException.class)
    public ResponseEntity<ErrorBody> handleCategorization(CategorizationException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(RuleStoreException.class)
    public ResponseEntity<ErrorBody> handleRuleStore(RuleStoreException ex) {
        log.error("Confirmed correction not persisted", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of(RULE_STORE_UNAVAILABLE, "Correction could not be saved; retry later"));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "DESCRIPTION_REQUIRED" -> "Transaction description is required";
            case "CATEGORY_REQUIRED" -> "Category is required";
            case "TRANSACTIONS_REQUIRED" -> "Transaction list is required";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
