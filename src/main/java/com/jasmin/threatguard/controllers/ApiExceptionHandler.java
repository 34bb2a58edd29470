package com.jasmin.threatguard.controllers;

import com.jasmin.threatguard.controllers.dto.ApiErrorResponse;
import com.jasmin.threatguard.services.secrets.SecretsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Maps operator API failures to {@code {error, code}} bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        log.debug("Rejected operator request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), "BAD_REQUEST");
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), "BAD_REQUEST");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalid(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .collect(Collectors.joining(", ", "Invalid fields: ", ""));
        return error(HttpStatus.BAD_REQUEST, message, "VALIDATION_FAILED");
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(NoSuchElementException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), "NOT_FOUND");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiErrorResponse> handleConflict(IllegalStateException ex) {
        log.info("Operator request conflicts with current state: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage(), "INVALID_TRANSITION");
    }

    @ExceptionHandler(SecretsException.class)
    public ResponseEntity<ApiErrorResponse> handleSecrets(SecretsException ex) {
        log.error("Secrets operation failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), "SECRETS_ERROR");
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String message, String code) {
        return ResponseEntity.status(status).body(new ApiErrorResponse(message, code));
    }
}
