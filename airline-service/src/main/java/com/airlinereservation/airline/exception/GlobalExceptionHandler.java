package com.airlinereservation.airline.exception;

import com.airlinereservation.airline.constants.ErrorCodes;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized exception handling for the airline service.
 * Maps domain exceptions to appropriate HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AirlineValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(AirlineValidationException ex) {
        log.warn("Validation error: {}", ex.getDetails());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        log.warn("Not found: kind={}, id={}", ex.getKind(), ex.getEntityId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(ReferenceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleMissingReference(ReferenceNotFoundException ex) {
        log.warn("Missing reference: kind={}, id={}", ex.getKind(), ex.getEntityId());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex) {
        log.warn("Conflict: code={}, details={}", ex.getErrorCode(), ex.getDetails());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(ReservationOperationException.class)
    public ResponseEntity<ErrorResponse> handleOperation(ReservationOperationException ex) {
        HttpStatus status = ex.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.CONFLICT;
        log.warn("Operation error: code={}, retryable={}", ex.getErrorCode(), ex.isRetryable());
        return ResponseEntity.status(status)
                .body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(InvalidRequestBodyException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(InvalidRequestBodyException ex) {
        log.warn("Invalid request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(AirlineException.class)
    public ResponseEntity<ErrorResponse> handleAirlineException(AirlineException ex) {
        log.error("Airline error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.from(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.warn("Validation errors: {}", fieldErrors);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.withDetails(ErrorCodes.VALIDATION_ERROR, "Invalid request", fieldErrors));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getAllValidationResults().forEach(result -> fieldErrors.put(
                result.getMethodParameter().getParameterName(),
                result.getResolvableErrors().stream()
                        .map(MessageSourceResolvable::getDefaultMessage)
                        .collect(Collectors.joining("; "))));
        log.warn("Parameter validation errors: {}", fieldErrors);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.withDetails(ErrorCodes.VALIDATION_ERROR, "Invalid request", fieldErrors));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Type mismatch: parameter={}", ex.getName());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.withDetails(ErrorCodes.TYPE_MISMATCH,
                        "Invalid value for parameter: " + ex.getName(),
                        Map.of(ex.getName(), String.valueOf(ex.getValue()))));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        if (ex.getCause() instanceof MismatchedInputException mismatch && !mismatch.getPath().isEmpty()) {
            String field = mismatch.getPath().stream()
                    .map(JsonMappingException.Reference::getFieldName)
                    .collect(Collectors.joining("."));
            log.warn("Body type mismatch: field={}", field);
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(ErrorResponse.withDetails(ErrorCodes.TYPE_MISMATCH,
                            "Invalid value for field: " + field, Map.of(field, "Invalid value")));
        }
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(ErrorCodes.MALFORMED_REQUEST, "Malformed request body"));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of(ErrorCodes.DATA_INTEGRITY,
                        "The request conflicts with existing data"));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStoreError(DataAccessException ex) {
        log.error("Store error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorCodes.STORE_ERROR, "A storage error occurred"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        if (ex instanceof org.springframework.web.ErrorResponse springError
                && springError.getStatusCode().is4xxClientError()) {
            log.warn("Request rejected: status={}, error={}", springError.getStatusCode(), ex.getMessage());
            return ResponseEntity.status(springError.getStatusCode())
                    .body(ErrorResponse.of(ErrorCodes.MALFORMED_REQUEST, ex.getMessage()));
        }
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorCodes.INTERNAL_ERROR, "An unexpected error occurred"));
    }

    /**
     * Standard error response format. {@code error} carries the human-readable message,
     * {@code code} the machine-readable one.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class ErrorResponse {
        private final String error;
        private final String code;
        private final Map<String, String> details;
        private final boolean retryable;
        private final Instant timestamp;

        private ErrorResponse(String error, String code, Map<String, String> details, boolean retryable) {
            this.error = error;
            this.code = code;
            this.details = details;
            this.retryable = retryable;
            this.timestamp = Instant.now();
        }

        public static ErrorResponse of(String code, String message) {
            return new ErrorResponse(message, code, null, false);
        }

        public static ErrorResponse withDetails(String code, String message, Map<String, String> details) {
            return new ErrorResponse(message, code, details, false);
        }

        public static ErrorResponse from(AirlineException ex) {
            return new ErrorResponse(ex.getMessage(), ex.getErrorCode(), ex.getDetails(), ex.isRetryable());
        }

        public String getError() { return error; }
        public String getCode() { return code; }
        public Map<String, String> getDetails() { return details; }
        public boolean isRetryable() { return retryable; }
        public Instant getTimestamp() { return timestamp; }
    }
}
