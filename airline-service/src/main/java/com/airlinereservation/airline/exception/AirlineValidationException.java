package com.airlinereservation.airline.exception;

import com.airlinereservation.airline.constants.ErrorCodes;

import java.util.Map;

/**
 * Thrown when input fails a field rule. Details hold one message per offending field.
 */
public class AirlineValidationException extends AirlineException {

    public AirlineValidationException(String field, String message) {
        super(ErrorCodes.VALIDATION_ERROR, message, Map.of(field, message));
    }

    public AirlineValidationException(Map<String, String> fieldErrors) {
        super(ErrorCodes.VALIDATION_ERROR, "Invalid request", fieldErrors);
    }
}
