package com.airlinereservation.airline.exception;

import com.airlinereservation.airline.constants.ErrorCodes;

/**
 * Thrown when a request body has the wrong shape, e.g. a missing or extra key.
 */
public class InvalidRequestBodyException extends AirlineException {

    public InvalidRequestBodyException(String message) {
        super(ErrorCodes.MALFORMED_REQUEST, message);
    }
}
