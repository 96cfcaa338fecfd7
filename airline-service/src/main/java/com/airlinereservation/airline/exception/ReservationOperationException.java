package com.airlinereservation.airline.exception;

import com.airlinereservation.airline.constants.ErrorCodes;

import java.util.Map;

/**
 * Thrown when a reservation operation could not run to completion for reasons other
 * than the request itself.
 */
public class ReservationOperationException extends AirlineException {

    public ReservationOperationException(String errorCode, String message, boolean retryable,
                                         Map<String, String> details) {
        super(errorCode, message, retryable, null, details);
    }

    public static ReservationOperationException lockFailed(Long flightId) {
        return new ReservationOperationException(ErrorCodes.LOCK_FAILED,
                "Could not acquire booking lock for flight " + flightId + ", please retry", true,
                Map.of("flightId", String.valueOf(flightId)));
    }
}
