package com.airlinereservation.airline.validator;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.constants.ValidationMessages;
import com.airlinereservation.airline.dto.CancelReservationRequest;
import com.airlinereservation.airline.dto.ReservationRequest;
import com.airlinereservation.airline.exception.AirlineValidationException;
import com.airlinereservation.airline.exception.InvalidRequestBodyException;
import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

public final class ReservationValidator {

    private static final Pattern ALPHANUMERIC = Pattern.compile(AirlineConstants.ALPHANUMERIC_PATTERN);

    private ReservationValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Checks a booking request and returns the passenger name with surrounding whitespace removed.
     */
    public static String validateReservationRequest(ReservationRequest request) {
        if (request == null) {
            throw new AirlineValidationException("request", ValidationMessages.RESERVATION_REQUEST_REQUIRED);
        }

        validateFlightId(request.getFlightId());
        return normalizePassengerName(request.getPassengerName());
    }

    public static String normalizePassengerName(String passengerName) {
        if (!StringUtils.hasText(passengerName)) {
            throw new AirlineValidationException("passengerName", ValidationMessages.PASSENGER_NAME_REQUIRED);
        }

        String trimmed = passengerName.trim();
        if (!ALPHANUMERIC.matcher(trimmed).matches()) {
            throw new AirlineValidationException("passengerName", ValidationMessages.PASSENGER_NAME_ALPHANUMERIC);
        }
        if (trimmed.length() < AirlineConstants.MIN_PASSENGER_NAME_LENGTH) {
            throw new AirlineValidationException("passengerName", ValidationMessages.PASSENGER_NAME_MIN);
        }
        return trimmed;
    }

    public static void validateFlightId(Long flightId) {
        if (flightId == null) {
            throw new AirlineValidationException("flightId", ValidationMessages.FLIGHT_ID_REQUIRED);
        }
        if (flightId < AirlineConstants.MIN_ID) {
            throw new AirlineValidationException("flightId", ValidationMessages.FLIGHT_ID_POSITIVE);
        }
    }

    /**
     * The cancel body must carry exactly one key, {@code ID}. Returns that id.
     */
    public static Long validateCancelRequest(CancelReservationRequest request) {
        if (request == null || request.getId() == null) {
            throw new InvalidRequestBodyException(ValidationMessages.CANCEL_ID_REQUIRED);
        }
        if (request.hasUnexpectedFields()) {
            throw new InvalidRequestBodyException(ValidationMessages.CANCEL_ONLY_ID);
        }
        if (request.getId() < AirlineConstants.MIN_ID) {
            throw new InvalidRequestBodyException(ValidationMessages.ID_POSITIVE);
        }
        return request.getId();
    }
}
