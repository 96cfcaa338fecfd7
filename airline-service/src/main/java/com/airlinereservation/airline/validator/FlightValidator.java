package com.airlinereservation.airline.validator;

import com.airlinereservation.airline.constants.ValidationMessages;
import com.airlinereservation.airline.dto.FlightEntry;
import com.airlinereservation.airline.exception.AirlineValidationException;

import java.time.LocalDateTime;

public final class FlightValidator {

    private FlightValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateFlightEntry(FlightEntry entry) {
        if (entry == null) {
            throw new AirlineValidationException("flight", ValidationMessages.FLIGHT_DATA_REQUIRED);
        }

        validateArrivalAfterDeparture(entry.getDepartureTime(), entry.getArrivalTime());
    }

    public static void validateArrivalAfterDeparture(LocalDateTime departureTime, LocalDateTime arrivalTime) {
        if (departureTime == null || arrivalTime == null) {
            return; // Jakarta @NotNull handles null checks
        }

        if (!arrivalTime.isAfter(departureTime)) {
            throw new AirlineValidationException("arrivalTime", ValidationMessages.ARRIVAL_AFTER_DEPARTURE);
        }
    }
}
