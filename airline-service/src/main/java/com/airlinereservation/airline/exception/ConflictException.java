package com.airlinereservation.airline.exception;

import com.airlinereservation.airline.constants.ErrorCodes;
import com.airlinereservation.airline.constants.ResponseMessages;
import com.airlinereservation.airline.enums.EntityKind;

import java.util.Map;

/**
 * Thrown when a write would break a uniqueness, capacity or referential rule.
 */
public class ConflictException extends AirlineException {

    public ConflictException(String errorCode, String message, Map<String, String> details) {
        super(errorCode, message, details);
    }

    public static ConflictException duplicate(String field, String value, String message) {
        return new ConflictException(ErrorCodes.DUPLICATE_ENTITY, message, Map.of(field, value));
    }

    public static ConflictException flightFull(Long flightId, long reserved, int capacity) {
        return new ConflictException(ErrorCodes.FLIGHT_FULL, ResponseMessages.FLIGHT_FULL, Map.of(
                "flightId", String.valueOf(flightId),
                "reserved", String.valueOf(reserved),
                "capacity", String.valueOf(capacity)));
    }

    public static ConflictException dependentsExist(EntityKind kind, Long id, EntityKind dependent, long count) {
        return new ConflictException(ErrorCodes.DEPENDENT_RECORDS_EXIST,
                String.format("%s %d is still referenced by %d %s record(s)",
                        kind.getLabel(), id, count, dependent.getLabel().toLowerCase()),
                Map.of("entity", kind.name(), "id", String.valueOf(id),
                        "dependent", dependent.name(), "count", String.valueOf(count)));
    }

    public static ConflictException capacityBelowReservations(Long flightId, int capacity, long reserved) {
        return new ConflictException(ErrorCodes.CAPACITY_BELOW_RESERVATIONS,
                String.format("Capacity %d is below the %d reservation(s) held on flight %d",
                        capacity, reserved, flightId),
                Map.of("flightId", String.valueOf(flightId),
                        "reserved", String.valueOf(reserved),
                        "capacity", String.valueOf(capacity)));
    }
}
