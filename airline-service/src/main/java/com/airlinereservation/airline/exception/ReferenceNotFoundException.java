package com.airlinereservation.airline.exception;

import com.airlinereservation.airline.constants.ErrorCodes;
import com.airlinereservation.airline.constants.ResponseMessages;
import com.airlinereservation.airline.enums.EntityKind;
import lombok.Getter;

import java.util.Map;

/**
 * Thrown when a write or lookup names a related record that does not exist,
 * e.g. a booking against an unknown flight.
 */
@Getter
public class ReferenceNotFoundException extends AirlineException {

    private final EntityKind kind;
    private final Long entityId;

    public ReferenceNotFoundException(EntityKind kind, Long entityId, String message) {
        this(ErrorCodes.REFERENCE_NOT_FOUND, kind, entityId, message);
    }

    private ReferenceNotFoundException(String errorCode, EntityKind kind, Long entityId, String message) {
        super(errorCode, message, Map.of("entity", kind.name(), "id", String.valueOf(entityId)));
        this.kind = kind;
        this.entityId = entityId;
    }

    public static ReferenceNotFoundException noSuchFlight(Long flightId) {
        return new ReferenceNotFoundException(ErrorCodes.NO_SUCH_FLIGHT, EntityKind.FLIGHT, flightId,
                ResponseMessages.NO_SUCH_FLIGHT);
    }
}
