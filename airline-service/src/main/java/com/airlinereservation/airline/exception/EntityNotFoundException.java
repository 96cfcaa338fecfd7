package com.airlinereservation.airline.exception;

import com.airlinereservation.airline.constants.ErrorCodes;
import com.airlinereservation.airline.constants.ResponseMessages;
import com.airlinereservation.airline.enums.EntityKind;
import lombok.Getter;

import java.util.Map;

/**
 * Thrown when the record addressed by a request does not exist.
 */
@Getter
public class EntityNotFoundException extends AirlineException {

    private final EntityKind kind;
    private final Long entityId;

    public EntityNotFoundException(EntityKind kind, Long entityId) {
        this(kind, entityId, kind.getLabel() + " not found: " + entityId);
    }

    private EntityNotFoundException(EntityKind kind, Long entityId, String message) {
        super(ErrorCodes.NOT_FOUND, message, Map.of("entity", kind.name(), "id", String.valueOf(entityId)));
        this.kind = kind;
        this.entityId = entityId;
    }

    public static EntityNotFoundException reservation(Long reservationId) {
        return new EntityNotFoundException(EntityKind.RESERVATION, reservationId, ResponseMessages.RESERVATION_NOT_FOUND);
    }
}
