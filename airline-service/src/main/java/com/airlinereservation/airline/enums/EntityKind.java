package com.airlinereservation.airline.enums;

/**
 * The persisted entity types, used when reporting which record a lookup or
 * constraint refers to.
 */
public enum EntityKind {

    AIRPORT("Airport"),
    ITINERARY("Itinerary"),
    AIRPLANE("Airplane"),
    FLIGHT("Flight"),
    RESERVATION("Reservation");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * The kind of record that holds a foreign key to this one, or {@code null} for reservations.
     */
    public EntityKind dependentKind() {
        return switch (this) {
            case AIRPORT -> ITINERARY;
            case ITINERARY, AIRPLANE -> FLIGHT;
            case FLIGHT -> RESERVATION;
            case RESERVATION -> null;
        };
    }
}
