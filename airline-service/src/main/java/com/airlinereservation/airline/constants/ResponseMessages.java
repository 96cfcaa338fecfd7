package com.airlinereservation.airline.constants;

public final class ResponseMessages {

    private ResponseMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String RESERVATION_CREATED = "Reservation created successfully";
    public static final String RESERVATIONS_RETRIEVED = "Reservations retrieved successfully";
    public static final String RESERVATION_RETRIEVED = "Reservation retrieved successfully";
    public static final String RESERVATION_DELETED = "Reservation deleted successfully.";

    public static final String NO_SUCH_FLIGHT = "No such flight exists.";
    public static final String FLIGHT_FULL = "The flight is already full.";
    public static final String RESERVATION_NOT_FOUND = "Reservation not found.";

    public static final String AIRPORT_NAME_EXISTS = "Airport name already exists.";
    public static final String ITINERARY_CODE_EXISTS = "Itinerary code already exists.";
    public static final String AIRPLANE_NAME_EXISTS = "Airplane name already exists.";
    public static final String INVALID_ITINERARY_ID = "Invalid itinerary ID.";
    public static final String INVALID_AIRPLANE_ID = "Invalid airplane ID.";
    public static final String ORIGIN_AIRPORT_MISSING = "Origin airport does not exist.";
    public static final String DESTINATION_AIRPORT_MISSING = "Destination airport does not exist.";
}
