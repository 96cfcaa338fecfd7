package com.airlinereservation.airline.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Airport ==========

    public static final String AIRPORT_NAME_REQUIRED = "Name is required.";
    public static final String AIRPORT_NAME_ALPHANUMERIC = "Name should contain only alphanumeric characters.";
    public static final String LATITUDE_REQUIRED = "Latitude is required.";
    public static final String LATITUDE_INVALID = "Invalid latitude.";
    public static final String LONGITUDE_REQUIRED = "Longitude is required.";
    public static final String LONGITUDE_INVALID = "Invalid longitude.";
    public static final String TIMEZONE_REQUIRED = "Timezone is required.";
    public static final String TIMEZONE_INVALID = "Invalid timezone. Expected GMT+H or GMT-H with H between 0 and 12.";

    // ========== Itinerary ==========

    public static final String CODE_REQUIRED = "Code is required.";
    public static final String CODE_ALPHANUMERIC = "Code should contain only alphanumeric characters.";
    public static final String ORIGIN_AIRPORT_REQUIRED = "Origin airport ID is required.";
    public static final String ORIGIN_AIRPORT_POSITIVE = "Origin airport ID must be a valid non-zero integer.";
    public static final String DESTINATION_AIRPORT_REQUIRED = "Destination airport ID is required.";
    public static final String DESTINATION_AIRPORT_POSITIVE = "Destination airport ID must be a valid non-zero integer.";
    public static final String DURATION_REQUIRED = "Duration is required.";
    public static final String DURATION_MIN = "Duration must be a valid non-zero integer representing the flight duration in minutes.";

    // ========== Airplane ==========

    public static final String AIRPLANE_NAME_REQUIRED = "Name is required.";
    public static final String AIRPLANE_NAME_ALPHANUMERIC = "Name should contain only alphanumeric characters.";
    public static final String MODEL_REQUIRED = "Model is required.";
    public static final String MODEL_ALPHANUMERIC = "Model should contain only alphanumeric characters.";
    public static final String CAPACITY_REQUIRED = "Capacity is required.";
    public static final String CAPACITY_MIN = "Capacity must be a valid positive, non-zero integer.";

    // ========== Flight ==========

    public static final String FLIGHT_DATA_REQUIRED = "Flight data is required.";
    public static final String ITINERARY_ID_REQUIRED = "Itinerary ID is required.";
    public static final String ITINERARY_ID_POSITIVE = "Itinerary ID must be a valid positive, non-zero integer.";
    public static final String AIRPLANE_ID_REQUIRED = "Airplane ID is required.";
    public static final String AIRPLANE_ID_POSITIVE = "Airplane ID must be a valid positive, non-zero integer.";
    public static final String DEPARTURE_TIME_REQUIRED = "Departure time is required.";
    public static final String ARRIVAL_TIME_REQUIRED = "Arrival time is required.";
    public static final String ARRIVAL_AFTER_DEPARTURE = "Arrival time must be after departure time.";

    // ========== Reservation ==========

    public static final String RESERVATION_REQUEST_REQUIRED = "Reservation request is required.";
    public static final String PASSENGER_NAME_REQUIRED = "Passenger name is required.";
    public static final String PASSENGER_NAME_ALPHANUMERIC = "Passenger name should contain only alphanumeric characters.";
    public static final String PASSENGER_NAME_MIN = "Passenger name should contain at least 2 characters.";
    public static final String FLIGHT_ID_REQUIRED = "Flight ID is required.";
    public static final String FLIGHT_ID_POSITIVE = "Flight ID must be a valid positive, non-zero integer.";
    public static final String CANCEL_ID_REQUIRED = "ID is required in the body.";
    public static final String CANCEL_ONLY_ID = "Only the ID should be provided in the body.";
    public static final String ID_POSITIVE = "ID must be a valid positive, non-zero integer.";
}
