package com.airlinereservation.airline.constants;

public final class ErrorCodes {

    private ErrorCodes() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";

    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String NO_SUCH_FLIGHT = "NO_SUCH_FLIGHT";
    public static final String REFERENCE_NOT_FOUND = "REFERENCE_NOT_FOUND";

    public static final String FLIGHT_FULL = "FLIGHT_FULL";
    public static final String DUPLICATE_ENTITY = "DUPLICATE_ENTITY";
    public static final String DEPENDENT_RECORDS_EXIST = "DEPENDENT_RECORDS_EXIST";
    public static final String CAPACITY_BELOW_RESERVATIONS = "CAPACITY_BELOW_RESERVATIONS";
    public static final String DATA_INTEGRITY = "DATA_INTEGRITY";

    public static final String LOCK_FAILED = "LOCK_FAILED";
    public static final String STORE_ERROR = "STORE_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
