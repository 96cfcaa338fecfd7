package com.airlinereservation.airline.constants;

public final class AirlineConstants {

    private AirlineConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Field Rules ==========

    public static final String ALPHANUMERIC_PATTERN = "^[A-Za-z0-9]+$";
    public static final String TIMEZONE_PATTERN = "^GMT[+-](\\d|1[0-2])$";
    public static final int MIN_PASSENGER_NAME_LENGTH = 2;
    public static final int MIN_CAPACITY = 1;
    public static final int MIN_DURATION_MINUTES = 1;
    public static final long MIN_ID = 1L;

    // ========== Locking ==========

    public static final String FLIGHT_LOCK_PREFIX = "flight:";
    public static final long DEFAULT_LOCK_WAIT_TIMEOUT_MS = 5000;
    public static final long DEFAULT_LOCK_LEASE_TIMEOUT_MS = 10000;
    public static final String LOCK_MODE_LOCAL = "local";
    public static final String LOCK_MODE_REDIS = "redis";

    // ========== Metrics ==========

    public static final String METRIC_BOOK_TOTAL = "reservation.book.total";
    public static final String METRIC_BOOK_DURATION = "reservation.book.duration";
    public static final String METRIC_CANCEL_TOTAL = "reservation.cancel.total";
}
