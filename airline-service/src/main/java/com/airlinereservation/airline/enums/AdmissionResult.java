package com.airlinereservation.airline.enums;

public enum AdmissionResult {
    ADMITTED,
    REJECTED_FLIGHT_FULL
}
