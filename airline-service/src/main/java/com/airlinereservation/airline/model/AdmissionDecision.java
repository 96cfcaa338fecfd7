package com.airlinereservation.airline.model;

import com.airlinereservation.airline.enums.AdmissionResult;

public record AdmissionDecision(AdmissionResult result, long reserved, int capacity) {

    public static AdmissionDecision evaluate(long reserved, int capacity) {
        AdmissionResult result = reserved < capacity
                ? AdmissionResult.ADMITTED
                : AdmissionResult.REJECTED_FLIGHT_FULL;
        return new AdmissionDecision(result, reserved, capacity);
    }

    public boolean isAdmitted() {
        return result == AdmissionResult.ADMITTED;
    }

    public long remainingSeats() {
        return Math.max(0, capacity - reserved);
    }
}
