package com.airlinereservation.airline.model;

/**
 * A reservation that was admitted, paired with the flight context it was admitted against.
 */
public record Allocation(Reservation reservation, FlightContext context) {
}
