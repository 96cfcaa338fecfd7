package com.airlinereservation.airline.repository;

/**
 * Live reservation count of one flight.
 */
public interface FlightReservationCount {

    Long getFlightId();

    Long getReserved();
}
