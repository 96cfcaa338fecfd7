package com.airlinereservation.airline.model;

import org.hibernate.Hibernate;

/**
 * A flight together with every record it depends on, resolved in one step.
 * This is the shape reservations are confirmed and listed against.
 */
public record FlightContext(
        Flight flight,
        Itinerary itinerary,
        Airport originAirport,
        Airport destinationAirport,
        Airplane airplane
) {

    /**
     * Builds the context from a flight whose associations are reachable. Lazy proxies are
     * unwrapped so the context stays usable after the session closes.
     */
    public static FlightContext of(Flight flight) {
        Itinerary itinerary = Hibernate.unproxy(flight.getItinerary(), Itinerary.class);
        return new FlightContext(
                flight,
                itinerary,
                Hibernate.unproxy(itinerary.getOriginAirport(), Airport.class),
                Hibernate.unproxy(itinerary.getDestinationAirport(), Airport.class),
                Hibernate.unproxy(flight.getAirplane(), Airplane.class));
    }

    public Long flightId() {
        return flight.getId();
    }

    public int capacity() {
        return airplane.getCapacity();
    }
}
