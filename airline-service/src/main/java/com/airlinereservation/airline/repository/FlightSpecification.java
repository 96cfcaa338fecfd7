package com.airlinereservation.airline.repository;

import com.airlinereservation.airline.dto.FlightFilterCriteria;
import com.airlinereservation.airline.model.Flight;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;

public final class FlightSpecification {

    private FlightSpecification() {
    }

    public static Specification<Flight> withCriteria(FlightFilterCriteria criteria) {
        return Specification
                .where(hasAirplane(criteria.getAirplaneId()))
                .and(hasItinerary(criteria.getItineraryId()))
                .and(arrivesBefore(criteria.getArrivesBefore()));
    }

    public static Specification<Flight> hasAirplane(Long airplaneId) {
        return (root, query, cb) -> {
            if (airplaneId == null) {
                return null;
            }
            return cb.equal(root.get("airplane").get("id"), airplaneId);
        };
    }

    public static Specification<Flight> hasItinerary(Long itineraryId) {
        return (root, query, cb) -> {
            if (itineraryId == null) {
                return null;
            }
            return cb.equal(root.get("itinerary").get("id"), itineraryId);
        };
    }

    public static Specification<Flight> arrivesBefore(LocalDateTime arrivesBefore) {
        return (root, query, cb) -> {
            if (arrivesBefore == null) {
                return null;
            }
            return cb.lessThan(root.get("arrivalTime"), arrivesBefore);
        };
    }
}
