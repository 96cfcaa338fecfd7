package com.airlinereservation.airline.service;

import com.airlinereservation.airline.enums.EntityKind;
import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.exception.ReferenceNotFoundException;
import com.airlinereservation.airline.model.Airplane;
import com.airlinereservation.airline.model.Airport;
import com.airlinereservation.airline.model.FlightContext;
import com.airlinereservation.airline.model.Itinerary;
import com.airlinereservation.airline.repository.AirplaneRepository;
import com.airlinereservation.airline.repository.AirportRepository;
import com.airlinereservation.airline.repository.FlightRepository;
import com.airlinereservation.airline.repository.ItineraryRepository;
import com.airlinereservation.airline.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Looks up related records and checks that the ones a write depends on exist.
 *
 * <p>All reads for a flight context go through a single fetch-join query, so the flight,
 * its itinerary, both airports and the airplane are observed together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferentialResolver {

    private final AirportRepository airportRepository;
    private final ItineraryRepository itineraryRepository;
    private final AirplaneRepository airplaneRepository;
    private final FlightRepository flightRepository;
    private final ReservationRepository reservationRepository;

    // ========== Flight Context ==========

    @Transactional(readOnly = true)
    public FlightContext resolveFlightContext(Long flightId) {
        return flightRepository.findContextById(flightId)
                .map(FlightContext::of)
                .orElseThrow(() -> {
                    log.warn("Flight not found: flightId={}", flightId);
                    return ReferenceNotFoundException.noSuchFlight(flightId);
                });
    }

    /**
     * Same as {@link #resolveFlightContext(Long)} but takes a write lock on the flight row first.
     * The lock is held until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FlightContext lockFlightContext(Long flightId) {
        if (flightRepository.findByIdForUpdate(flightId).isEmpty()) {
            log.warn("Flight not found: flightId={}", flightId);
            throw ReferenceNotFoundException.noSuchFlight(flightId);
        }
        return resolveFlightContext(flightId);
    }

    // ========== Existence ==========

    @Transactional(readOnly = true)
    public boolean exists(EntityKind kind, Long id) {
        if (id == null) {
            return false;
        }
        return switch (kind) {
            case AIRPORT -> airportRepository.existsById(id);
            case ITINERARY -> itineraryRepository.existsById(id);
            case AIRPLANE -> airplaneRepository.existsById(id);
            case FLIGHT -> flightRepository.existsById(id);
            case RESERVATION -> reservationRepository.existsById(id);
        };
    }

    /**
     * Fails with the given message when {@link #exists(EntityKind, Long)} is false.
     */
    public void requireExists(EntityKind kind, Long id, String message) {
        if (!exists(kind, id)) {
            log.warn("Missing reference: kind={}, id={}", kind, id);
            throw new ReferenceNotFoundException(kind, id, message);
        }
    }

    public Airport requireAirport(Long airportId, String message) {
        return airportRepository.findById(airportId)
                .orElseThrow(() -> new ReferenceNotFoundException(EntityKind.AIRPORT, airportId, message));
    }

    public Itinerary requireItinerary(Long itineraryId, String message) {
        return itineraryRepository.findById(itineraryId)
                .orElseThrow(() -> new ReferenceNotFoundException(EntityKind.ITINERARY, itineraryId, message));
    }

    public Airplane requireAirplane(Long airplaneId, String message) {
        return airplaneRepository.findById(airplaneId)
                .orElseThrow(() -> new ReferenceNotFoundException(EntityKind.AIRPLANE, airplaneId, message));
    }

    /**
     * Loads the airplane with a write lock held until the caller's transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Airplane lockAirplane(Long airplaneId, String message) {
        return airplaneRepository.findByIdForUpdate(airplaneId)
                .orElseThrow(() -> new ReferenceNotFoundException(EntityKind.AIRPLANE, airplaneId, message));
    }

    // ========== Dependents ==========

    @Transactional(readOnly = true)
    public long countDependents(EntityKind kind, Long id) {
        return switch (kind) {
            case AIRPORT -> itineraryRepository.countByAirportId(id);
            case ITINERARY -> flightRepository.countByItineraryId(id);
            case AIRPLANE -> flightRepository.countByAirplaneId(id);
            case FLIGHT -> reservationRepository.countByFlightId(id);
            case RESERVATION -> 0L;
        };
    }

    /**
     * Rejects the delete of a record that other records still point at.
     */
    public void requireNoDependents(EntityKind kind, Long id) {
        long count = countDependents(kind, id);
        if (count > 0) {
            log.warn("Delete blocked by dependents: kind={}, id={}, dependent={}, count={}",
                    kind, id, kind.dependentKind(), count);
            throw ConflictException.dependentsExist(kind, id, kind.dependentKind(), count);
        }
    }
}
