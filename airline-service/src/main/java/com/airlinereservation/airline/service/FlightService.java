package com.airlinereservation.airline.service;

import com.airlinereservation.airline.constants.ResponseMessages;
import com.airlinereservation.airline.dto.FlightEntry;
import com.airlinereservation.airline.dto.FlightFilterCriteria;
import com.airlinereservation.airline.enums.EntityKind;
import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.exception.EntityNotFoundException;
import com.airlinereservation.airline.mapper.FlightMapper;
import com.airlinereservation.airline.model.Airplane;
import com.airlinereservation.airline.model.Flight;
import com.airlinereservation.airline.model.Itinerary;
import com.airlinereservation.airline.repository.FlightRepository;
import com.airlinereservation.airline.repository.FlightSpecification;
import com.airlinereservation.airline.repository.ReservationRepository;
import com.airlinereservation.airline.validator.FlightValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class FlightService {

    private final FlightRepository flightRepository;
    private final ReservationRepository reservationRepository;
    private final ReferentialResolver referentialResolver;

    // ========== CRUD Operations ==========

    @Transactional
    public FlightEntry createFlight(FlightEntry request) {
        FlightValidator.validateFlightEntry(request);

        Itinerary itinerary = referentialResolver.requireItinerary(
                request.getItineraryId(), ResponseMessages.INVALID_ITINERARY_ID);
        Airplane airplane = referentialResolver.requireAirplane(
                request.getAirplaneId(), ResponseMessages.INVALID_AIRPLANE_ID);

        Flight saved = flightRepository.save(FlightMapper.toEntity(request, itinerary, airplane));
        log.info("Created flight: id={}, itinerary={}, airplane={}", saved.getId(), itinerary.getCode(), airplane.getName());
        return FlightMapper.toEntry(saved);
    }

    /**
     * Reassigning the airplane is only allowed if the new one seats every existing reservation.
     * The target airplane row is locked before the flight row, the same order a capacity
     * change on that airplane uses, so the count and the capacity cannot move underneath.
     */
    @Transactional
    public FlightEntry updateFlight(Long flightId, FlightEntry request) {
        FlightValidator.validateFlightEntry(request);

        if (!flightRepository.existsById(flightId)) {
            throw new EntityNotFoundException(EntityKind.FLIGHT, flightId);
        }

        Itinerary itinerary = referentialResolver.requireItinerary(
                request.getItineraryId(), ResponseMessages.INVALID_ITINERARY_ID);
        Airplane airplane = referentialResolver.lockAirplane(
                request.getAirplaneId(), ResponseMessages.INVALID_AIRPLANE_ID);

        Flight flight = flightRepository.findByIdForUpdate(flightId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.FLIGHT, flightId));

        long reserved = reservationRepository.countByFlightId(flightId);
        if (reserved > airplane.getCapacity()) {
            log.warn("Airplane reassignment rejected: flightId={}, airplaneId={}, reserved={}, capacity={}",
                    flightId, airplane.getId(), reserved, airplane.getCapacity());
            throw ConflictException.capacityBelowReservations(flightId, airplane.getCapacity(), reserved);
        }

        FlightMapper.updateEntity(flight, request, itinerary, airplane);
        Flight saved = flightRepository.save(flight);
        log.info("Updated flight: id={}", flightId);
        return FlightMapper.toEntry(saved);
    }

    @Transactional
    public void deleteFlight(Long flightId) {
        Flight flight = flightRepository.findByIdForUpdate(flightId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.FLIGHT, flightId));
        referentialResolver.requireNoDependents(EntityKind.FLIGHT, flightId);

        flightRepository.delete(flight);
        log.info("Deleted flight: id={}", flightId);
    }

    // ========== Query Operations ==========

    @Transactional(readOnly = true)
    public FlightEntry getFlight(Long flightId) {
        return flightRepository.findById(flightId)
                .map(FlightMapper::toEntry)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.FLIGHT, flightId));
    }

    /**
     * Lists flights matching every given filter. A filter naming an airplane or itinerary
     * that does not exist is rejected rather than yielding an empty list.
     */
    @Transactional(readOnly = true)
    public List<FlightEntry> findFlights(FlightFilterCriteria criteria) {
        if (criteria.getAirplaneId() != null) {
            referentialResolver.requireExists(EntityKind.AIRPLANE, criteria.getAirplaneId(),
                    ResponseMessages.INVALID_AIRPLANE_ID);
        }
        if (criteria.getItineraryId() != null) {
            referentialResolver.requireExists(EntityKind.ITINERARY, criteria.getItineraryId(),
                    ResponseMessages.INVALID_ITINERARY_ID);
        }

        Specification<Flight> spec = FlightSpecification.withCriteria(criteria);
        List<Flight> flights = flightRepository.findAll(spec, Sort.by("id"));
        return FlightMapper.toEntryList(flights);
    }
}
