package com.airlinereservation.airline.service;

import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.model.AdmissionDecision;
import com.airlinereservation.airline.model.Allocation;
import com.airlinereservation.airline.model.FlightContext;
import com.airlinereservation.airline.model.Reservation;
import com.airlinereservation.airline.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admits reservations against the live count of a flight.
 *
 * <p>Seats are never tracked in a counter column: the reservation rows are the only record,
 * counted inside the same transaction that inserts the new one. Callers serialize access per
 * flight; the row lock taken here covers instances that do not share that lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapacityAllocator {

    private final ReferentialResolver referentialResolver;
    private final ReservationRepository reservationRepository;

    public AdmissionDecision tryAdmit(FlightContext context) {
        long reserved = reservationRepository.countByFlightId(context.flightId());
        AdmissionDecision decision = AdmissionDecision.evaluate(reserved, context.capacity());
        log.debug("Admission decision: flightId={}, reserved={}, capacity={}, result={}",
                context.flightId(), reserved, context.capacity(), decision.result());
        return decision;
    }

    @Transactional
    public Allocation allocate(Long flightId, String passengerName) {
        FlightContext context = referentialResolver.lockFlightContext(flightId);

        AdmissionDecision decision = tryAdmit(context);
        if (!decision.isAdmitted()) {
            log.warn("Flight full: flightId={}, reserved={}, capacity={}",
                    flightId, decision.reserved(), decision.capacity());
            throw ConflictException.flightFull(flightId, decision.reserved(), decision.capacity());
        }

        Reservation saved = reservationRepository.saveAndFlush(Reservation.builder()
                .passengerName(passengerName)
                .flight(context.flight())
                .build());

        log.info("Seat allocated: reservationId={}, flightId={}, remaining={}",
                saved.getId(), flightId, decision.remainingSeats() - 1);
        return new Allocation(saved, context);
    }
}
