package com.airlinereservation.airline.service;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.dto.ReservationEntry;
import com.airlinereservation.airline.dto.ReservationRequest;
import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.exception.EntityNotFoundException;
import com.airlinereservation.airline.exception.ReferenceNotFoundException;
import com.airlinereservation.airline.exception.ReservationOperationException;
import com.airlinereservation.airline.mapper.ReservationMapper;
import com.airlinereservation.airline.model.Allocation;
import com.airlinereservation.airline.model.FlightContext;
import com.airlinereservation.airline.model.Reservation;
import com.airlinereservation.airline.repository.ReservationRepository;
import com.airlinereservation.airline.service.lock.LockOperations;
import com.airlinereservation.airline.validator.ReservationValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Books, lists and cancels reservations.
 *
 * <p>A booking holds the per-flight lock for the whole allocation transaction, so the commit
 * is visible before the next booking on that flight counts seats.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final ReferentialResolver referentialResolver;
    private final CapacityAllocator capacityAllocator;
    private final ReservationRepository reservationRepository;
    private final LockOperations lockOperations;
    private final MeterRegistry meterRegistry;

    public ReservationEntry book(ReservationRequest request) {
        String passengerName = ReservationValidator.validateReservationRequest(request);
        Long flightId = request.getFlightId();

        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Booking reservation: flightId={}, passengerName={}", flightId, passengerName);

        try {
            Allocation allocation = lockOperations.executeWithLock(
                    AirlineConstants.FLIGHT_LOCK_PREFIX + flightId,
                    () -> capacityAllocator.allocate(flightId, passengerName));

            countBooking("success");
            log.info("Reservation created: reservationId={}, flightId={}",
                    allocation.reservation().getId(), flightId);
            return ReservationMapper.toEntry(allocation);
        } catch (LockOperations.LockAcquisitionException e) {
            countBooking("lock_failed");
            log.warn("Failed to acquire booking lock: flightId={}", flightId);
            throw ReservationOperationException.lockFailed(flightId);
        } catch (ReferenceNotFoundException e) {
            countBooking("no_such_flight");
            throw e;
        } catch (ConflictException e) {
            countBooking("flight_full");
            throw e;
        } catch (RuntimeException e) {
            countBooking("error");
            log.error("Error booking reservation: flightId={}, error={}", flightId, e.getMessage(), e);
            throw e;
        } finally {
            sample.stop(Timer.builder(AirlineConstants.METRIC_BOOK_DURATION).register(meterRegistry));
        }
    }

    /**
     * Lists the reservations of a flight in creation order. The flight context is resolved
     * once and shared by every entry.
     */
    @Transactional(readOnly = true)
    public List<ReservationEntry> listReservationsForFlight(Long flightId) {
        ReservationValidator.validateFlightId(flightId);

        FlightContext context = referentialResolver.resolveFlightContext(flightId);
        List<Reservation> reservations = reservationRepository.findByFlightIdInCreationOrder(flightId);

        log.debug("Listed reservations: flightId={}, count={}", flightId, reservations.size());
        return ReservationMapper.toEntryList(reservations, context);
    }

    @Transactional(readOnly = true)
    public ReservationEntry getReservation(Long reservationId) {
        Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> EntityNotFoundException.reservation(reservationId));

        FlightContext context = referentialResolver.resolveFlightContext(reservation.getFlight().getId());
        return ReservationMapper.toEntry(reservation, context);
    }

    /**
     * Deletes a reservation by id. The freed seat is available to the next booking since
     * occupancy is always counted from the stored rows.
     */
    @Transactional
    public void cancel(Long reservationId) {
        log.info("Cancelling reservation: reservationId={}", reservationId);

        if (!reservationRepository.existsById(reservationId)) {
            meterRegistry.counter(AirlineConstants.METRIC_CANCEL_TOTAL, "result", "not_found").increment();
            log.warn("Reservation not found: reservationId={}", reservationId);
            throw EntityNotFoundException.reservation(reservationId);
        }

        reservationRepository.deleteById(reservationId);
        meterRegistry.counter(AirlineConstants.METRIC_CANCEL_TOTAL, "result", "success").increment();
        log.info("Reservation cancelled: reservationId={}", reservationId);
    }

    private void countBooking(String result) {
        meterRegistry.counter(AirlineConstants.METRIC_BOOK_TOTAL, "result", result).increment();
    }
}
