package com.airlinereservation.airline.service;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.constants.ErrorCodes;
import com.airlinereservation.airline.dto.ReservationEntry;
import com.airlinereservation.airline.dto.ReservationRequest;
import com.airlinereservation.airline.exception.AirlineValidationException;
import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.exception.EntityNotFoundException;
import com.airlinereservation.airline.exception.ReferenceNotFoundException;
import com.airlinereservation.airline.exception.ReservationOperationException;
import com.airlinereservation.airline.model.Allocation;
import com.airlinereservation.airline.model.FlightContext;
import com.airlinereservation.airline.model.Reservation;
import com.airlinereservation.airline.repository.ReservationRepository;
import com.airlinereservation.airline.service.lock.LockOperations;
import com.airlinereservation.airline.support.AirlineFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("BookingService")
class BookingServiceTest {

    @Mock
    private ReferentialResolver referentialResolver;

    @Mock
    private CapacityAllocator capacityAllocator;

    @Mock
    private ReservationRepository reservationRepository;

    @Mock
    private LockOperations lockOperations;

    private SimpleMeterRegistry meterRegistry;
    private BookingService bookingService;
    private FlightContext context;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        bookingService = new BookingService(
                referentialResolver, capacityAllocator, reservationRepository, lockOperations, meterRegistry);
        context = AirlineFixtures.context(10L, 2);

        when(lockOperations.executeWithLock(anyString(), ArgumentMatchers.<Supplier<Allocation>>any()))
                .thenAnswer(inv -> inv.<Supplier<Allocation>>getArgument(1).get());
    }

    private double bookCount(String result) {
        return meterRegistry.counter(AirlineConstants.METRIC_BOOK_TOTAL, "result", result).count();
    }

    @Nested
    @DisplayName("book")
    class Book {

        @Test
        @DisplayName("allocates under the flight lock with a trimmed name")
        void allocatesUnderFlightLock() {
            Reservation saved = AirlineFixtures.reservation(5L, "Alice", context.flight(), AirlineFixtures.DEPARTURE);
            when(capacityAllocator.allocate(10L, "Alice")).thenReturn(new Allocation(saved, context));

            ReservationEntry entry = bookingService.book(new ReservationRequest("  Alice ", 10L));

            verify(lockOperations).executeWithLock(eq("flight:10"), any());
            verify(capacityAllocator).allocate(10L, "Alice");
            assertThat(entry.getId()).isEqualTo(5L);
            assertThat(entry.getPassengerName()).isEqualTo("Alice");
            assertThat(entry.getFlight().getId()).isEqualTo(10L);
            assertThat(entry.getFlight().getAirplane().getCapacity()).isEqualTo(2);
            assertThat(bookCount("success")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("rejects short name before touching the store")
        void rejectsShortName() {
            assertThatThrownBy(() -> bookingService.book(new ReservationRequest(" A ", 10L)))
                    .isInstanceOf(AirlineValidationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCodes.VALIDATION_ERROR);

            verify(capacityAllocator, never()).allocate(anyLong(), anyString());
        }

        @Test
        @DisplayName("rejects non-alphanumeric name")
        void rejectsNonAlphanumericName() {
            assertThatThrownBy(() -> bookingService.book(new ReservationRequest("Al ice", 10L)))
                    .isInstanceOf(AirlineValidationException.class)
                    .hasMessageContaining("alphanumeric");
        }

        @Test
        @DisplayName("rejects non-positive flight id")
        void rejectsNonPositiveFlightId() {
            assertThatThrownBy(() -> bookingService.book(new ReservationRequest("Alice", 0L)))
                    .isInstanceOf(AirlineValidationException.class);

            verify(lockOperations, never()).executeWithLock(anyString(), any());
        }

        @Test
        @DisplayName("propagates FLIGHT_FULL and counts it")
        void propagatesFlightFull() {
            when(capacityAllocator.allocate(10L, "Carol"))
                    .thenThrow(ConflictException.flightFull(10L, 2, 2));

            assertThatThrownBy(() -> bookingService.book(new ReservationRequest("Carol", 10L)))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCodes.FLIGHT_FULL);

            assertThat(bookCount("flight_full")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("propagates NO_SUCH_FLIGHT and counts it")
        void propagatesNoSuchFlight() {
            when(capacityAllocator.allocate(9999L, "Alice"))
                    .thenThrow(ReferenceNotFoundException.noSuchFlight(9999L));

            assertThatThrownBy(() -> bookingService.book(new ReservationRequest("Alice", 9999L)))
                    .isInstanceOf(ReferenceNotFoundException.class)
                    .hasMessage("No such flight exists.");

            assertThat(bookCount("no_such_flight")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("maps lock timeout to a retryable LOCK_FAILED")
        void mapsLockTimeout() {
            when(lockOperations.executeWithLock(anyString(), any()))
                    .thenThrow(new LockOperations.LockAcquisitionException("timeout"));

            assertThatThrownBy(() -> bookingService.book(new ReservationRequest("Alice", 10L)))
                    .isInstanceOf(ReservationOperationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCodes.LOCK_FAILED)
                    .hasFieldOrPropertyWithValue("retryable", true);

            assertThat(bookCount("lock_failed")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("records booking duration")
        void recordsDuration() {
            Reservation saved = AirlineFixtures.reservation(5L, "Alice", context.flight(), AirlineFixtures.DEPARTURE);
            when(capacityAllocator.allocate(10L, "Alice")).thenReturn(new Allocation(saved, context));

            bookingService.book(new ReservationRequest("Alice", 10L));

            assertThat(meterRegistry.timer(AirlineConstants.METRIC_BOOK_DURATION).count()).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("listReservationsForFlight")
    class ListReservations {

        @Test
        @DisplayName("maps every reservation against one resolved context")
        void mapsAgainstOneContext() {
            Reservation first = AirlineFixtures.reservation(1L, "Alice", context.flight(), AirlineFixtures.DEPARTURE);
            Reservation second = AirlineFixtures.reservation(2L, "Bob", context.flight(), AirlineFixtures.ARRIVAL);
            when(referentialResolver.resolveFlightContext(10L)).thenReturn(context);
            when(reservationRepository.findByFlightIdInCreationOrder(10L)).thenReturn(List.of(first, second));

            List<ReservationEntry> entries = bookingService.listReservationsForFlight(10L);

            assertThat(entries).extracting(ReservationEntry::getPassengerName).containsExactly("Alice", "Bob");
            assertThat(entries).allSatisfy(e -> assertThat(e.getFlight().getId()).isEqualTo(10L));
            verify(referentialResolver).resolveFlightContext(10L);
        }

        @Test
        @DisplayName("returns empty list for a flight without reservations")
        void returnsEmptyList() {
            when(referentialResolver.resolveFlightContext(10L)).thenReturn(context);
            when(reservationRepository.findByFlightIdInCreationOrder(10L)).thenReturn(List.of());

            assertThat(bookingService.listReservationsForFlight(10L)).isEmpty();
        }

        @Test
        @DisplayName("throws NO_SUCH_FLIGHT for unknown flight")
        void throwsForUnknownFlight() {
            when(referentialResolver.resolveFlightContext(42L))
                    .thenThrow(ReferenceNotFoundException.noSuchFlight(42L));

            assertThatThrownBy(() -> bookingService.listReservationsForFlight(42L))
                    .isInstanceOf(ReferenceNotFoundException.class);

            verify(reservationRepository, never()).findByFlightIdInCreationOrder(anyLong());
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("deletes existing reservation")
        void deletesExisting() {
            when(reservationRepository.existsById(5L)).thenReturn(true);

            bookingService.cancel(5L);

            verify(reservationRepository).deleteById(5L);
            assertThat(meterRegistry.counter(AirlineConstants.METRIC_CANCEL_TOTAL, "result", "success").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("throws not found for missing reservation")
        void throwsForMissing() {
            when(reservationRepository.existsById(5L)).thenReturn(false);

            assertThatThrownBy(() -> bookingService.cancel(5L))
                    .isInstanceOf(EntityNotFoundException.class)
                    .hasMessage("Reservation not found.");

            verify(reservationRepository, never()).deleteById(anyLong());
        }
    }

    @Nested
    @DisplayName("getReservation")
    class GetReservation {

        @Test
        @DisplayName("hydrates reservation with its flight context")
        void hydratesReservation() {
            Reservation reservation = AirlineFixtures.reservation(5L, "Alice", context.flight(), AirlineFixtures.DEPARTURE);
            when(reservationRepository.findById(5L)).thenReturn(Optional.of(reservation));
            when(referentialResolver.resolveFlightContext(10L)).thenReturn(context);

            ReservationEntry entry = bookingService.getReservation(5L);

            assertThat(entry.getFlight().getItinerary().getCode()).isEqualTo("JFKLHR1");
        }

        @Test
        @DisplayName("throws not found for missing reservation")
        void throwsForMissing() {
            when(reservationRepository.findById(5L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> bookingService.getReservation(5L))
                    .isInstanceOf(EntityNotFoundException.class);
        }
    }
}
