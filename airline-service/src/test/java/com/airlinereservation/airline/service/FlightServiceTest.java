package com.airlinereservation.airline.service;

import com.airlinereservation.airline.constants.ErrorCodes;
import com.airlinereservation.airline.dto.FlightEntry;
import com.airlinereservation.airline.dto.FlightFilterCriteria;
import com.airlinereservation.airline.enums.EntityKind;
import com.airlinereservation.airline.exception.AirlineValidationException;
import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.exception.EntityNotFoundException;
import com.airlinereservation.airline.exception.ReferenceNotFoundException;
import com.airlinereservation.airline.model.Airplane;
import com.airlinereservation.airline.model.Flight;
import com.airlinereservation.airline.model.Itinerary;
import com.airlinereservation.airline.repository.FlightRepository;
import com.airlinereservation.airline.repository.ReservationRepository;
import com.airlinereservation.airline.support.AirlineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("FlightService")
class FlightServiceTest {

    @Mock
    private FlightRepository flightRepository;

    @Mock
    private ReservationRepository reservationRepository;

    @Mock
    private ReferentialResolver referentialResolver;

    private FlightService flightService;

    private FlightEntry validEntry;
    private Itinerary itinerary;
    private Airplane airplane;
    private Flight existingFlight;

    @BeforeEach
    void setUp() {
        flightService = new FlightService(flightRepository, reservationRepository, referentialResolver);

        itinerary = AirlineFixtures.context(10L, 3).itinerary();
        airplane = AirlineFixtures.airplane(4L, "Skylark", 3);
        existingFlight = AirlineFixtures.flight(10L, itinerary, airplane);

        validEntry = FlightEntry.builder()
                .itineraryId(3L)
                .departureTime(AirlineFixtures.DEPARTURE)
                .arrivalTime(AirlineFixtures.ARRIVAL)
                .airplaneId(4L)
                .build();

        when(referentialResolver.requireItinerary(eq(3L), any())).thenReturn(itinerary);
        when(referentialResolver.requireAirplane(eq(4L), any())).thenReturn(airplane);
        when(referentialResolver.lockAirplane(eq(4L), any())).thenReturn(airplane);
        when(flightRepository.existsById(10L)).thenReturn(true);
    }

    @Nested
    @DisplayName("createFlight")
    class CreateFlight {

        @Test
        @DisplayName("creates flight with valid data")
        void createsFlightWithValidData() {
            when(flightRepository.save(any(Flight.class))).thenAnswer(inv -> {
                Flight f = inv.getArgument(0);
                f.setId(11L);
                return f;
            });

            FlightEntry result = flightService.createFlight(validEntry);

            assertThat(result.getId()).isEqualTo(11L);
            assertThat(result.getItineraryId()).isEqualTo(3L);
            assertThat(result.getAirplaneId()).isEqualTo(4L);
        }

        @Test
        @DisplayName("rejects arrival not after departure")
        void rejectsArrivalBeforeDeparture() {
            validEntry.setArrivalTime(validEntry.getDepartureTime());

            assertThatThrownBy(() -> flightService.createFlight(validEntry))
                    .isInstanceOf(AirlineValidationException.class)
                    .hasMessage("Arrival time must be after departure time.");

            verify(flightRepository, never()).save(any());
        }

        @Test
        @DisplayName("rejects unknown itinerary")
        void rejectsUnknownItinerary() {
            validEntry.setItineraryId(99L);
            when(referentialResolver.requireItinerary(eq(99L), any()))
                    .thenThrow(new ReferenceNotFoundException(EntityKind.ITINERARY, 99L, "Invalid itinerary ID."));

            assertThatThrownBy(() -> flightService.createFlight(validEntry))
                    .isInstanceOf(ReferenceNotFoundException.class)
                    .hasMessage("Invalid itinerary ID.");

            verify(flightRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("updateFlight")
    class UpdateFlight {

        @Test
        @DisplayName("reassigns airplane large enough for existing reservations")
        void reassignsAirplane() {
            Airplane bigger = AirlineFixtures.airplane(5L, "Condor", 200);
            validEntry.setAirplaneId(5L);
            when(referentialResolver.lockAirplane(eq(5L), any())).thenReturn(bigger);
            when(flightRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(existingFlight));
            when(reservationRepository.countByFlightId(10L)).thenReturn(3L);
            when(flightRepository.save(any(Flight.class))).thenAnswer(inv -> inv.getArgument(0));

            FlightEntry result = flightService.updateFlight(10L, validEntry);

            assertThat(result.getAirplaneId()).isEqualTo(5L);
        }

        @Test
        @DisplayName("locks the target airplane before the flight and counts under both locks")
        void locksAirplaneBeforeFlight() {
            when(flightRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(existingFlight));
            when(flightRepository.save(any(Flight.class))).thenAnswer(inv -> inv.getArgument(0));

            flightService.updateFlight(10L, validEntry);

            InOrder inOrder = inOrder(referentialResolver, flightRepository, reservationRepository);
            inOrder.verify(referentialResolver).lockAirplane(eq(4L), any());
            inOrder.verify(flightRepository).findByIdForUpdate(10L);
            inOrder.verify(reservationRepository).countByFlightId(10L);
        }

        @Test
        @DisplayName("rejects airplane smaller than live reservation count")
        void rejectsSmallerAirplane() {
            Airplane smaller = AirlineFixtures.airplane(6L, "Finch", 1);
            validEntry.setAirplaneId(6L);
            when(referentialResolver.lockAirplane(eq(6L), any())).thenReturn(smaller);
            when(flightRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(existingFlight));
            when(reservationRepository.countByFlightId(10L)).thenReturn(2L);

            assertThatThrownBy(() -> flightService.updateFlight(10L, validEntry))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCodes.CAPACITY_BELOW_RESERVATIONS);

            verify(flightRepository, never()).save(any());
        }

        @Test
        @DisplayName("throws not found for missing flight")
        void throwsForMissingFlight() {
            when(flightRepository.existsById(10L)).thenReturn(false);

            assertThatThrownBy(() -> flightService.updateFlight(10L, validEntry))
                    .isInstanceOf(EntityNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCodes.NOT_FOUND);

            verify(referentialResolver, never()).lockAirplane(any(), any());
        }
    }

    @Nested
    @DisplayName("deleteFlight")
    class DeleteFlight {

        @Test
        @DisplayName("deletes flight without reservations")
        void deletesFlight() {
            when(flightRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(existingFlight));

            flightService.deleteFlight(10L);

            verify(referentialResolver).requireNoDependents(EntityKind.FLIGHT, 10L);
            verify(flightRepository).delete(existingFlight);
        }

        @Test
        @DisplayName("keeps flight that still has reservations")
        void keepsFlightWithReservations() {
            when(flightRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(existingFlight));
            doThrow(ConflictException.dependentsExist(EntityKind.FLIGHT, 10L, EntityKind.RESERVATION, 2))
                    .when(referentialResolver).requireNoDependents(EntityKind.FLIGHT, 10L);

            assertThatThrownBy(() -> flightService.deleteFlight(10L))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCodes.DEPENDENT_RECORDS_EXIST);

            verify(flightRepository, never()).delete(any(Flight.class));
        }
    }

    @Nested
    @DisplayName("findFlights")
    class FindFlights {

        @Test
        @DisplayName("returns flights matching filters")
        void returnsMatchingFlights() {
            when(flightRepository.findAll(ArgumentMatchers.<Specification<Flight>>any(), any(Sort.class)))
                    .thenReturn(List.of(existingFlight));

            List<FlightEntry> result = flightService.findFlights(FlightFilterCriteria.builder()
                    .airplaneId(4L)
                    .arrivesBefore(AirlineFixtures.ARRIVAL.plusHours(1))
                    .build());

            assertThat(result).extracting(FlightEntry::getId).containsExactly(10L);
            verify(referentialResolver).requireExists(eq(EntityKind.AIRPLANE), eq(4L), any());
        }

        @Test
        @DisplayName("rejects filter naming an unknown airplane")
        void rejectsUnknownAirplaneFilter() {
            doThrow(new ReferenceNotFoundException(EntityKind.AIRPLANE, 77L, "Invalid airplane ID."))
                    .when(referentialResolver).requireExists(eq(EntityKind.AIRPLANE), eq(77L), any());

            assertThatThrownBy(() -> flightService.findFlights(FlightFilterCriteria.builder().airplaneId(77L).build()))
                    .isInstanceOf(ReferenceNotFoundException.class);

            verify(flightRepository, never()).findAll(ArgumentMatchers.<Specification<Flight>>any(), any(Sort.class));
        }
    }
}
