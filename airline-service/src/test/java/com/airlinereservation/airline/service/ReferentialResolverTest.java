package com.airlinereservation.airline.service;

import com.airlinereservation.airline.constants.ErrorCodes;
import com.airlinereservation.airline.enums.EntityKind;
import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.exception.ReferenceNotFoundException;
import com.airlinereservation.airline.model.Flight;
import com.airlinereservation.airline.model.FlightContext;
import com.airlinereservation.airline.repository.AirplaneRepository;
import com.airlinereservation.airline.repository.AirportRepository;
import com.airlinereservation.airline.repository.FlightRepository;
import com.airlinereservation.airline.repository.ItineraryRepository;
import com.airlinereservation.airline.repository.ReservationRepository;
import com.airlinereservation.airline.support.AirlineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ReferentialResolver")
class ReferentialResolverTest {

    @Mock
    private AirportRepository airportRepository;

    @Mock
    private ItineraryRepository itineraryRepository;

    @Mock
    private AirplaneRepository airplaneRepository;

    @Mock
    private FlightRepository flightRepository;

    @Mock
    private ReservationRepository reservationRepository;

    private ReferentialResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ReferentialResolver(airportRepository, itineraryRepository, airplaneRepository,
                flightRepository, reservationRepository);
    }

    @Nested
    @DisplayName("resolveFlightContext")
    class ResolveFlightContext {

        @Test
        @DisplayName("hydrates flight, itinerary, both airports and airplane")
        void hydratesContext() {
            Flight flight = AirlineFixtures.context(10L, 150).flight();
            when(flightRepository.findContextById(10L)).thenReturn(Optional.of(flight));

            FlightContext context = resolver.resolveFlightContext(10L);

            assertThat(context.flightId()).isEqualTo(10L);
            assertThat(context.itinerary().getCode()).isEqualTo("JFKLHR1");
            assertThat(context.originAirport().getName()).isEqualTo("JFK");
            assertThat(context.destinationAirport().getName()).isEqualTo("LHR");
            assertThat(context.capacity()).isEqualTo(150);
        }

        @Test
        @DisplayName("throws NO_SUCH_FLIGHT for unknown id")
        void throwsForUnknownFlight() {
            when(flightRepository.findContextById(9999L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resolver.resolveFlightContext(9999L))
                    .isInstanceOf(ReferenceNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCodes.NO_SUCH_FLIGHT)
                    .hasFieldOrPropertyWithValue("kind", EntityKind.FLIGHT)
                    .hasFieldOrPropertyWithValue("entityId", 9999L);
        }

        @Test
        @DisplayName("lock variant takes the row lock before hydrating")
        void lockVariantLocksFirst() {
            Flight flight = AirlineFixtures.context(10L, 150).flight();
            when(flightRepository.findByIdForUpdate(10L)).thenReturn(Optional.of(flight));
            when(flightRepository.findContextById(10L)).thenReturn(Optional.of(flight));

            FlightContext context = resolver.lockFlightContext(10L);

            assertThat(context.flight()).isSameAs(flight);
            verify(flightRepository).findByIdForUpdate(10L);
        }

        @Test
        @DisplayName("lock variant throws NO_SUCH_FLIGHT without hydrating")
        void lockVariantThrowsForUnknownFlight() {
            when(flightRepository.findByIdForUpdate(9999L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resolver.lockFlightContext(9999L))
                    .isInstanceOf(ReferenceNotFoundException.class)
                    .hasMessage("No such flight exists.");

            verify(flightRepository, never()).findContextById(anyLong());
        }
    }

    @Nested
    @DisplayName("exists")
    class Exists {

        @Test
        @DisplayName("dispatches to the repository of each kind")
        void dispatchesPerKind() {
            when(airportRepository.existsById(1L)).thenReturn(true);
            when(itineraryRepository.existsById(1L)).thenReturn(false);
            when(airplaneRepository.existsById(1L)).thenReturn(true);
            when(flightRepository.existsById(1L)).thenReturn(false);
            when(reservationRepository.existsById(1L)).thenReturn(true);

            assertThat(resolver.exists(EntityKind.AIRPORT, 1L)).isTrue();
            assertThat(resolver.exists(EntityKind.ITINERARY, 1L)).isFalse();
            assertThat(resolver.exists(EntityKind.AIRPLANE, 1L)).isTrue();
            assertThat(resolver.exists(EntityKind.FLIGHT, 1L)).isFalse();
            assertThat(resolver.exists(EntityKind.RESERVATION, 1L)).isTrue();
        }

        @Test
        @DisplayName("null id never exists")
        void nullIdNeverExists() {
            assertThat(resolver.exists(EntityKind.FLIGHT, null)).isFalse();
            verify(flightRepository, never()).existsById(anyLong());
        }
    }

    @Nested
    @DisplayName("require")
    class Require {

        @Test
        @DisplayName("names the missing airport in the error")
        void namesMissingAirport() {
            when(airportRepository.findById(7L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resolver.requireAirport(7L, "Origin airport does not exist."))
                    .isInstanceOf(ReferenceNotFoundException.class)
                    .hasMessage("Origin airport does not exist.")
                    .hasFieldOrPropertyWithValue("kind", EntityKind.AIRPORT)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCodes.REFERENCE_NOT_FOUND);
        }

        @Test
        @DisplayName("returns the airplane when present")
        void returnsAirplane() {
            when(airplaneRepository.findById(4L)).thenReturn(Optional.of(AirlineFixtures.airplane(4L, "Skylark", 3)));

            assertThat(resolver.requireAirplane(4L, "Invalid airplane ID.").getName()).isEqualTo("Skylark");
        }

        @Test
        @DisplayName("requireExists fails with the given message for an unknown id")
        void requireExistsRejectsUnknown() {
            when(itineraryRepository.existsById(8L)).thenReturn(false);

            assertThatThrownBy(() -> resolver.requireExists(EntityKind.ITINERARY, 8L, "Invalid itinerary ID."))
                    .isInstanceOf(ReferenceNotFoundException.class)
                    .hasMessage("Invalid itinerary ID.")
                    .hasFieldOrPropertyWithValue("kind", EntityKind.ITINERARY);
        }

        @Test
        @DisplayName("requireExists passes for a known id")
        void requireExistsAcceptsKnown() {
            when(airplaneRepository.existsById(4L)).thenReturn(true);

            assertThatCode(() -> resolver.requireExists(EntityKind.AIRPLANE, 4L, "Invalid airplane ID."))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("lockAirplane reads through the row lock")
        void lockAirplaneUsesRowLock() {
            when(airplaneRepository.findByIdForUpdate(4L))
                    .thenReturn(Optional.of(AirlineFixtures.airplane(4L, "Skylark", 3)));

            assertThat(resolver.lockAirplane(4L, "Invalid airplane ID.").getCapacity()).isEqualTo(3);
            verify(airplaneRepository, never()).findById(anyLong());
        }

        @Test
        @DisplayName("lockAirplane names the missing airplane")
        void lockAirplaneRejectsUnknown() {
            when(airplaneRepository.findByIdForUpdate(5L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resolver.lockAirplane(5L, "Invalid airplane ID."))
                    .isInstanceOf(ReferenceNotFoundException.class)
                    .hasFieldOrPropertyWithValue("kind", EntityKind.AIRPLANE);
        }
    }

    @Nested
    @DisplayName("requireNoDependents")
    class RequireNoDependents {

        @Test
        @DisplayName("blocks flight delete while reservations exist")
        void blocksFlightWithReservations() {
            when(reservationRepository.countByFlightId(10L)).thenReturn(2L);

            assertThatThrownBy(() -> resolver.requireNoDependents(EntityKind.FLIGHT, 10L))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCodes.DEPENDENT_RECORDS_EXIST)
                    .hasMessageContaining("2 reservation");
        }

        @Test
        @DisplayName("counts itineraries at either end of an airport")
        void blocksAirportWithItineraries() {
            when(itineraryRepository.countByAirportId(1L)).thenReturn(1L);

            assertThatThrownBy(() -> resolver.requireNoDependents(EntityKind.AIRPORT, 1L))
                    .isInstanceOf(ConflictException.class)
                    .hasMessageContaining("itinerary");
        }

        @Test
        @DisplayName("allows delete without dependents")
        void allowsWithoutDependents() {
            when(flightRepository.countByAirplaneId(4L)).thenReturn(0L);

            assertThatCode(() -> resolver.requireNoDependents(EntityKind.AIRPLANE, 4L)).doesNotThrowAnyException();
        }
    }
}
