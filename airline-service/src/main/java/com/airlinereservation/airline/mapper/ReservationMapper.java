package com.airlinereservation.airline.mapper;

import com.airlinereservation.airline.dto.FlightSummary;
import com.airlinereservation.airline.dto.ReservationEntry;
import com.airlinereservation.airline.model.Allocation;
import com.airlinereservation.airline.model.FlightContext;
import com.airlinereservation.airline.model.Reservation;

import java.util.ArrayList;
import java.util.List;

/**
 * Shapes reservations into the denormalized confirmation format: the flight, its itinerary
 * with both airports, and the airplane are embedded in every entry.
 */
public final class ReservationMapper {

    private ReservationMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ReservationEntry toEntry(Allocation allocation) {
        return toEntry(allocation.reservation(), allocation.context());
    }

    public static ReservationEntry toEntry(Reservation reservation, FlightContext context) {
        if (reservation == null) {
            return null;
        }

        return toEntry(reservation, FlightMapper.toSummary(context));
    }

    /**
     * Maps every reservation of one flight against a single context.
     */
    public static List<ReservationEntry> toEntryList(List<Reservation> reservations, FlightContext context) {
        if (reservations == null || reservations.isEmpty()) {
            return new ArrayList<>();
        }

        FlightSummary flight = FlightMapper.toSummary(context);
        List<ReservationEntry> result = new ArrayList<>(reservations.size());
        for (Reservation reservation : reservations) {
            result.add(toEntry(reservation, flight));
        }
        return result;
    }

    private static ReservationEntry toEntry(Reservation reservation, FlightSummary flight) {
        return ReservationEntry.builder()
                .id(reservation.getId())
                .passengerName(reservation.getPassengerName())
                .flight(flight)
                .updatedAt(reservation.getUpdatedAt())
                .createdAt(reservation.getCreatedAt())
                .build();
    }
}
