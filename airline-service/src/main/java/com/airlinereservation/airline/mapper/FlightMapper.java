package com.airlinereservation.airline.mapper;

import com.airlinereservation.airline.dto.FlightEntry;
import com.airlinereservation.airline.dto.FlightSummary;
import com.airlinereservation.airline.model.Airplane;
import com.airlinereservation.airline.model.Flight;
import com.airlinereservation.airline.model.FlightContext;
import com.airlinereservation.airline.model.Itinerary;

import java.util.ArrayList;
import java.util.List;

public final class FlightMapper {

    private FlightMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static FlightEntry toEntry(Flight flight) {
        if (flight == null) {
            return null;
        }

        return FlightEntry.builder()
                .id(flight.getId())
                .itineraryId(flight.getItinerary() != null ? flight.getItinerary().getId() : null)
                .departureTime(flight.getDepartureTime())
                .arrivalTime(flight.getArrivalTime())
                .airplaneId(flight.getAirplane() != null ? flight.getAirplane().getId() : null)
                .createdAt(flight.getCreatedAt())
                .updatedAt(flight.getUpdatedAt())
                .build();
    }

    public static List<FlightEntry> toEntryList(List<Flight> flights) {
        if (flights == null || flights.isEmpty()) {
            return new ArrayList<>();
        }

        List<FlightEntry> result = new ArrayList<>(flights.size());
        for (Flight flight : flights) {
            result.add(toEntry(flight));
        }
        return result;
    }

    public static FlightSummary toSummary(FlightContext context) {
        if (context == null) {
            return null;
        }

        Flight flight = context.flight();
        return FlightSummary.builder()
                .id(flight.getId())
                .departureTime(flight.getDepartureTime())
                .arrivalTime(flight.getArrivalTime())
                .itinerary(ItineraryMapper.toSummary(
                        context.itinerary(), context.originAirport(), context.destinationAirport()))
                .airplane(AirplaneMapper.toSummary(context.airplane()))
                .build();
    }

    public static Flight toEntity(FlightEntry entry, Itinerary itinerary, Airplane airplane) {
        if (entry == null) {
            return null;
        }

        return Flight.builder()
                .itinerary(itinerary)
                .departureTime(entry.getDepartureTime())
                .arrivalTime(entry.getArrivalTime())
                .airplane(airplane)
                .build();
    }

    public static void updateEntity(Flight flight, FlightEntry entry, Itinerary itinerary, Airplane airplane) {
        if (flight == null || entry == null) {
            return;
        }

        flight.setItinerary(itinerary);
        flight.setDepartureTime(entry.getDepartureTime());
        flight.setArrivalTime(entry.getArrivalTime());
        flight.setAirplane(airplane);
    }
}
