package com.airlinereservation.airline.mapper;

import com.airlinereservation.airline.dto.ItineraryEntry;
import com.airlinereservation.airline.dto.ItinerarySummary;
import com.airlinereservation.airline.model.Airport;
import com.airlinereservation.airline.model.Itinerary;

import java.util.ArrayList;
import java.util.List;

public final class ItineraryMapper {

    private ItineraryMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ItineraryEntry toEntry(Itinerary itinerary) {
        if (itinerary == null) {
            return null;
        }

        return ItineraryEntry.builder()
                .id(itinerary.getId())
                .code(itinerary.getCode())
                .originAirportId(itinerary.getOriginAirport() != null ? itinerary.getOriginAirport().getId() : null)
                .destinationAirportId(itinerary.getDestinationAirport() != null
                        ? itinerary.getDestinationAirport().getId() : null)
                .durationMinutes(itinerary.getDurationMinutes())
                .createdAt(itinerary.getCreatedAt())
                .updatedAt(itinerary.getUpdatedAt())
                .build();
    }

    public static List<ItineraryEntry> toEntryList(List<Itinerary> itineraries) {
        if (itineraries == null || itineraries.isEmpty()) {
            return new ArrayList<>();
        }

        List<ItineraryEntry> result = new ArrayList<>(itineraries.size());
        for (Itinerary itinerary : itineraries) {
            result.add(toEntry(itinerary));
        }
        return result;
    }

    public static ItinerarySummary toSummary(Itinerary itinerary, Airport origin, Airport destination) {
        if (itinerary == null) {
            return null;
        }

        return ItinerarySummary.builder()
                .id(itinerary.getId())
                .code(itinerary.getCode())
                .originAirport(AirportMapper.toSummary(origin))
                .destinationAirport(AirportMapper.toSummary(destination))
                .durationMinutes(itinerary.getDurationMinutes())
                .build();
    }

    public static Itinerary toEntity(ItineraryEntry entry, Airport origin, Airport destination) {
        if (entry == null) {
            return null;
        }

        return Itinerary.builder()
                .code(entry.getCode())
                .originAirport(origin)
                .destinationAirport(destination)
                .durationMinutes(entry.getDurationMinutes())
                .build();
    }

    public static void updateEntity(Itinerary itinerary, ItineraryEntry entry, Airport origin, Airport destination) {
        if (itinerary == null || entry == null) {
            return;
        }

        itinerary.setCode(entry.getCode());
        itinerary.setOriginAirport(origin);
        itinerary.setDestinationAirport(destination);
        itinerary.setDurationMinutes(entry.getDurationMinutes());
    }
}
