package com.airlinereservation.airline.mapper;

import com.airlinereservation.airline.dto.AirportEntry;
import com.airlinereservation.airline.dto.AirportSummary;
import com.airlinereservation.airline.model.Airport;

import java.util.ArrayList;
import java.util.List;

public final class AirportMapper {

    private AirportMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static AirportEntry toEntry(Airport airport) {
        if (airport == null) {
            return null;
        }

        return AirportEntry.builder()
                .id(airport.getId())
                .name(airport.getName())
                .latitude(airport.getLatitude())
                .longitude(airport.getLongitude())
                .timezone(airport.getTimezone())
                .createdAt(airport.getCreatedAt())
                .updatedAt(airport.getUpdatedAt())
                .build();
    }

    public static List<AirportEntry> toEntryList(List<Airport> airports) {
        if (airports == null || airports.isEmpty()) {
            return new ArrayList<>();
        }

        List<AirportEntry> result = new ArrayList<>(airports.size());
        for (Airport airport : airports) {
            result.add(toEntry(airport));
        }
        return result;
    }

    public static AirportSummary toSummary(Airport airport) {
        if (airport == null) {
            return null;
        }

        return AirportSummary.builder()
                .id(airport.getId())
                .name(airport.getName())
                .latitude(airport.getLatitude())
                .longitude(airport.getLongitude())
                .timezone(airport.getTimezone())
                .build();
    }

    public static Airport toEntity(AirportEntry entry) {
        if (entry == null) {
            return null;
        }

        return Airport.builder()
                .name(entry.getName())
                .latitude(entry.getLatitude())
                .longitude(entry.getLongitude())
                .timezone(entry.getTimezone())
                .build();
    }

    public static void updateEntity(Airport airport, AirportEntry entry) {
        if (airport == null || entry == null) {
            return;
        }

        airport.setName(entry.getName());
        airport.setLatitude(entry.getLatitude());
        airport.setLongitude(entry.getLongitude());
        airport.setTimezone(entry.getTimezone());
    }
}
