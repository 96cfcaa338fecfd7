package com.airlinereservation.airline.mapper;

import com.airlinereservation.airline.dto.AirplaneEntry;
import com.airlinereservation.airline.dto.AirplaneSummary;
import com.airlinereservation.airline.model.Airplane;

import java.util.ArrayList;
import java.util.List;

public final class AirplaneMapper {

    private AirplaneMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static AirplaneEntry toEntry(Airplane airplane) {
        if (airplane == null) {
            return null;
        }

        return AirplaneEntry.builder()
                .id(airplane.getId())
                .name(airplane.getName())
                .model(airplane.getModel())
                .capacity(airplane.getCapacity())
                .createdAt(airplane.getCreatedAt())
                .updatedAt(airplane.getUpdatedAt())
                .build();
    }

    public static List<AirplaneEntry> toEntryList(List<Airplane> airplanes) {
        if (airplanes == null || airplanes.isEmpty()) {
            return new ArrayList<>();
        }

        List<AirplaneEntry> result = new ArrayList<>(airplanes.size());
        for (Airplane airplane : airplanes) {
            result.add(toEntry(airplane));
        }
        return result;
    }

    public static AirplaneSummary toSummary(Airplane airplane) {
        if (airplane == null) {
            return null;
        }

        return AirplaneSummary.builder()
                .id(airplane.getId())
                .name(airplane.getName())
                .model(airplane.getModel())
                .capacity(airplane.getCapacity())
                .build();
    }

    public static Airplane toEntity(AirplaneEntry entry) {
        if (entry == null) {
            return null;
        }

        return Airplane.builder()
                .name(entry.getName())
                .model(entry.getModel())
                .capacity(entry.getCapacity())
                .build();
    }

    public static void updateEntity(Airplane airplane, AirplaneEntry entry) {
        if (airplane == null || entry == null) {
            return;
        }

        airplane.setName(entry.getName());
        airplane.setModel(entry.getModel());
        airplane.setCapacity(entry.getCapacity());
    }
}
