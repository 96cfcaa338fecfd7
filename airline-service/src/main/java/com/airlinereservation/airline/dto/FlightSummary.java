package com.airlinereservation.airline.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonPropertyOrder({"ID", "DepartureTime", "ArrivalTime", "Itinerary", "Airplane"})
public class FlightSummary {

    @JsonProperty("ID")
    Long id;

    @JsonProperty("DepartureTime")
    LocalDateTime departureTime;

    @JsonProperty("ArrivalTime")
    LocalDateTime arrivalTime;

    @JsonProperty("Itinerary")
    ItinerarySummary itinerary;

    @JsonProperty("Airplane")
    AirplaneSummary airplane;
}
