package com.airlinereservation.airline.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonPropertyOrder({"ID", "Code", "OriginAirport", "DestinationAirport", "DurationMinutes"})
public class ItinerarySummary {

    @JsonProperty("ID")
    Long id;

    @JsonProperty("Code")
    String code;

    @JsonProperty("OriginAirport")
    AirportSummary originAirport;

    @JsonProperty("DestinationAirport")
    AirportSummary destinationAirport;

    @JsonProperty("DurationMinutes")
    Integer durationMinutes;
}
