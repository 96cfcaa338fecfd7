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
@JsonPropertyOrder({"ID", "Name", "Latitude", "Longitude", "Timezone"})
public class AirportSummary {

    @JsonProperty("ID")
    Long id;

    @JsonProperty("Name")
    String name;

    @JsonProperty("Latitude")
    Double latitude;

    @JsonProperty("Longitude")
    Double longitude;

    @JsonProperty("Timezone")
    String timezone;
}
