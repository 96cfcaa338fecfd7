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
@JsonPropertyOrder({"ID", "Name", "Model", "Capacity"})
public class AirplaneSummary {

    @JsonProperty("ID")
    Long id;

    @JsonProperty("Name")
    String name;

    @JsonProperty("Model")
    String model;

    @JsonProperty("Capacity")
    Integer capacity;
}
