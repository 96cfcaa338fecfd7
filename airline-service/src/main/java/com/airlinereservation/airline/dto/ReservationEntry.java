package com.airlinereservation.airline.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

/**
 * Reservation confirmation format. Every booking and every listing returns this
 * shape, with the flight chain fully denormalized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonPropertyOrder({"ID", "PassengerName", "Flight", "updatedAt", "createdAt"})
public class ReservationEntry {

    @JsonProperty("ID")
    Long id;

    @JsonProperty("PassengerName")
    String passengerName;

    @JsonProperty("Flight")
    FlightSummary flight;

    LocalDateTime updatedAt;

    LocalDateTime createdAt;
}
