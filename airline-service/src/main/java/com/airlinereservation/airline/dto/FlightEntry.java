package com.airlinereservation.airline.dto;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.constants.ValidationMessages;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightEntry {

    Long id;

    @NotNull(message = ValidationMessages.ITINERARY_ID_REQUIRED)
    @Min(value = AirlineConstants.MIN_ID, message = ValidationMessages.ITINERARY_ID_POSITIVE)
    Long itineraryId;

    @NotNull(message = ValidationMessages.DEPARTURE_TIME_REQUIRED)
    LocalDateTime departureTime;

    @NotNull(message = ValidationMessages.ARRIVAL_TIME_REQUIRED)
    LocalDateTime arrivalTime;

    @NotNull(message = ValidationMessages.AIRPLANE_ID_REQUIRED)
    @Min(value = AirlineConstants.MIN_ID, message = ValidationMessages.AIRPLANE_ID_POSITIVE)
    Long airplaneId;

    LocalDateTime createdAt;

    LocalDateTime updatedAt;
}
