package com.airlinereservation.airline.dto;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.constants.ValidationMessages;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ItineraryEntry {

    Long id;

    @NotBlank(message = ValidationMessages.CODE_REQUIRED)
    @Pattern(regexp = AirlineConstants.ALPHANUMERIC_PATTERN, message = ValidationMessages.CODE_ALPHANUMERIC)
    String code;

    @NotNull(message = ValidationMessages.ORIGIN_AIRPORT_REQUIRED)
    @Min(value = AirlineConstants.MIN_ID, message = ValidationMessages.ORIGIN_AIRPORT_POSITIVE)
    Long originAirportId;

    @NotNull(message = ValidationMessages.DESTINATION_AIRPORT_REQUIRED)
    @Min(value = AirlineConstants.MIN_ID, message = ValidationMessages.DESTINATION_AIRPORT_POSITIVE)
    Long destinationAirportId;

    @NotNull(message = ValidationMessages.DURATION_REQUIRED)
    @Min(value = AirlineConstants.MIN_DURATION_MINUTES, message = ValidationMessages.DURATION_MIN)
    @JsonAlias("duration")
    Integer durationMinutes;

    LocalDateTime createdAt;

    LocalDateTime updatedAt;
}
