package com.airlinereservation.airline.dto;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.constants.ValidationMessages;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
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
public class AirportEntry {

    Long id;

    @NotBlank(message = ValidationMessages.AIRPORT_NAME_REQUIRED)
    @Pattern(regexp = AirlineConstants.ALPHANUMERIC_PATTERN, message = ValidationMessages.AIRPORT_NAME_ALPHANUMERIC)
    String name;

    @NotNull(message = ValidationMessages.LATITUDE_REQUIRED)
    @DecimalMin(value = "-90.0", message = ValidationMessages.LATITUDE_INVALID)
    @DecimalMax(value = "90.0", message = ValidationMessages.LATITUDE_INVALID)
    Double latitude;

    @NotNull(message = ValidationMessages.LONGITUDE_REQUIRED)
    @DecimalMin(value = "-180.0", message = ValidationMessages.LONGITUDE_INVALID)
    @DecimalMax(value = "180.0", message = ValidationMessages.LONGITUDE_INVALID)
    Double longitude;

    @NotBlank(message = ValidationMessages.TIMEZONE_REQUIRED)
    @Pattern(regexp = AirlineConstants.TIMEZONE_PATTERN, message = ValidationMessages.TIMEZONE_INVALID)
    String timezone;

    LocalDateTime createdAt;

    LocalDateTime updatedAt;
}
