package com.airlinereservation.airline.dto;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.constants.ValidationMessages;
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
public class AirplaneEntry {

    Long id;

    @NotBlank(message = ValidationMessages.AIRPLANE_NAME_REQUIRED)
    @Pattern(regexp = AirlineConstants.ALPHANUMERIC_PATTERN, message = ValidationMessages.AIRPLANE_NAME_ALPHANUMERIC)
    String name;

    @NotBlank(message = ValidationMessages.MODEL_REQUIRED)
    @Pattern(regexp = AirlineConstants.ALPHANUMERIC_PATTERN, message = ValidationMessages.MODEL_ALPHANUMERIC)
    String model;

    @NotNull(message = ValidationMessages.CAPACITY_REQUIRED)
    @Min(value = AirlineConstants.MIN_CAPACITY, message = ValidationMessages.CAPACITY_MIN)
    Integer capacity;

    LocalDateTime createdAt;

    LocalDateTime updatedAt;
}
