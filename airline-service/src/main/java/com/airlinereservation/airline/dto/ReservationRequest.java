package com.airlinereservation.airline.dto;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.constants.ValidationMessages;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReservationRequest {

    @NotBlank(message = ValidationMessages.PASSENGER_NAME_REQUIRED)
    @Pattern(regexp = "^\\s*[A-Za-z0-9]+\\s*$", message = ValidationMessages.PASSENGER_NAME_ALPHANUMERIC)
    @Size(min = AirlineConstants.MIN_PASSENGER_NAME_LENGTH, message = ValidationMessages.PASSENGER_NAME_MIN)
    @JsonAlias("PassengerName")
    String passengerName;

    @NotNull(message = ValidationMessages.FLIGHT_ID_REQUIRED)
    @Min(value = AirlineConstants.MIN_ID, message = ValidationMessages.FLIGHT_ID_POSITIVE)
    @JsonAlias({"FlightID", "flightID"})
    Long flightId;
}
