package com.airlinereservation.airline.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightFilterCriteria {

    Long airplaneId;
    Long itineraryId;
    LocalDateTime arrivesBefore;
}
