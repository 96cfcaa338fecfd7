package com.airlinereservation.airline.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReservationResponse {

    String message;
    ReservationEntry reservation;

    public static ReservationResponse of(String message, ReservationEntry reservation) {
        return new ReservationResponse(message, reservation);
    }
}
