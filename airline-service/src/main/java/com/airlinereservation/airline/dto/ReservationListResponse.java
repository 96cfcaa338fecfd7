package com.airlinereservation.airline.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReservationListResponse {

    String message;
    List<ReservationEntry> reservations;

    public static ReservationListResponse of(String message, List<ReservationEntry> reservations) {
        return new ReservationListResponse(message, reservations);
    }
}
