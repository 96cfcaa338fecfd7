package com.airlinereservation.airline.controller.v1;

import com.airlinereservation.airline.constants.AirlineConstants;
import com.airlinereservation.airline.constants.ResponseMessages;
import com.airlinereservation.airline.constants.ValidationMessages;
import com.airlinereservation.airline.dto.CancelReservationRequest;
import com.airlinereservation.airline.dto.ReservationEntry;
import com.airlinereservation.airline.dto.ReservationListResponse;
import com.airlinereservation.airline.dto.ReservationRequest;
import com.airlinereservation.airline.dto.ReservationResponse;
import com.airlinereservation.airline.service.BookingService;
import com.airlinereservation.airline.validator.ReservationValidator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
@Slf4j
public class ReservationController {

    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<ReservationResponse> create(@Valid @RequestBody ReservationRequest request) {
        log.info("POST /api/v1/reservations - flightId={}", request.getFlightId());

        ReservationEntry entry = bookingService.book(request);
        return ResponseEntity.ok(ReservationResponse.of(ResponseMessages.RESERVATION_CREATED, entry));
    }

    @GetMapping("/flight/{flightId}")
    public ResponseEntity<ReservationListResponse> findByFlight(
            @PathVariable @Min(value = AirlineConstants.MIN_ID, message = ValidationMessages.FLIGHT_ID_POSITIVE)
            Long flightId) {
        log.debug("GET /api/v1/reservations/flight/{}", flightId);

        List<ReservationEntry> reservations = bookingService.listReservationsForFlight(flightId);
        return ResponseEntity.ok(ReservationListResponse.of(ResponseMessages.RESERVATIONS_RETRIEVED, reservations));
    }

    @GetMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> findById(
            @PathVariable @Min(value = AirlineConstants.MIN_ID, message = ValidationMessages.ID_POSITIVE)
            Long reservationId) {
        log.debug("GET /api/v1/reservations/{}", reservationId);

        ReservationEntry entry = bookingService.getReservation(reservationId);
        return ResponseEntity.ok(ReservationResponse.of(ResponseMessages.RESERVATION_RETRIEVED, entry));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> cancel(@RequestBody(required = false) CancelReservationRequest request) {
        Long reservationId = ReservationValidator.validateCancelRequest(request);
        log.info("DELETE /api/v1/reservations - reservationId={}", reservationId);

        bookingService.cancel(reservationId);
        return ResponseEntity.ok(Map.of("message", ResponseMessages.RESERVATION_DELETED));
    }
}
