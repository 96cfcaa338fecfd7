package com.airlinereservation.airline.controller.v1;

import com.airlinereservation.airline.dto.FlightEntry;
import com.airlinereservation.airline.dto.FlightFilterCriteria;
import com.airlinereservation.airline.service.FlightService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/flights")
@RequiredArgsConstructor
@Slf4j
public class FlightController {

    private final FlightService flightService;

    @PostMapping
    public ResponseEntity<FlightEntry> create(@Valid @RequestBody FlightEntry request) {
        log.info("POST /api/v1/flights - itinerary={}, airplane={}, departure={}",
                request.getItineraryId(), request.getAirplaneId(), request.getDepartureTime());
        return ResponseEntity.status(HttpStatus.CREATED).body(flightService.createFlight(request));
    }

    @GetMapping
    public ResponseEntity<List<FlightEntry>> search(
            @RequestParam(required = false) Long airplaneId,
            @RequestParam(required = false) Long itineraryId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime arrivesBefore) {

        log.debug("GET /api/v1/flights - airplaneId={}, itineraryId={}, arrivesBefore={}",
                airplaneId, itineraryId, arrivesBefore);

        FlightFilterCriteria criteria = FlightFilterCriteria.builder()
                .airplaneId(airplaneId)
                .itineraryId(itineraryId)
                .arrivesBefore(arrivesBefore)
                .build();

        return ResponseEntity.ok(flightService.findFlights(criteria));
    }

    @GetMapping("/{flightId}")
    public ResponseEntity<FlightEntry> findById(@PathVariable Long flightId) {
        log.debug("GET /api/v1/flights/{}", flightId);
        return ResponseEntity.ok(flightService.getFlight(flightId));
    }

    @PutMapping("/{flightId}")
    public ResponseEntity<FlightEntry> update(@PathVariable Long flightId, @Valid @RequestBody FlightEntry request) {
        log.info("PUT /api/v1/flights/{}", flightId);
        return ResponseEntity.ok(flightService.updateFlight(flightId, request));
    }

    @DeleteMapping("/{flightId}")
    public ResponseEntity<Void> delete(@PathVariable Long flightId) {
        log.info("DELETE /api/v1/flights/{}", flightId);
        flightService.deleteFlight(flightId);
        return ResponseEntity.noContent().build();
    }
}
