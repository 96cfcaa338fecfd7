package com.airlinereservation.airline.controller.v1;

import com.airlinereservation.airline.dto.ItineraryEntry;
import com.airlinereservation.airline.service.ItineraryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/itineraries")
@RequiredArgsConstructor
@Slf4j
public class ItineraryController {

    private final ItineraryService itineraryService;

    @PostMapping
    public ResponseEntity<ItineraryEntry> create(@Valid @RequestBody ItineraryEntry request) {
        log.info("POST /api/v1/itineraries - code={}, origin={}, destination={}",
                request.getCode(), request.getOriginAirportId(), request.getDestinationAirportId());
        return ResponseEntity.status(HttpStatus.CREATED).body(itineraryService.createItinerary(request));
    }

    @GetMapping
    public ResponseEntity<List<ItineraryEntry>> findAll() {
        log.debug("GET /api/v1/itineraries");
        return ResponseEntity.ok(itineraryService.getAllItineraries());
    }

    @GetMapping("/{itineraryId}")
    public ResponseEntity<ItineraryEntry> findById(@PathVariable Long itineraryId) {
        log.debug("GET /api/v1/itineraries/{}", itineraryId);
        return ResponseEntity.ok(itineraryService.getItinerary(itineraryId));
    }

    @PutMapping("/{itineraryId}")
    public ResponseEntity<ItineraryEntry> update(@PathVariable Long itineraryId, @Valid @RequestBody ItineraryEntry request) {
        log.info("PUT /api/v1/itineraries/{}", itineraryId);
        return ResponseEntity.ok(itineraryService.updateItinerary(itineraryId, request));
    }

    @DeleteMapping("/{itineraryId}")
    public ResponseEntity<Void> delete(@PathVariable Long itineraryId) {
        log.info("DELETE /api/v1/itineraries/{}", itineraryId);
        itineraryService.deleteItinerary(itineraryId);
        return ResponseEntity.noContent().build();
    }
}
