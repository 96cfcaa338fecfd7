package com.airlinereservation.airline.controller.v1;

import com.airlinereservation.airline.dto.AirportEntry;
import com.airlinereservation.airline.service.AirportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/airports")
@RequiredArgsConstructor
@Slf4j
public class AirportController {

    private final AirportService airportService;

    @PostMapping
    public ResponseEntity<AirportEntry> create(@Valid @RequestBody AirportEntry request) {
        log.info("POST /api/v1/airports - name={}", request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(airportService.createAirport(request));
    }

    @GetMapping
    public ResponseEntity<List<AirportEntry>> findAll() {
        log.debug("GET /api/v1/airports");
        return ResponseEntity.ok(airportService.getAllAirports());
    }

    @GetMapping("/{airportId}")
    public ResponseEntity<AirportEntry> findById(@PathVariable Long airportId) {
        log.debug("GET /api/v1/airports/{}", airportId);
        return ResponseEntity.ok(airportService.getAirport(airportId));
    }

    @PutMapping("/{airportId}")
    public ResponseEntity<AirportEntry> update(@PathVariable Long airportId, @Valid @RequestBody AirportEntry request) {
        log.info("PUT /api/v1/airports/{}", airportId);
        return ResponseEntity.ok(airportService.updateAirport(airportId, request));
    }

    @DeleteMapping("/{airportId}")
    public ResponseEntity<Void> delete(@PathVariable Long airportId) {
        log.info("DELETE /api/v1/airports/{}", airportId);
        airportService.deleteAirport(airportId);
        return ResponseEntity.noContent().build();
    }
}
