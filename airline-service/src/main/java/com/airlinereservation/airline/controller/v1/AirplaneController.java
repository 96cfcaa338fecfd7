package com.airlinereservation.airline.controller.v1;

import com.airlinereservation.airline.dto.AirplaneEntry;
import com.airlinereservation.airline.service.AirplaneService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/airplanes")
@RequiredArgsConstructor
@Slf4j
public class AirplaneController {

    private final AirplaneService airplaneService;

    @PostMapping
    public ResponseEntity<AirplaneEntry> create(@Valid @RequestBody AirplaneEntry request) {
        log.info("POST /api/v1/airplanes - name={}, capacity={}", request.getName(), request.getCapacity());
        return ResponseEntity.status(HttpStatus.CREATED).body(airplaneService.createAirplane(request));
    }

    @GetMapping
    public ResponseEntity<List<AirplaneEntry>> findAll() {
        log.debug("GET /api/v1/airplanes");
        return ResponseEntity.ok(airplaneService.getAllAirplanes());
    }

    @GetMapping("/{airplaneId}")
    public ResponseEntity<AirplaneEntry> findById(@PathVariable Long airplaneId) {
        log.debug("GET /api/v1/airplanes/{}", airplaneId);
        return ResponseEntity.ok(airplaneService.getAirplane(airplaneId));
    }

    @PutMapping("/{airplaneId}")
    public ResponseEntity<AirplaneEntry> update(@PathVariable Long airplaneId, @Valid @RequestBody AirplaneEntry request) {
        log.info("PUT /api/v1/airplanes/{}", airplaneId);
        return ResponseEntity.ok(airplaneService.updateAirplane(airplaneId, request));
    }

    @DeleteMapping("/{airplaneId}")
    public ResponseEntity<Void> delete(@PathVariable Long airplaneId) {
        log.info("DELETE /api/v1/airplanes/{}", airplaneId);
        airplaneService.deleteAirplane(airplaneId);
        return ResponseEntity.noContent().build();
    }
}
