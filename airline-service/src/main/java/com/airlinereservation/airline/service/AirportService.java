package com.airlinereservation.airline.service;

import com.airlinereservation.airline.constants.ResponseMessages;
import com.airlinereservation.airline.dto.AirportEntry;
import com.airlinereservation.airline.enums.EntityKind;
import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.exception.EntityNotFoundException;
import com.airlinereservation.airline.mapper.AirportMapper;
import com.airlinereservation.airline.model.Airport;
import com.airlinereservation.airline.repository.AirportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class AirportService {

    private final AirportRepository airportRepository;
    private final ReferentialResolver referentialResolver;

    @Transactional
    public AirportEntry createAirport(AirportEntry request) {
        if (airportRepository.existsByName(request.getName())) {
            throw ConflictException.duplicate("name", request.getName(), ResponseMessages.AIRPORT_NAME_EXISTS);
        }

        Airport saved = airportRepository.save(AirportMapper.toEntity(request));
        log.info("Created airport: id={}, name={}", saved.getId(), saved.getName());
        return AirportMapper.toEntry(saved);
    }

    @Transactional
    public AirportEntry updateAirport(Long airportId, AirportEntry request) {
        Airport airport = findAirportOrThrow(airportId);

        if (airportRepository.existsByNameAndIdNot(request.getName(), airportId)) {
            throw ConflictException.duplicate("name", request.getName(), ResponseMessages.AIRPORT_NAME_EXISTS);
        }

        AirportMapper.updateEntity(airport, request);
        Airport saved = airportRepository.save(airport);
        log.info("Updated airport: id={}", airportId);
        return AirportMapper.toEntry(saved);
    }

    @Transactional(readOnly = true)
    public AirportEntry getAirport(Long airportId) {
        return AirportMapper.toEntry(findAirportOrThrow(airportId));
    }

    @Transactional(readOnly = true)
    public List<AirportEntry> getAllAirports() {
        return AirportMapper.toEntryList(airportRepository.findAll(Sort.by("id")));
    }

    @Transactional
    public void deleteAirport(Long airportId) {
        Airport airport = findAirportOrThrow(airportId);
        referentialResolver.requireNoDependents(EntityKind.AIRPORT, airportId);

        airportRepository.delete(airport);
        log.info("Deleted airport: id={}", airportId);
    }

    private Airport findAirportOrThrow(Long airportId) {
        return airportRepository.findById(airportId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.AIRPORT, airportId));
    }
}
