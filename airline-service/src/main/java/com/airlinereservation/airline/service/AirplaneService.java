package com.airlinereservation.airline.service;

import com.airlinereservation.airline.constants.ResponseMessages;
import com.airlinereservation.airline.dto.AirplaneEntry;
import com.airlinereservation.airline.enums.EntityKind;
import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.exception.EntityNotFoundException;
import com.airlinereservation.airline.mapper.AirplaneMapper;
import com.airlinereservation.airline.model.Airplane;
import com.airlinereservation.airline.repository.AirplaneRepository;
import com.airlinereservation.airline.repository.FlightRepository;
import com.airlinereservation.airline.repository.FlightReservationCount;
import com.airlinereservation.airline.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class AirplaneService {

    private final AirplaneRepository airplaneRepository;
    private final FlightRepository flightRepository;
    private final ReservationRepository reservationRepository;
    private final ReferentialResolver referentialResolver;

    @Transactional
    public AirplaneEntry createAirplane(AirplaneEntry request) {
        if (airplaneRepository.existsByName(request.getName())) {
            throw ConflictException.duplicate("name", request.getName(), ResponseMessages.AIRPLANE_NAME_EXISTS);
        }

        Airplane saved = airplaneRepository.save(AirplaneMapper.toEntity(request));
        log.info("Created airplane: id={}, name={}, capacity={}", saved.getId(), saved.getName(), saved.getCapacity());
        return AirplaneMapper.toEntry(saved);
    }

    @Transactional
    public AirplaneEntry updateAirplane(Long airplaneId, AirplaneEntry request) {
        Airplane airplane = airplaneRepository.findByIdForUpdate(airplaneId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.AIRPLANE, airplaneId));

        if (airplaneRepository.existsByNameAndIdNot(request.getName(), airplaneId)) {
            throw ConflictException.duplicate("name", request.getName(), ResponseMessages.AIRPLANE_NAME_EXISTS);
        }

        if (request.getCapacity() < airplane.getCapacity()) {
            validateCapacityReduction(airplaneId, request.getCapacity());
        }

        AirplaneMapper.updateEntity(airplane, request);
        Airplane saved = airplaneRepository.save(airplane);
        log.info("Updated airplane: id={}, capacity={}", airplaneId, saved.getCapacity());
        return AirplaneMapper.toEntry(saved);
    }

    @Transactional(readOnly = true)
    public AirplaneEntry getAirplane(Long airplaneId) {
        return AirplaneMapper.toEntry(findAirplaneOrThrow(airplaneId));
    }

    @Transactional(readOnly = true)
    public List<AirplaneEntry> getAllAirplanes() {
        return AirplaneMapper.toEntryList(airplaneRepository.findAll(Sort.by("id")));
    }

    @Transactional
    public void deleteAirplane(Long airplaneId) {
        Airplane airplane = findAirplaneOrThrow(airplaneId);
        referentialResolver.requireNoDependents(EntityKind.AIRPLANE, airplaneId);

        airplaneRepository.delete(airplane);
        log.info("Deleted airplane: id={}", airplaneId);
    }

    /**
     * A smaller airplane must still seat everyone already booked on each of its flights.
     * Runs with the airplane row already locked, so no flight can be moved onto it meanwhile.
     * Its flight rows are locked next so no booking lands between the count and the update.
     */
    private void validateCapacityReduction(Long airplaneId, int newCapacity) {
        flightRepository.lockByAirplaneId(airplaneId);

        List<FlightReservationCount> counts = reservationRepository.countPerFlightForAirplane(airplaneId);
        for (FlightReservationCount count : counts) {
            if (count.getReserved() > newCapacity) {
                log.warn("Capacity reduction rejected: airplaneId={}, flightId={}, reserved={}, newCapacity={}",
                        airplaneId, count.getFlightId(), count.getReserved(), newCapacity);
                throw ConflictException.capacityBelowReservations(count.getFlightId(), newCapacity, count.getReserved());
            }
        }
    }

    private Airplane findAirplaneOrThrow(Long airplaneId) {
        return airplaneRepository.findById(airplaneId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.AIRPLANE, airplaneId));
    }
}
