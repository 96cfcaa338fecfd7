package com.airlinereservation.airline.service;

import com.airlinereservation.airline.constants.ResponseMessages;
import com.airlinereservation.airline.dto.ItineraryEntry;
import com.airlinereservation.airline.enums.EntityKind;
import com.airlinereservation.airline.exception.ConflictException;
import com.airlinereservation.airline.exception.EntityNotFoundException;
import com.airlinereservation.airline.mapper.ItineraryMapper;
import com.airlinereservation.airline.model.Airport;
import com.airlinereservation.airline.model.Itinerary;
import com.airlinereservation.airline.repository.ItineraryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ItineraryService {

    private final ItineraryRepository itineraryRepository;
    private final ReferentialResolver referentialResolver;

    @Transactional
    public ItineraryEntry createItinerary(ItineraryEntry request) {
        Airport origin = referentialResolver.requireAirport(
                request.getOriginAirportId(), ResponseMessages.ORIGIN_AIRPORT_MISSING);
        Airport destination = referentialResolver.requireAirport(
                request.getDestinationAirportId(), ResponseMessages.DESTINATION_AIRPORT_MISSING);

        if (itineraryRepository.existsByCode(request.getCode())) {
            throw ConflictException.duplicate("code", request.getCode(), ResponseMessages.ITINERARY_CODE_EXISTS);
        }

        Itinerary saved = itineraryRepository.save(ItineraryMapper.toEntity(request, origin, destination));
        log.info("Created itinerary: id={}, code={}, route={}->{}",
                saved.getId(), saved.getCode(), origin.getName(), destination.getName());
        return ItineraryMapper.toEntry(saved);
    }

    @Transactional
    public ItineraryEntry updateItinerary(Long itineraryId, ItineraryEntry request) {
        Itinerary itinerary = findItineraryOrThrow(itineraryId);

        Airport origin = referentialResolver.requireAirport(
                request.getOriginAirportId(), ResponseMessages.ORIGIN_AIRPORT_MISSING);
        Airport destination = referentialResolver.requireAirport(
                request.getDestinationAirportId(), ResponseMessages.DESTINATION_AIRPORT_MISSING);

        if (itineraryRepository.existsByCodeAndIdNot(request.getCode(), itineraryId)) {
            throw ConflictException.duplicate("code", request.getCode(), ResponseMessages.ITINERARY_CODE_EXISTS);
        }

        ItineraryMapper.updateEntity(itinerary, request, origin, destination);
        Itinerary saved = itineraryRepository.save(itinerary);
        log.info("Updated itinerary: id={}", itineraryId);
        return ItineraryMapper.toEntry(saved);
    }

    @Transactional(readOnly = true)
    public ItineraryEntry getItinerary(Long itineraryId) {
        return ItineraryMapper.toEntry(findItineraryOrThrow(itineraryId));
    }

    @Transactional(readOnly = true)
    public List<ItineraryEntry> getAllItineraries() {
        return ItineraryMapper.toEntryList(itineraryRepository.findAll(Sort.by("id")));
    }

    @Transactional
    public void deleteItinerary(Long itineraryId) {
        Itinerary itinerary = findItineraryOrThrow(itineraryId);
        referentialResolver.requireNoDependents(EntityKind.ITINERARY, itineraryId);

        itineraryRepository.delete(itinerary);
        log.info("Deleted itinerary: id={}", itineraryId);
    }

    private Itinerary findItineraryOrThrow(Long itineraryId) {
        return itineraryRepository.findById(itineraryId)
                .orElseThrow(() -> new EntityNotFoundException(EntityKind.ITINERARY, itineraryId));
    }
}
