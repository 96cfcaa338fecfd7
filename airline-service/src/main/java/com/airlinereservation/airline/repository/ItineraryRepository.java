package com.airlinereservation.airline.repository;

import com.airlinereservation.airline.model.Itinerary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ItineraryRepository extends JpaRepository<Itinerary, Long> {

    boolean existsByCode(String code);

    boolean existsByCodeAndIdNot(String code, Long id);

    @Query("SELECT COUNT(i) FROM Itinerary i " +
            "WHERE i.originAirport.id = :airportId OR i.destinationAirport.id = :airportId")
    long countByAirportId(@Param("airportId") Long airportId);
}
