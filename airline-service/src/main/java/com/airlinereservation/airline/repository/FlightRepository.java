package com.airlinereservation.airline.repository;

import com.airlinereservation.airline.model.Flight;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FlightRepository extends JpaRepository<Flight, Long>, JpaSpecificationExecutor<Flight> {

    @Query("SELECT f FROM Flight f " +
            "JOIN FETCH f.itinerary i " +
            "JOIN FETCH i.originAirport " +
            "JOIN FETCH i.destinationAirport " +
            "JOIN FETCH f.airplane " +
            "WHERE f.id = :flightId")
    Optional<Flight> findContextById(@Param("flightId") Long flightId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM Flight f WHERE f.id = :flightId")
    Optional<Flight> findByIdForUpdate(@Param("flightId") Long flightId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM Flight f WHERE f.airplane.id = :airplaneId ORDER BY f.id")
    List<Flight> lockByAirplaneId(@Param("airplaneId") Long airplaneId);

    long countByItineraryId(Long itineraryId);

    long countByAirplaneId(Long airplaneId);
}
