package com.airlinereservation.airline.repository;

import com.airlinereservation.airline.model.Reservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    @Query("SELECT COUNT(r) FROM Reservation r WHERE r.flight.id = :flightId")
    long countByFlightId(@Param("flightId") Long flightId);

    @Query("SELECT r FROM Reservation r WHERE r.flight.id = :flightId ORDER BY r.createdAt ASC, r.id ASC")
    List<Reservation> findByFlightIdInCreationOrder(@Param("flightId") Long flightId);

    @Query("SELECT r.flight.id AS flightId, COUNT(r) AS reserved FROM Reservation r " +
            "WHERE r.flight.airplane.id = :airplaneId " +
            "GROUP BY r.flight.id " +
            "ORDER BY COUNT(r) DESC")
    List<FlightReservationCount> countPerFlightForAirplane(@Param("airplaneId") Long airplaneId);
}
