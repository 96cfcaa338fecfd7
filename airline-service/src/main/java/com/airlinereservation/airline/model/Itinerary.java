package com.airlinereservation.airline.model;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Entity
@Table(name = "itineraries", indexes = {
        @Index(name = "idx_itinerary_origin", columnList = "origin_airport_id"),
        @Index(name = "idx_itinerary_destination", columnList = "destination_airport_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Itinerary {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    Long id;

    @Column(name = "code", nullable = false, unique = true, length = 50)
    String code;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "origin_airport_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_itinerary_origin_airport"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Airport originAirport;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "destination_airport_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_itinerary_destination_airport"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Airport destinationAirport;

    @Column(name = "duration_minutes", nullable = false)
    Integer durationMinutes;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
