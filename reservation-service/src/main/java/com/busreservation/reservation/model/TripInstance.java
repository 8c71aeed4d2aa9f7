package com.busreservation.reservation.model;

import com.busreservation.reservation.enums.TripStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Entity
@Table(name = "trip_instances", indexes = {
        @Index(name = "idx_trip_route_date", columnList = "origin, destination, service_date"),
        @Index(name = "idx_trip_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TripInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    Long id;

    @Column(name = "trip_id", length = 36, unique = true, nullable = false)
    String tripId;

    @Column(name = "bus_id", nullable = false, length = 36)
    String busId;

    @Column(name = "route_id", nullable = false, length = 36)
    String routeId;

    @Column(name = "operator_id", length = 36)
    String operatorId;

    @Column(name = "bus_number", length = 30)
    String busNumber;

    @Column(name = "origin", nullable = false, length = 100)
    String origin;

    @Column(name = "destination", nullable = false, length = 100)
    String destination;

    @Column(name = "service_date", nullable = false)
    LocalDate serviceDate;

    @Column(name = "departure_time", nullable = false)
    LocalTime departureTime;

    @Column(name = "arrival_time", nullable = false)
    LocalTime arrivalTime;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    BigDecimal price;

    @Column(name = "total_seats", nullable = false)
    Integer totalSeats;

    @Column(name = "available_seats", nullable = false)
    Integer availableSeats;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "VARCHAR(20)")
    @Builder.Default
    TripStatus status = TripStatus.SCHEDULED;

    @Version
    @Column(name = "version")
    Long version;

    @Column(name = "cancelled_at")
    LocalDateTime cancelledAt;

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

    public LocalDateTime departureDateTime() {
        return serviceDate.atTime(departureTime);
    }

    /**
     * An arrival time-of-day earlier than departure means the trip arrives the next day.
     */
    public LocalDateTime arrivalDateTime() {
        LocalDateTime arrival = serviceDate.atTime(arrivalTime);
        return arrivalTime.isBefore(departureTime) ? arrival.plusDays(1) : arrival;
    }

    public boolean isCancelled() {
        return status == TripStatus.CANCELLED;
    }
}
