package com.busreservation.reservation.model;

import com.busreservation.reservation.enums.Gender;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

/**
 * One seat on one trip held by one booking.
 *
 * While the claim is active, {@code activeSeatKey} holds {@code tripId:seatNumber} under a
 * unique constraint, so the database itself refuses a second active claim on the same seat.
 * Releasing nulls the key and stamps {@code releasedAt}; the row stays for audit.
 */
@Entity
@Table(name = "seat_claims",
        uniqueConstraints = @UniqueConstraint(name = "uk_seat_claim_active", columnNames = "active_seat_key"),
        indexes = {
                @Index(name = "idx_claim_trip", columnList = "trip_id"),
                @Index(name = "idx_claim_booking", columnList = "booking_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SeatClaim {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "trip_id", nullable = false, length = 36)
    String tripId;

    @Column(name = "seat_number", nullable = false, length = 10)
    String seatNumber;

    @Column(name = "booking_id", nullable = false, length = 36)
    String bookingId;

    @Column(name = "seat_order", nullable = false)
    Integer seatOrder;

    @Column(name = "passenger_name", nullable = false, length = 100)
    String passengerName;

    @Column(name = "passenger_age")
    Integer passengerAge;

    @Enumerated(EnumType.STRING)
    @Column(name = "passenger_gender", columnDefinition = "VARCHAR(10)")
    Gender passengerGender;

    @Column(name = "active_seat_key", length = 50)
    String activeSeatKey;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "released_at")
    LocalDateTime releasedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public static String activeKey(String tripId, String seatNumber) {
        return tripId + ":" + seatNumber;
    }

    public boolean isActive() {
        return releasedAt == null;
    }

    public void release(LocalDateTime when) {
        this.releasedAt = when;
        this.activeSeatKey = null;
    }
}
