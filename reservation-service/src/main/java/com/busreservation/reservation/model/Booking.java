package com.busreservation.reservation.model;

import com.busreservation.reservation.enums.BookingStatus;
import com.busreservation.reservation.enums.CancellationActor;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_booking_user", columnList = "user_id"),
        @Index(name = "idx_booking_trip_status", columnList = "trip_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Booking {

    @Id
    @Column(name = "booking_id", length = 36)
    String bookingId;

    @Column(name = "user_id", nullable = false, length = 36)
    String userId;

    @Column(name = "trip_id", nullable = false, length = 36)
    String tripId;

    @Column(name = "seat_count", nullable = false)
    Integer seatCount;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "VARCHAR(20)")
    @Builder.Default
    BookingStatus status = BookingStatus.CONFIRMED;

    @Column(name = "can_cancel", nullable = false)
    Boolean canCancel;

    @Column(name = "cancelled_at")
    LocalDateTime cancelledAt;

    @Column(name = "refund_amount", precision = 10, scale = 2)
    BigDecimal refundAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", columnDefinition = "VARCHAR(20)")
    CancellationActor cancelledBy;

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

    public boolean isConfirmed() {
        return status == BookingStatus.CONFIRMED;
    }

    /**
     * Confirmed -> Cancelled. The refund is recorded here and nowhere else.
     */
    public void cancel(CancellationActor actor, BigDecimal refund, LocalDateTime when) {
        if (!isConfirmed()) {
            throw new IllegalStateException("Booking " + bookingId + " is " + status + ", cannot cancel");
        }
        this.status = BookingStatus.CANCELLED;
        this.cancelledBy = actor;
        this.refundAmount = refund;
        this.cancelledAt = when;
    }

    public void complete() {
        if (isConfirmed()) {
            this.status = BookingStatus.COMPLETED;
        }
    }
}
