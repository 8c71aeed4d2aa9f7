package com.busreservation.reservation.event;

import com.busreservation.reservation.enums.CancellationActor;
import com.busreservation.reservation.model.Booking;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.math.BigDecimal;

/**
 * Published when a booking is created or cancelled. Carries a snapshot of the
 * booking so listeners never touch the live entity.
 */
@Getter
public class BookingLifecycleEvent extends ApplicationEvent {

    private final String bookingId;
    private final String userId;
    private final String tripId;
    private final int seatCount;
    private final BigDecimal totalAmount;
    private final BigDecimal refundAmount;
    private final CancellationActor cancelledBy;
    private final ChangeType changeType;

    private BookingLifecycleEvent(Object source, Booking booking, ChangeType changeType) {
        super(source);
        this.bookingId = booking.getBookingId();
        this.userId = booking.getUserId();
        this.tripId = booking.getTripId();
        this.seatCount = booking.getSeatCount();
        this.totalAmount = booking.getTotalAmount();
        this.refundAmount = booking.getRefundAmount();
        this.cancelledBy = booking.getCancelledBy();
        this.changeType = changeType;
    }

    public static BookingLifecycleEvent created(Object source, Booking booking) {
        return new BookingLifecycleEvent(source, booking, ChangeType.CREATED);
    }

    public static BookingLifecycleEvent cancelled(Object source, Booking booking) {
        return new BookingLifecycleEvent(source, booking, ChangeType.CANCELLED);
    }

    public enum ChangeType {
        CREATED,
        CANCELLED
    }
}
