package com.busreservation.reservation.mapper;

import com.busreservation.reservation.dto.BookingEntry;
import com.busreservation.reservation.dto.CancellationResponse;
import com.busreservation.reservation.dto.SeatEntry;
import com.busreservation.reservation.model.Booking;
import com.busreservation.reservation.model.SeatClaim;

import java.util.List;

public final class BookingMapper {

    private BookingMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static BookingEntry toEntry(Booking booking, List<SeatClaim> claims) {
        return BookingEntry.builder()
                .bookingId(booking.getBookingId())
                .userId(booking.getUserId())
                .tripId(booking.getTripId())
                .seats(claims.stream().map(BookingMapper::toSeatEntry).toList())
                .seatCount(booking.getSeatCount())
                .totalAmount(booking.getTotalAmount())
                .status(booking.getStatus().name())
                .canCancel(booking.getCanCancel())
                .cancelledAt(booking.getCancelledAt())
                .refundAmount(booking.getRefundAmount())
                .cancelledBy(booking.getCancelledBy() != null ? booking.getCancelledBy().name() : null)
                .createdAt(booking.getCreatedAt())
                .build();
    }

    public static SeatEntry toSeatEntry(SeatClaim claim) {
        return SeatEntry.builder()
                .seatNumber(claim.getSeatNumber())
                .passengerName(claim.getPassengerName())
                .passengerAge(claim.getPassengerAge())
                .passengerGender(claim.getPassengerGender() != null ? claim.getPassengerGender().name() : null)
                .build();
    }

    public static CancellationResponse toCancellation(Booking booking, int seatsReleased) {
        return CancellationResponse.builder()
                .bookingId(booking.getBookingId())
                .status(booking.getStatus().name())
                .refundAmount(booking.getRefundAmount())
                .cancelledBy(booking.getCancelledBy() != null ? booking.getCancelledBy().name() : null)
                .cancelledAt(booking.getCancelledAt())
                .seatsReleased(seatsReleased)
                .build();
    }
}
