package com.busreservation.reservation.exception;

import lombok.Getter;

@Getter
public class BookingNotFoundException extends ReservationException {

    private static final String ERROR_CODE = "BOOKING_NOT_FOUND";

    private final String bookingId;

    public BookingNotFoundException(String bookingId) {
        super(ERROR_CODE, "Booking not found: " + bookingId);
        this.bookingId = bookingId;
    }
}
