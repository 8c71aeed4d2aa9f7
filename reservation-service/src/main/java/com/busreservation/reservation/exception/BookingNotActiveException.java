package com.busreservation.reservation.exception;

import com.busreservation.reservation.enums.BookingStatus;

/**
 * Thrown when cancelling a booking that is not CONFIRMED.
 */
public class BookingNotActiveException extends ReservationException {

    private static final String ERROR_CODE = "BOOKING_NOT_ACTIVE";

    public BookingNotActiveException(String bookingId, BookingStatus status) {
        super(ERROR_CODE, "Booking " + bookingId + " is " + status);
    }
}
