package com.busreservation.reservation.exception;

public class CancellationNotAllowedException extends ReservationException {

    private static final String ERROR_CODE = "CANCELLATION_NOT_ALLOWED";

    public CancellationNotAllowedException(String bookingId) {
        super(ERROR_CODE, "Booking " + bookingId + " can no longer be cancelled");
    }
}
