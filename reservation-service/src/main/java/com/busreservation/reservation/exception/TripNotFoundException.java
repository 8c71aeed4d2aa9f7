package com.busreservation.reservation.exception;

/**
 * Thrown when a requested trip instance does not exist.
 */
public class TripNotFoundException extends ReservationException {

    private static final String ERROR_CODE = "TRIP_NOT_FOUND";

    public TripNotFoundException(String tripId) {
        super(ERROR_CODE, "Trip not found: " + tripId);
    }
}
