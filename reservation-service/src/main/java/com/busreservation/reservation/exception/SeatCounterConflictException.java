package com.busreservation.reservation.exception;

/**
 * The available-seat counter refused an adjustment that would leave it outside
 * {@code [0, totalSeats]}. Internal race, never caused by the caller.
 */
public class SeatCounterConflictException extends ReservationException {

    private static final String ERROR_CODE = "INVENTORY_CONFLICT";

    public SeatCounterConflictException(String tripId, int delta) {
        super(ERROR_CODE, "Seat counter conflict on trip " + tripId + " (delta " + delta + ")", true);
    }

    public SeatCounterConflictException(String tripId, Throwable cause) {
        super(ERROR_CODE, "Concurrent update on trip " + tripId + ", please retry", true, cause);
    }
}
