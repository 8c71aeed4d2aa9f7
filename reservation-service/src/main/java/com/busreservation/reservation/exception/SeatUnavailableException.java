package com.busreservation.reservation.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when one or more requested seats are already held on the trip.
 * Carries every contested seat so the caller can pick again.
 */
@Getter
public class SeatUnavailableException extends ReservationException {

    private static final String ERROR_CODE = "SEAT_UNAVAILABLE";

    private final String tripId;
    private final List<String> seats;

    public SeatUnavailableException(String tripId, List<String> seats) {
        this(tripId, seats, null);
    }

    public SeatUnavailableException(String tripId, List<String> seats, Throwable cause) {
        super(ERROR_CODE, "Seats already booked on trip " + tripId + ": " + String.join(", ", seats), false, cause);
        this.tripId = tripId;
        this.seats = List.copyOf(seats);
    }
}
