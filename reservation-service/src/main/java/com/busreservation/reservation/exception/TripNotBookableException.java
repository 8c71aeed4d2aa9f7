package com.busreservation.reservation.exception;

import com.busreservation.reservation.enums.TripStatus;

public class TripNotBookableException extends ReservationException {

    private static final String ERROR_CODE = "TRIP_NOT_BOOKABLE";

    public TripNotBookableException(String tripId, TripStatus status) {
        super(ERROR_CODE, "Trip " + tripId + " is " + status + " and cannot be booked");
    }
}
