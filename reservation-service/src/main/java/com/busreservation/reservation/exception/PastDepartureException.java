package com.busreservation.reservation.exception;

import java.time.LocalDateTime;

public class PastDepartureException extends ReservationException {

    private static final String ERROR_CODE = "PAST_DEPARTURE";

    public PastDepartureException(String tripId, LocalDateTime departure) {
        super(ERROR_CODE, "Cannot book trip " + tripId + ": departure " + departure + " has passed");
    }
}
