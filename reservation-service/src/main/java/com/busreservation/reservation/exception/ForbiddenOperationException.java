package com.busreservation.reservation.exception;

public class ForbiddenOperationException extends ReservationException {

    private static final String ERROR_CODE = "FORBIDDEN";

    public ForbiddenOperationException(String message) {
        super(ERROR_CODE, message);
    }
}
