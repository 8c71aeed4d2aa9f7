package com.busreservation.reservation.exception;


public class ReservationValidationException extends ReservationException {

    private static final String ERROR_CODE = "INVALID_REQUEST";

    public ReservationValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
