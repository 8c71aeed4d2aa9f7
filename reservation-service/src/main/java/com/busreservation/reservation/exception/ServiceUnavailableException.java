package com.busreservation.reservation.exception;

/**
 * Exception thrown when a downstream service is unavailable.
 */
public class ServiceUnavailableException extends ReservationException {

    private static final String ERROR_CODE = "SERVICE_UNAVAILABLE";

    public ServiceUnavailableException(String message) {
        super(ERROR_CODE, message, true);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, true, cause);
    }
}
