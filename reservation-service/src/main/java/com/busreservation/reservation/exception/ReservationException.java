package com.busreservation.reservation.exception;

import lombok.Getter;


@Getter
public class ReservationException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public ReservationException(String errorCode, String message) {
        this(errorCode, message, false, null);
    }

    public ReservationException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, retryable, null);
    }

    public ReservationException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, false, cause);
    }

    public ReservationException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
