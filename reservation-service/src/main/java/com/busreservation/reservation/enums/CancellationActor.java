package com.busreservation.reservation.enums;

/**
 * Who released a booking. Determines refund ratio and whether the
 * cancellation window applies.
 */
public enum CancellationActor {
    USER,
    ADMIN,
    TRIP_CANCELLATION
}
