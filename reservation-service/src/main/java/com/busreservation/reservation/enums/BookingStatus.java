package com.busreservation.reservation.enums;

public enum BookingStatus {
    CONFIRMED,
    CANCELLED,
    COMPLETED
}
