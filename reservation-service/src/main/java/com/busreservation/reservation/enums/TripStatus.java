package com.busreservation.reservation.enums;

public enum TripStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    CANCELLED
}
