package com.busreservation.reservation.enums;

public enum CallerRole {
    USER,
    ADMIN
}
