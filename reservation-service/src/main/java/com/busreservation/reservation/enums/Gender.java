package com.busreservation.reservation.enums;

public enum Gender {
    MALE,
    FEMALE,
    OTHER
}
