package com.busreservation.reservation.util;

import com.busreservation.reservation.constants.ReservationConstants;

import java.util.UUID;

public final class IdGenerator {

    private static final int UUID_SUBSTRING_LENGTH = 10;

    private IdGenerator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String generateTripId() {
        return ReservationConstants.TRIP_ID_PREFIX + randomSuffix();
    }

    public static String generateBookingId() {
        return ReservationConstants.BOOKING_ID_PREFIX + randomSuffix();
    }

    private static String randomSuffix() {
        return UUID.randomUUID()
                .toString()
                .replace("-", "")
                .substring(0, UUID_SUBSTRING_LENGTH)
                .toUpperCase();
    }
}
