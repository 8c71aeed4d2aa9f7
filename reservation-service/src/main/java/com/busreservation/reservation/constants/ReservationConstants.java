package com.busreservation.reservation.constants;

public final class ReservationConstants {

    private ReservationConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Booking Rules ==========

    public static final int DEFAULT_CANCELLATION_WINDOW_HOURS = 2;
    public static final String DEFAULT_USER_REFUND_RATIO = "0.90";
    public static final int DEFAULT_MAX_CONFLICT_RETRIES = 3;
    public static final int MONEY_SCALE = 2;

    // ========== Passenger Constraints ==========

    public static final int MIN_PASSENGER_AGE = 0;
    public static final int MAX_PASSENGER_AGE = 120;

    // ========== Seat Layout ==========

    public static final int SEATS_PER_ROW = 4;
    public static final String SEAT_NUMBER_FORMAT = "%02d";

    // ========== Locking ==========

    public static final String LOCK_MODE_LOCAL = "local";
    public static final String LOCK_MODE_REDIS = "redis";
    public static final long DEFAULT_LOCK_WAIT_TIMEOUT_MS = 5000;
    public static final long DEFAULT_LOCK_LEASE_TIMEOUT_MS = 10000;

    // ========== Scheduling ==========

    public static final long DEFAULT_STATUS_CHECK_INTERVAL_MS = 60000;

    // ========== Pagination ==========

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    // ========== ID Generation ==========

    public static final String TRIP_ID_PREFIX = "TR";
    public static final String BOOKING_ID_PREFIX = "BK";

    // ========== Identity Headers ==========

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    // ========== Redis Keys ==========

    public static final String REDIS_TRIP_SEATS_KEY_PATTERN = "trip:%s:availableSeats";
    public static final String REDIS_TRIP_LOCK_PREFIX = "lock:trip:";
}
