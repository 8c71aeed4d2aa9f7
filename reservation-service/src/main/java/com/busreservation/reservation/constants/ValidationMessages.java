package com.busreservation.reservation.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    // ========== Reservation Validation Messages ==========

    public static final String RESERVATION_REQUIRED = "Reservation request is required";
    public static final String TRIP_ID_REQUIRED = "Trip ID is required";
    public static final String USER_ID_REQUIRED = "User ID is required";
    public static final String BOOKING_ID_REQUIRED = "Booking ID is required";
    public static final String SEATS_REQUIRED = "At least one seat is required";
    public static final String SEAT_NUMBER_BLANK = "Seat numbers cannot be blank";
    public static final String DUPLICATE_SEATS = "Duplicate seat numbers in request";
    public static final String PASSENGERS_REQUIRED = "Passenger details are required";
    public static final String PASSENGER_COUNT_MISMATCH = "Number of passengers must match number of seats";
    public static final String PASSENGER_NAME_REQUIRED = "Passenger name is required";
    public static final String PASSENGER_AGE_RANGE = "Passenger age must be between 0 and 120";
    public static final String UNKNOWN_SEAT = "Seat does not exist on this trip";

    // ========== Trip Validation Messages ==========

    public static final String TRIP_DATA_REQUIRED = "Trip data is required";
    public static final String BUS_ID_REQUIRED = "Bus ID is required";
    public static final String ROUTE_ID_REQUIRED = "Route ID is required";
    public static final String SERVICE_DATE_REQUIRED = "Service date is required";
    public static final String SERVICE_DATE_NOT_PAST = "Service date cannot be in the past";
    public static final String DEPARTURE_TIME_REQUIRED = "Departure time is required";
    public static final String ARRIVAL_TIME_REQUIRED = "Arrival time is required";
    public static final String PRICE_REQUIRED = "Price is required";
    public static final String PRICE_NON_NEGATIVE = "Price must be non-negative";
    public static final String BUS_SEATS_POSITIVE = "Bus must have at least one seat";

    // ========== Search Validation Messages ==========

    public static final String ORIGIN_REQUIRED = "Origin is required";
    public static final String DESTINATION_REQUIRED = "Destination is required";
    public static final String DATE_REQUIRED = "Date is required";
}
