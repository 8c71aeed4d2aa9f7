package com.busreservation.reservation.util;

import com.busreservation.reservation.constants.ReservationConstants;

import java.util.ArrayList;
import java.util.List;

/**
 * Seats on a bus are numbered "01".."NN" and laid out four to a row.
 */
public final class SeatNumbers {

    private SeatNumbers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String format(int index) {
        return String.format(ReservationConstants.SEAT_NUMBER_FORMAT, index);
    }

    public static List<String> allSeats(int totalSeats) {
        List<String> seats = new ArrayList<>(totalSeats);
        for (int i = 1; i <= totalSeats; i++) {
            seats.add(format(i));
        }
        return seats;
    }

    /**
     * True if the seat number is exactly one of {@link #allSeats(int)}.
     */
    public static boolean exists(String seatNumber, int totalSeats) {
        if (seatNumber == null || seatNumber.length() < 2 || !seatNumber.chars().allMatch(Character::isDigit)) {
            return false;
        }
        int index;
        try {
            index = Integer.parseInt(seatNumber);
        } catch (NumberFormatException e) {
            return false;
        }
        return index >= 1 && index <= totalSeats && format(index).equals(seatNumber);
    }

    public static int row(int index) {
        return (index - 1) / ReservationConstants.SEATS_PER_ROW + 1;
    }

    public static int column(int index) {
        return (index - 1) % ReservationConstants.SEATS_PER_ROW + 1;
    }
}
