package com.busreservation.reservation.validator;

import com.busreservation.reservation.constants.ReservationConstants;
import com.busreservation.reservation.constants.ValidationMessages;
import com.busreservation.reservation.dto.PassengerDetails;
import com.busreservation.reservation.dto.ReservationRequest;
import com.busreservation.reservation.exception.ReservationValidationException;
import com.busreservation.reservation.util.SeatNumbers;
import org.springframework.util.StringUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ReservationValidator {

    private ReservationValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Shape checks that need no trip data. Services call this even when the
     * controller already ran bean validation.
     */
    public static void validateRequest(ReservationRequest request, String userId) {
        if (request == null) {
            throw new ReservationValidationException(ValidationMessages.RESERVATION_REQUIRED);
        }
        if (!StringUtils.hasText(userId)) {
            throw new ReservationValidationException(ValidationMessages.USER_ID_REQUIRED);
        }
        if (!StringUtils.hasText(request.getTripId())) {
            throw new ReservationValidationException(ValidationMessages.TRIP_ID_REQUIRED);
        }

        List<String> seats = request.getSeatNumbers();
        if (seats == null || seats.isEmpty()) {
            throw new ReservationValidationException(ValidationMessages.SEATS_REQUIRED);
        }
        Set<String> unique = new HashSet<>();
        for (String seat : seats) {
            if (!StringUtils.hasText(seat)) {
                throw new ReservationValidationException(ValidationMessages.SEAT_NUMBER_BLANK);
            }
            if (!unique.add(seat)) {
                throw new ReservationValidationException(ValidationMessages.DUPLICATE_SEATS + ": " + seat);
            }
        }

        List<PassengerDetails> passengers = request.getPassengers();
        if (passengers == null || passengers.isEmpty()) {
            throw new ReservationValidationException(ValidationMessages.PASSENGERS_REQUIRED);
        }
        if (passengers.size() != seats.size()) {
            throw new ReservationValidationException(ValidationMessages.PASSENGER_COUNT_MISMATCH);
        }
        passengers.forEach(ReservationValidator::validatePassenger);
    }

    public static void validatePassenger(PassengerDetails passenger) {
        if (passenger == null || !StringUtils.hasText(passenger.getName())) {
            throw new ReservationValidationException(ValidationMessages.PASSENGER_NAME_REQUIRED);
        }
        Integer age = passenger.getAge();
        if (age != null && (age < ReservationConstants.MIN_PASSENGER_AGE || age > ReservationConstants.MAX_PASSENGER_AGE)) {
            throw new ReservationValidationException(ValidationMessages.PASSENGER_AGE_RANGE);
        }
    }

    public static void validateSeatsExist(List<String> seatNumbers, int totalSeats) {
        for (String seat : seatNumbers) {
            if (!SeatNumbers.exists(seat, totalSeats)) {
                throw new ReservationValidationException(ValidationMessages.UNKNOWN_SEAT + ": " + seat);
            }
        }
    }

    public static void validateId(String id, String message) {
        if (!StringUtils.hasText(id)) {
            throw new ReservationValidationException(message);
        }
    }
}
