package com.busreservation.reservation.validator;

import com.busreservation.reservation.dto.PassengerDetails;
import com.busreservation.reservation.dto.ReservationRequest;
import com.busreservation.reservation.exception.ReservationValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ReservationValidator Tests")
class ReservationValidatorTest {

    private ReservationRequest request;

    @BeforeEach
    void setUp() {
        request = ReservationRequest.builder()
                .tripId("TR1")
                .seatNumbers(new ArrayList<>(List.of("01", "02")))
                .passengers(new ArrayList<>(List.of(
                        PassengerDetails.builder().name("Asha").age(31).build(),
                        PassengerDetails.builder().name("Ravi").age(7).build())))
                .build();
    }

    @Test
    @DisplayName("Should accept a well-formed request")
    void validateRequest_Valid_Passes() {
        assertThatCode(() -> ReservationValidator.validateRequest(request, "user-1")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject missing user")
    void validateRequest_MissingUser_Throws() {
        assertThatThrownBy(() -> ReservationValidator.validateRequest(request, " "))
                .isInstanceOf(ReservationValidationException.class)
                .hasMessageContaining("User ID");
    }

    @Test
    @DisplayName("Should reject empty seat list")
    void validateRequest_NoSeats_Throws() {
        request.setSeatNumbers(List.of());

        assertThatThrownBy(() -> ReservationValidator.validateRequest(request, "user-1"))
                .isInstanceOf(ReservationValidationException.class)
                .hasMessageContaining("seat");
    }

    @Test
    @DisplayName("Should reject duplicate seats")
    void validateRequest_DuplicateSeats_Throws() {
        request.setSeatNumbers(List.of("01", "01"));

        assertThatThrownBy(() -> ReservationValidator.validateRequest(request, "user-1"))
                .isInstanceOf(ReservationValidationException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("Should reject passenger count that differs from seat count")
    void validateRequest_PassengerMismatch_Throws() {
        request.setPassengers(List.of(PassengerDetails.builder().name("Asha").build()));

        assertThatThrownBy(() -> ReservationValidator.validateRequest(request, "user-1"))
                .isInstanceOf(ReservationValidationException.class)
                .hasMessageContaining("match");
    }

    @Test
    @DisplayName("Should reject blank passenger name")
    void validateRequest_BlankPassengerName_Throws() {
        request.getPassengers().get(1).setName("  ");

        assertThatThrownBy(() -> ReservationValidator.validateRequest(request, "user-1"))
                .isInstanceOf(ReservationValidationException.class)
                .hasMessageContaining("name");
    }

    @Test
    @DisplayName("Should reject out-of-range passenger age")
    void validateRequest_BadAge_Throws() {
        request.getPassengers().get(0).setAge(121);

        assertThatThrownBy(() -> ReservationValidator.validateRequest(request, "user-1"))
                .isInstanceOf(ReservationValidationException.class)
                .hasMessageContaining("age");
    }

    @Test
    @DisplayName("Should accept only seats printed on the bus")
    void validateSeatsExist_RejectsUnknownSeats() {
        assertThatCode(() -> ReservationValidator.validateSeatsExist(List.of("01", "40"), 40))
                .doesNotThrowAnyException();

        for (String seat : Arrays.asList("00", "41", "1", "A1", "001")) {
            assertThatThrownBy(() -> ReservationValidator.validateSeatsExist(List.of(seat), 40))
                    .as("seat %s", seat)
                    .isInstanceOf(ReservationValidationException.class);
        }
    }
}
