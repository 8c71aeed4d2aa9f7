package com.busreservation.reservation.dto;

import com.busreservation.reservation.constants.ReservationConstants;
import com.busreservation.reservation.constants.ValidationMessages;
import com.busreservation.reservation.enums.Gender;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PassengerDetails {

    @NotBlank(message = ValidationMessages.PASSENGER_NAME_REQUIRED)
    String name;

    @Min(value = ReservationConstants.MIN_PASSENGER_AGE, message = ValidationMessages.PASSENGER_AGE_RANGE)
    @Max(value = ReservationConstants.MAX_PASSENGER_AGE, message = ValidationMessages.PASSENGER_AGE_RANGE)
    Integer age;

    Gender gender;
}
