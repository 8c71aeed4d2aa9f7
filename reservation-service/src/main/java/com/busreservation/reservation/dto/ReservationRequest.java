package com.busreservation.reservation.dto;

import com.busreservation.reservation.constants.ValidationMessages;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ReservationRequest {

    @NotBlank(message = ValidationMessages.TRIP_ID_REQUIRED)
    String tripId;

    @NotEmpty(message = ValidationMessages.SEATS_REQUIRED)
    List<String> seatNumbers;

    @NotEmpty(message = ValidationMessages.PASSENGERS_REQUIRED)
    List<@Valid PassengerDetails> passengers;
}
