package com.busreservation.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SeatEntry {

    String seatNumber;
    String passengerName;
    Integer passengerAge;
    String passengerGender;
}
