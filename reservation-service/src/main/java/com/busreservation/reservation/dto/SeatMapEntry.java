package com.busreservation.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SeatMapEntry {

    String seatNumber;
    boolean booked;
    int row;
    int column;
}
