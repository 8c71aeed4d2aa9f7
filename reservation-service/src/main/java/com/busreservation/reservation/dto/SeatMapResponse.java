package com.busreservation.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SeatMapResponse {

    String tripId;
    int totalSeats;
    int availableSeats;
    List<SeatMapEntry> seats;
}
