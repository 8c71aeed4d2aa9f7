package com.busreservation.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TripEntry {

    String tripId;
    String busId;
    String routeId;
    String operatorId;
    String busNumber;
    String origin;
    String destination;
    LocalDate serviceDate;
    LocalTime departureTime;
    LocalTime arrivalTime;
    BigDecimal price;
    Integer totalSeats;
    Integer availableSeats;
    String status;
    LocalDateTime cancelledAt;
}
