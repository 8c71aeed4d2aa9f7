package com.busreservation.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingEntry {

    String bookingId;
    String userId;
    String tripId;
    List<SeatEntry> seats;
    Integer seatCount;
    BigDecimal totalAmount;
    String status;
    Boolean canCancel;
    LocalDateTime cancelledAt;
    BigDecimal refundAmount;
    String cancelledBy;
    LocalDateTime createdAt;
}
