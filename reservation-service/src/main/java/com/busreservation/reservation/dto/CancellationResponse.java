package com.busreservation.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CancellationResponse {

    String bookingId;
    String status;
    BigDecimal refundAmount;
    String cancelledBy;
    LocalDateTime cancelledAt;
    Integer seatsReleased;
}
