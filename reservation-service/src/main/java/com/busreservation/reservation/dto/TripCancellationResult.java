package com.busreservation.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class TripCancellationResult {

    String tripId;
    boolean alreadyCancelled;
    int cancelledBookingCount;
    BigDecimal totalRefund;
}
