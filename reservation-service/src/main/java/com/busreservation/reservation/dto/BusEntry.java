package com.busreservation.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Bus as served by the catalog service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BusEntry {

    String busId;
    String operatorId;
    String busNumber;
    String busType;
    Integer totalSeats;
    boolean active;
}
