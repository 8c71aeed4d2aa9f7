package com.busreservation.reservation.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Route as served by the catalog service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class RouteEntry {

    String routeId;
    String origin;
    String destination;
    Double distanceKm;
    Double estimatedDurationHours;
    boolean active;
}
