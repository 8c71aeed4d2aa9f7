package com.busreservation.reservation.service.cache;

import java.util.Optional;

/**
 * Display cache of available-seat counts.
 * Never consulted when deciding whether a booking may proceed.
 */
public interface SeatCacheOperations {

    void setSeats(String tripId, int seats);

    Optional<Integer> getSeats(String tripId);

    void deleteSeats(String tripId);
}
