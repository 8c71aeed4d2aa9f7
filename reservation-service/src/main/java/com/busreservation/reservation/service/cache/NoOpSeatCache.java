package com.busreservation.reservation.service.cache;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@ConditionalOnProperty(name = "reservation.cache.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpSeatCache implements SeatCacheOperations {

    @Override
    public void setSeats(String tripId, int seats) {
    }

    @Override
    public Optional<Integer> getSeats(String tripId) {
        return Optional.empty();
    }

    @Override
    public void deleteSeats(String tripId) {
    }
}
