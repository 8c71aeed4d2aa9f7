package com.busreservation.reservation.service;

import com.busreservation.reservation.enums.TripStatus;
import com.busreservation.reservation.exception.SeatCounterConflictException;
import com.busreservation.reservation.exception.TripNotFoundException;
import com.busreservation.reservation.model.TripInstance;
import com.busreservation.reservation.repository.TripInstanceRepository;
import com.busreservation.reservation.service.cache.SeatCacheOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Schedule record store: one inventory record per trip instance.
 *
 * Counter writes are single conditional UPDATEs, so the bounds check and the write
 * happen atomically in the database. They must join a transaction opened by the
 * booking or trip lifecycle services.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripInventoryService {

    private final TripInstanceRepository tripRepository;
    private final SeatCacheOperations seatCache;

    public TripInstance getTrip(String tripId) {
        return tripRepository.findByTripId(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));
    }

    /**
     * Display availability. Cache first, committed DB value on a miss.
     */
    public int getAvailableSeats(String tripId) {
        var cachedSeats = seatCache.getSeats(tripId);
        if (cachedSeats.isPresent()) {
            return cachedSeats.get();
        }

        log.debug("Cache miss for trip {}, falling back to DB", tripId);
        int seats = tripRepository.findAvailableSeats(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));
        seatCache.setSeats(tripId, seats);
        return seats;
    }

    /**
     * Moves the available-seat counter by {@code delta}.
     * A negative delta also requires the trip to still be SCHEDULED.
     *
     * @return the counter value after the adjustment
     * @throws SeatCounterConflictException if the result would leave {@code [0, totalSeats]}
     */
    @Transactional(propagation = Propagation.MANDATORY, noRollbackFor = SeatCounterConflictException.class)
    public int adjustAvailableSeats(String tripId, int delta) {
        if (delta == 0) {
            return currentSeats(tripId);
        }

        int updated = delta < 0
                ? tripRepository.reserveSeats(tripId, -delta, TripStatus.SCHEDULED)
                : tripRepository.restoreSeats(tripId, delta);

        if (updated == 0) {
            log.warn("Seat counter adjustment rejected: tripId={}, delta={}", tripId, delta);
            throw new SeatCounterConflictException(tripId, delta);
        }

        int seats = currentSeats(tripId);
        log.debug("Adjusted seats: tripId={}, delta={}, available={}", tripId, delta, seats);
        return seats;
    }

    /**
     * Rewrites the counter from the ledger: {@code totalSeats - activeClaims}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int reconcile(String tripId, int totalSeats, long activeClaims) {
        int seats = (int) Math.max(0, totalSeats - activeClaims);
        int updated = tripRepository.overwriteAvailableSeats(tripId, seats);
        if (updated == 0) {
            throw new TripNotFoundException(tripId);
        }
        log.info("Reconciled seat counter: tripId={}, available={}, activeClaims={}", tripId, seats, activeClaims);
        return seats;
    }

    /**
     * Pushes the committed counter to the display cache. Call after commit.
     */
    public void syncCacheFromDb(String tripId) {
        tripRepository.findAvailableSeats(tripId).ifPresentOrElse(seats -> {
            seatCache.setSeats(tripId, seats);
            log.debug("Synced trip {} from DB to cache: {} seats", tripId, seats);
        }, () -> seatCache.deleteSeats(tripId));
    }

    private int currentSeats(String tripId) {
        return tripRepository.findAvailableSeats(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));
    }
}
