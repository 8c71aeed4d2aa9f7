package com.busreservation.reservation.service.lock;

import com.busreservation.reservation.constants.ReservationConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-JVM trip locks. Correct for a single service instance; run with
 * {@code reservation.lock.mode=redis} when scaling out.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "reservation.lock.mode", havingValue = ReservationConstants.LOCK_MODE_LOCAL,
        matchIfMissing = true)
public class LocalTripLockService implements LockOperations {

    private final ConcurrentMap<String, TripLock> locks = new ConcurrentHashMap<>();
    private final long waitTimeoutMs;

    public LocalTripLockService(
            @Value("${reservation.lock.wait-timeout-ms:" + ReservationConstants.DEFAULT_LOCK_WAIT_TIMEOUT_MS + "}")
            long waitTimeoutMs) {
        this.waitTimeoutMs = waitTimeoutMs;
    }

    @Override
    public <T> T executeWithLock(String tripId, Supplier<T> action) {
        TripLock tripLock = retain(tripId);
        try {
            return runLocked(tripId, tripLock.lock, action);
        } finally {
            releaseReference(tripId);
        }
    }

    private <T> T runLocked(String tripId, ReentrantLock lock, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Lock acquisition interrupted: tripId={}", tripId);
            throw new LockAcquisitionException("Interrupted while waiting for lock on trip: " + tripId);
        }

        if (!acquired) {
            log.warn("Failed to acquire lock within timeout: tripId={}, waitTimeout={}ms", tripId, waitTimeoutMs);
            throw new LockAcquisitionException("Failed to acquire lock for trip: " + tripId);
        }

        log.debug("Acquired lock: tripId={}", tripId);
        try {
            return action.get();
        } finally {
            lock.unlock();
            log.debug("Released lock: tripId={}", tripId);
        }
    }

    private TripLock retain(String tripId) {
        return locks.compute(tripId, (id, existing) -> {
            TripLock tripLock = existing != null ? existing : new TripLock();
            tripLock.references++;
            return tripLock;
        });
    }

    // the entry goes once no caller holds or waits for it
    private void releaseReference(String tripId) {
        locks.computeIfPresent(tripId, (id, tripLock) -> --tripLock.references == 0 ? null : tripLock);
    }

    int trackedTrips() {
        return locks.size();
    }

    private static final class TripLock {
        // fair: waiting bookings on one trip run in arrival order
        private final ReentrantLock lock = new ReentrantLock(true);
        // mutated only inside map compute calls for this trip
        private int references;
    }
}
