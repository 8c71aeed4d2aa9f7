package com.busreservation.reservation.service.lock;

import java.util.function.Supplier;

/**
 * Per-trip mutual exclusion for inventory writes.
 * Operations on different trips never contend with each other.
 */
public interface LockOperations {

    /**
     * Executes action while holding the lock for one trip.
     *
     * @param tripId Trip to lock
     * @param action Action to execute while holding lock
     * @return Result of action
     * @throws LockAcquisitionException if lock cannot be acquired within the wait timeout
     */
    <T> T executeWithLock(String tripId, Supplier<T> action);

    class LockAcquisitionException extends RuntimeException {
        public LockAcquisitionException(String message) {
            super(message);
        }
    }
}
