package com.busreservation.reservation.service;

import com.busreservation.reservation.constants.ReservationConstants;
import com.busreservation.reservation.constants.ValidationMessages;
import com.busreservation.reservation.dto.TripCancellationResult;
import com.busreservation.reservation.enums.BookingStatus;
import com.busreservation.reservation.enums.TripStatus;
import com.busreservation.reservation.exception.ReservationException;
import com.busreservation.reservation.exception.SeatCounterConflictException;
import com.busreservation.reservation.model.Booking;
import com.busreservation.reservation.model.TripInstance;
import com.busreservation.reservation.repository.BookingRepository;
import com.busreservation.reservation.repository.TripInstanceRepository;
import com.busreservation.reservation.service.lock.LockOperations;
import com.busreservation.reservation.validator.ReservationValidator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Trip-wide state changes: admin cancellation and the departure/arrival status job.
 * Both take the same per-trip lock as bookings, so a reservation either commits
 * before the trip leaves SCHEDULED or sees the new status and is refused.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripLifecycleService {

    private final TripInstanceRepository tripRepository;
    private final BookingRepository bookingRepository;
    private final SeatLedgerService seatLedgerService;
    private final TripInventoryService tripInventoryService;
    private final BookingService bookingService;
    private final LockOperations lockService;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Cancels the trip and every confirmed booking on it with a full refund.
     * Reapplying to a cancelled trip changes nothing and refunds nothing.
     */
    public TripCancellationResult cancelTrip(String tripId) {
        ReservationValidator.validateId(tripId, ValidationMessages.TRIP_ID_REQUIRED);
        log.info("Cancelling trip: tripId={}", tripId);

        try {
            TripCancellationResult result = lockService.executeWithLock(tripId, () ->
                    transactionTemplate.execute(status -> doCancelTrip(tripId)));

            tripInventoryService.syncCacheFromDb(tripId);
            meterRegistry.counter("trip.cancel.total", "result",
                    result.isAlreadyCancelled() ? "already_cancelled" : "success").increment();
            log.info("Trip cancelled: tripId={}, bookingsCancelled={}, totalRefund={}",
                    tripId, result.getCancelledBookingCount(), result.getTotalRefund());
            return result;
        } catch (OptimisticLockingFailureException e) {
            meterRegistry.counter("trip.cancel.total", "result", "conflict").increment();
            throw new SeatCounterConflictException(tripId, e);
        } catch (ReservationException e) {
            meterRegistry.counter("trip.cancel.total", "result", e.getErrorCode().toLowerCase()).increment();
            throw e;
        } catch (LockOperations.LockAcquisitionException e) {
            meterRegistry.counter("trip.cancel.total", "result", "lock_failed").increment();
            log.warn("Failed to acquire lock for trip cancellation: tripId={}", tripId);
            throw e;
        }
    }

    private TripCancellationResult doCancelTrip(String tripId) {
        TripInstance trip = tripInventoryService.getTrip(tripId);
        if (trip.isCancelled()) {
            log.info("Trip {} already cancelled at {}", tripId, trip.getCancelledAt());
            return TripCancellationResult.builder()
                    .tripId(tripId)
                    .alreadyCancelled(true)
                    .cancelledBookingCount(0)
                    .totalRefund(BigDecimal.ZERO)
                    .build();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<Booking> confirmed = bookingRepository.findByTripIdAndStatus(tripId, BookingStatus.CONFIRMED);
        BigDecimal totalRefund = BigDecimal.ZERO;
        for (Booking booking : confirmed) {
            totalRefund = totalRefund.add(bookingService.cancelForTripCancellation(booking, now));
        }

        // every claim is released by now, so this resets the counter to capacity
        long activeClaims = seatLedgerService.countActive(tripId);
        trip.setAvailableSeats((int) Math.max(0, trip.getTotalSeats() - activeClaims));
        trip.setStatus(TripStatus.CANCELLED);
        trip.setCancelledAt(now);
        tripRepository.save(trip);

        return TripCancellationResult.builder()
                .tripId(tripId)
                .alreadyCancelled(false)
                .cancelledBookingCount(confirmed.size())
                .totalRefund(totalRefund)
                .build();
    }

    // ==================== Status job ====================

    /**
     * Moves trips SCHEDULED -> RUNNING at departure and RUNNING -> COMPLETED at
     * arrival. Completing a trip completes its confirmed bookings.
     *
     * @return number of trips whose status changed
     */
    @Scheduled(fixedDelayString = "${reservation.trips.status-check-interval-ms:"
            + ReservationConstants.DEFAULT_STATUS_CHECK_INTERVAL_MS + "}")
    public int advanceTripStatuses() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<TripInstance> candidates = tripRepository.findByStatusInAndServiceDateLessThanEqual(
                EnumSet.of(TripStatus.SCHEDULED, TripStatus.RUNNING), now.toLocalDate());

        int advanced = 0;
        for (TripInstance candidate : candidates) {
            if (targetStatus(candidate, now) == candidate.getStatus()) {
                continue;
            }
            try {
                Boolean changed = lockService.executeWithLock(candidate.getTripId(), () ->
                        transactionTemplate.execute(status -> advanceTrip(candidate.getTripId(), now)));
                if (Boolean.TRUE.equals(changed)) {
                    advanced++;
                }
            } catch (LockOperations.LockAcquisitionException e) {
                log.warn("Skipping status update for trip {}: lock busy", candidate.getTripId());
            } catch (Exception e) {
                log.error("Failed to advance status of trip {}: {}", candidate.getTripId(), e.getMessage(), e);
            }
        }

        if (advanced > 0) {
            log.info("Advanced status of {} trips", advanced);
        }
        return advanced;
    }

    private boolean advanceTrip(String tripId, LocalDateTime now) {
        TripInstance trip = tripInventoryService.getTrip(tripId);
        if (trip.getStatus() != TripStatus.SCHEDULED && trip.getStatus() != TripStatus.RUNNING) {
            return false;
        }
        TripStatus target = targetStatus(trip, now);
        if (target == trip.getStatus()) {
            return false;
        }

        trip.setStatus(target);
        tripRepository.save(trip);

        if (target == TripStatus.COMPLETED) {
            List<Booking> confirmed = bookingRepository.findByTripIdAndStatus(tripId, BookingStatus.CONFIRMED);
            confirmed.forEach(Booking::complete);
            bookingRepository.saveAll(confirmed);
            log.debug("Completed {} bookings on trip {}", confirmed.size(), tripId);
        }
        log.info("Trip {} moved to {}", tripId, target);
        return true;
    }

    static TripStatus targetStatus(TripInstance trip, LocalDateTime now) {
        if (!now.isBefore(trip.arrivalDateTime())) {
            return TripStatus.COMPLETED;
        }
        if (!now.isBefore(trip.departureDateTime())) {
            return TripStatus.RUNNING;
        }
        return trip.getStatus();
    }
}
