package com.busreservation.reservation.service;

import com.busreservation.reservation.constants.ReservationConstants;
import com.busreservation.reservation.constants.ValidationMessages;
import com.busreservation.reservation.dto.BookingEntry;
import com.busreservation.reservation.dto.CallerIdentity;
import com.busreservation.reservation.dto.CancellationResponse;
import com.busreservation.reservation.dto.PageResponse;
import com.busreservation.reservation.dto.ReservationRequest;
import com.busreservation.reservation.enums.BookingStatus;
import com.busreservation.reservation.enums.CancellationActor;
import com.busreservation.reservation.enums.TripStatus;
import com.busreservation.reservation.event.BookingLifecycleEvent;
import com.busreservation.reservation.exception.BookingNotActiveException;
import com.busreservation.reservation.exception.BookingNotFoundException;
import com.busreservation.reservation.exception.CancellationNotAllowedException;
import com.busreservation.reservation.exception.PastDepartureException;
import com.busreservation.reservation.exception.ReservationException;
import com.busreservation.reservation.exception.SeatCounterConflictException;
import com.busreservation.reservation.exception.SeatUnavailableException;
import com.busreservation.reservation.exception.TripNotBookableException;
import com.busreservation.reservation.mapper.BookingMapper;
import com.busreservation.reservation.model.Booking;
import com.busreservation.reservation.model.SeatClaim;
import com.busreservation.reservation.model.TripInstance;
import com.busreservation.reservation.repository.BookingRepository;
import com.busreservation.reservation.service.lock.LockOperations;
import com.busreservation.reservation.util.IdGenerator;
import com.busreservation.reservation.util.PageRequests;
import com.busreservation.reservation.validator.ReservationValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Booking transaction manager.
 *
 * Every write runs as: trip lock, then one database transaction, then unlock.
 * The transaction commits before the lock is released, so the next writer on the
 * same trip always sees committed ledger and counter state. The ledger's unique
 * active-seat key and the counter's conditional updates still hold if a writer
 * ever gets past the lock.
 */
@Service
@Slf4j
public class BookingService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final BookingRepository bookingRepository;
    private final SeatLedgerService seatLedgerService;
    private final TripInventoryService tripInventoryService;
    private final LockOperations lockService;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int cancellationWindowHours;
    private final BigDecimal userRefundRatio;
    private final int maxConflictRetries;

    public BookingService(BookingRepository bookingRepository,
                          SeatLedgerService seatLedgerService,
                          TripInventoryService tripInventoryService,
                          LockOperations lockService,
                          TransactionTemplate transactionTemplate,
                          ApplicationEventPublisher eventPublisher,
                          MeterRegistry meterRegistry,
                          Clock clock,
                          @Value("${reservation.booking.cancellation-window-hours:"
                                  + ReservationConstants.DEFAULT_CANCELLATION_WINDOW_HOURS + "}") int cancellationWindowHours,
                          @Value("${reservation.booking.user-refund-ratio:"
                                  + ReservationConstants.DEFAULT_USER_REFUND_RATIO + "}") BigDecimal userRefundRatio,
                          @Value("${reservation.booking.max-conflict-retries:"
                                  + ReservationConstants.DEFAULT_MAX_CONFLICT_RETRIES + "}") int maxConflictRetries) {
        this.bookingRepository = bookingRepository;
        this.seatLedgerService = seatLedgerService;
        this.tripInventoryService = tripInventoryService;
        this.lockService = lockService;
        this.transactionTemplate = transactionTemplate;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.cancellationWindowHours = cancellationWindowHours;
        this.userRefundRatio = userRefundRatio;
        this.maxConflictRetries = Math.max(1, maxConflictRetries);
    }

    // ==================== Reserve ====================

    /**
     * Books the requested seats on one trip for one user, all or nothing.
     *
     * @throws SeatUnavailableException naming every requested seat already held
     * @throws PastDepartureException if the trip has already departed
     * @throws TripNotBookableException if the trip is not SCHEDULED
     */
    public BookingEntry reserve(ReservationRequest request, String userId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        ReservationValidator.validateRequest(request, userId);

        String tripId = request.getTripId();
        List<String> seatNumbers = List.copyOf(request.getSeatNumbers());
        log.info("Reserving seats: tripId={}, userId={}, seats={}", tripId, userId, seatNumbers);

        try {
            BookingEntry booking = withConflictRetry(tripId, "reserve", () ->
                    lockService.executeWithLock(tripId, () ->
                            transactionTemplate.execute(status -> doReserve(request, seatNumbers, userId))));

            tripInventoryService.syncCacheFromDb(tripId);
            meterRegistry.counter("booking.reserve.total", "result", "success").increment();
            log.info("Booking confirmed: bookingId={}, tripId={}, seats={}, amount={}",
                    booking.getBookingId(), tripId, seatNumbers, booking.getTotalAmount());
            return booking;
        } catch (SeatCounterConflictException e) {
            if (e.getCause() instanceof OptimisticLockingFailureException) {
                meterRegistry.counter("booking.reserve.total", "result", "conflict").increment();
                throw e;
            }
            // counter kept refusing after retries: the seats are effectively gone
            meterRegistry.counter("booking.reserve.total", "result", "seat_unavailable").increment();
            throw new SeatUnavailableException(tripId, seatNumbers, e);
        } catch (ReservationException e) {
            meterRegistry.counter("booking.reserve.total", "result", resultTag(e)).increment();
            log.info("Reservation rejected: tripId={}, userId={}, reason={}", tripId, userId, e.getErrorCode());
            throw e;
        } catch (LockOperations.LockAcquisitionException e) {
            meterRegistry.counter("booking.reserve.total", "result", "lock_failed").increment();
            log.warn("Failed to acquire lock for reservation: tripId={}", tripId);
            throw e;
        } finally {
            sample.stop(Timer.builder("booking.reserve.duration").register(meterRegistry));
        }
    }

    private BookingEntry doReserve(ReservationRequest request, List<String> seatNumbers, String userId) {
        String tripId = request.getTripId();
        TripInstance trip = tripInventoryService.getTrip(tripId);

        if (trip.getStatus() == TripStatus.CANCELLED) {
            throw new TripNotBookableException(tripId, trip.getStatus());
        }
        // RUNNING and COMPLETED trips have departed; report them by departure time
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime departure = trip.departureDateTime();
        if (trip.getStatus() != TripStatus.SCHEDULED || !departure.isAfter(now)) {
            throw new PastDepartureException(tripId, departure);
        }
        ReservationValidator.validateSeatsExist(seatNumbers, trip.getTotalSeats());

        String bookingId = IdGenerator.generateBookingId();
        List<SeatClaim> claims = seatLedgerService.claim(tripId, bookingId, seatNumbers, request.getPassengers());
        int remaining = tripInventoryService.adjustAvailableSeats(tripId, -seatNumbers.size());

        BigDecimal totalAmount = trip.getPrice()
                .multiply(BigDecimal.valueOf(seatNumbers.size()))
                .setScale(ReservationConstants.MONEY_SCALE, RoundingMode.HALF_UP);

        Booking booking = bookingRepository.save(Booking.builder()
                .bookingId(bookingId)
                .userId(userId)
                .tripId(tripId)
                .seatCount(seatNumbers.size())
                .totalAmount(totalAmount)
                .status(BookingStatus.CONFIRMED)
                .canCancel(isWithinCancellationWindow(departure, now))
                .build());

        eventPublisher.publishEvent(BookingLifecycleEvent.created(this, booking));
        log.debug("Reserved: bookingId={}, tripId={}, remaining={}", bookingId, tripId, remaining);
        return BookingMapper.toEntry(booking, claims);
    }

    /**
     * True when departure is strictly more than the cancellation window away.
     * Evaluated once at creation; later time passage does not change it.
     */
    boolean isWithinCancellationWindow(LocalDateTime departure, LocalDateTime now) {
        return departure.isAfter(now.plusHours(cancellationWindowHours));
    }

    // ==================== Cancel ====================

    /**
     * Cancels a confirmed booking and returns its seats to the trip.
     * Users get {@code reservation.booking.user-refund-ratio} of the amount and only
     * while the booking is cancellable. Admins get a full refund at any time.
     */
    public CancellationResponse cancelBooking(String bookingId, CallerIdentity caller) {
        Timer.Sample sample = Timer.start(meterRegistry);
        ReservationValidator.validateId(bookingId, ValidationMessages.BOOKING_ID_REQUIRED);

        Booking existing = loadVisibleBooking(bookingId, caller);
        String tripId = existing.getTripId();
        CancellationActor actor = caller.isAdmin() ? CancellationActor.ADMIN : CancellationActor.USER;
        log.info("Cancelling booking: bookingId={}, tripId={}, actor={}", bookingId, tripId, actor);

        try {
            CancellationResponse response = withConflictRetry(tripId, "release", () ->
                    lockService.executeWithLock(tripId, () ->
                            transactionTemplate.execute(status -> doCancel(bookingId, actor))));

            tripInventoryService.syncCacheFromDb(tripId);
            meterRegistry.counter("booking.release.total", "result", "success").increment();
            log.info("Booking cancelled: bookingId={}, actor={}, refund={}, seatsReleased={}",
                    bookingId, actor, response.getRefundAmount(), response.getSeatsReleased());
            return response;
        } catch (ReservationException e) {
            meterRegistry.counter("booking.release.total", "result", resultTag(e)).increment();
            log.info("Cancellation rejected: bookingId={}, reason={}", bookingId, e.getErrorCode());
            throw e;
        } catch (LockOperations.LockAcquisitionException e) {
            meterRegistry.counter("booking.release.total", "result", "lock_failed").increment();
            log.warn("Failed to acquire lock for cancellation: bookingId={}, tripId={}", bookingId, tripId);
            throw e;
        } finally {
            sample.stop(Timer.builder("booking.release.duration").register(meterRegistry));
        }
    }

    private CancellationResponse doCancel(String bookingId, CancellationActor actor) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));

        if (!booking.isConfirmed()) {
            throw new BookingNotActiveException(bookingId, booking.getStatus());
        }
        if (actor == CancellationActor.USER && !Boolean.TRUE.equals(booking.getCanCancel())) {
            throw new CancellationNotAllowedException(bookingId);
        }

        BigDecimal refund = computeRefund(booking.getTotalAmount(), actor);
        int released = releaseBooking(booking, actor, refund, LocalDateTime.now(clock), true);
        return BookingMapper.toCancellation(booking, released);
    }

    /**
     * Cancels a booking as part of a trip cancellation: full refund, no cancellation
     * window check, counter left to the caller. Must run inside the caller's
     * transaction while it holds the trip lock.
     *
     * @return the refund recorded on the booking
     */
    public BigDecimal cancelForTripCancellation(Booking booking, LocalDateTime when) {
        BigDecimal refund = computeRefund(booking.getTotalAmount(), CancellationActor.TRIP_CANCELLATION);
        releaseBooking(booking, CancellationActor.TRIP_CANCELLATION, refund, when, false);
        return refund;
    }

    private int releaseBooking(Booking booking, CancellationActor actor, BigDecimal refund,
                               LocalDateTime when, boolean restoreCounter) {
        String tripId = booking.getTripId();
        booking.cancel(actor, refund, when);
        int released = seatLedgerService.release(tripId, booking.getBookingId(), when);

        if (restoreCounter && released > 0) {
            try {
                tripInventoryService.adjustAvailableSeats(tripId, released);
            } catch (SeatCounterConflictException e) {
                // counter drifted from the ledger; the ledger wins
                TripInstance trip = tripInventoryService.getTrip(tripId);
                tripInventoryService.reconcile(tripId, trip.getTotalSeats(), seatLedgerService.countActive(tripId));
            }
        }

        bookingRepository.save(booking);
        eventPublisher.publishEvent(BookingLifecycleEvent.cancelled(this, booking));
        return released;
    }

    BigDecimal computeRefund(BigDecimal totalAmount, CancellationActor actor) {
        BigDecimal ratio = actor == CancellationActor.USER ? userRefundRatio : BigDecimal.ONE;
        return totalAmount.multiply(ratio).setScale(ReservationConstants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    // ==================== Queries ====================

    public BookingEntry findById(String bookingId, CallerIdentity caller) {
        ReservationValidator.validateId(bookingId, ValidationMessages.BOOKING_ID_REQUIRED);
        Booking booking = loadVisibleBooking(bookingId, caller);
        return BookingMapper.toEntry(booking, seatLedgerService.findByBooking(bookingId));
    }

    /**
     * Bookings of one user, newest first. A null status returns every status.
     */
    public PageResponse<BookingEntry> findByUser(String userId, BookingStatus status, int page, int size) {
        ReservationValidator.validateId(userId, ValidationMessages.USER_ID_REQUIRED);
        Pageable pageable = PageRequests.of(page, size, NEWEST_FIRST);
        Page<Booking> bookings = status == null
                ? bookingRepository.findByUserId(userId, pageable)
                : bookingRepository.findByUserIdAndStatus(userId, status, pageable);
        return toPage(bookings);
    }

    public PageResponse<BookingEntry> findAll(BookingStatus status, int page, int size) {
        Pageable pageable = PageRequests.of(page, size, NEWEST_FIRST);
        Page<Booking> bookings = status == null
                ? bookingRepository.findAll(pageable)
                : bookingRepository.findByStatus(status, pageable);
        return toPage(bookings);
    }

    // ==================== Helpers ====================

    /**
     * Another user's booking is reported as missing, never as forbidden.
     */
    private Booking loadVisibleBooking(String bookingId, CallerIdentity caller) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        if (!caller.isAdmin() && !booking.getUserId().equals(caller.userId())) {
            log.warn("User {} requested booking {} owned by another user", caller.userId(), bookingId);
            throw new BookingNotFoundException(bookingId);
        }
        return booking;
    }

    private PageResponse<BookingEntry> toPage(Page<Booking> bookings) {
        return PageResponse.<BookingEntry>builder()
                .content(toEntries(bookings.getContent()))
                .page(bookings.getNumber())
                .size(bookings.getSize())
                .totalElements(bookings.getTotalElements())
                .totalPages(bookings.getTotalPages())
                .build();
    }

    private List<BookingEntry> toEntries(List<Booking> bookings) {
        if (bookings.isEmpty()) {
            return List.of();
        }
        Map<String, List<SeatClaim>> claimsByBooking = seatLedgerService
                .findByBookings(bookings.stream().map(Booking::getBookingId).toList())
                .stream()
                .collect(Collectors.groupingBy(SeatClaim::getBookingId));

        return bookings.stream()
                .map(b -> BookingMapper.toEntry(b, claimsByBooking.getOrDefault(b.getBookingId(), List.of())))
                .toList();
    }

    /**
     * Retries counter conflicts and optimistic-lock failures. Exhausted optimistic
     * failures surface as a retryable {@link SeatCounterConflictException}.
     */
    private <T> T withConflictRetry(String tripId, String operation, Supplier<T> action) {
        SeatCounterConflictException lastConflict = null;
        for (int attempt = 1; attempt <= maxConflictRetries; attempt++) {
            try {
                return action.get();
            } catch (SeatCounterConflictException e) {
                lastConflict = e;
            } catch (OptimisticLockingFailureException e) {
                lastConflict = new SeatCounterConflictException(tripId, e);
            }
            log.warn("Inventory conflict on {}: tripId={}, attempt={}/{}",
                    operation, tripId, attempt, maxConflictRetries);
        }
        throw lastConflict;
    }

    private static String resultTag(ReservationException e) {
        return e.getErrorCode().toLowerCase();
    }
}
