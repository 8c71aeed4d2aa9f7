package com.busreservation.reservation.event;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Reporting sink. Receives committed booking events only, off the request thread;
 * a failure here never affects the booking itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BookingReportingListener {

    private final MeterRegistry meterRegistry;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBookingEvent(BookingLifecycleEvent event) {
        try {
            switch (event.getChangeType()) {
                case CREATED -> recordCreated(event);
                case CANCELLED -> recordCancelled(event);
            }
        } catch (Exception e) {
            log.error("Failed to report booking event: bookingId={}, type={}",
                    event.getBookingId(), event.getChangeType(), e);
        }
    }

    private void recordCreated(BookingLifecycleEvent event) {
        meterRegistry.counter("reporting.bookings.created").increment();
        meterRegistry.counter("reporting.seats.sold").increment(event.getSeatCount());
        meterRegistry.summary("reporting.revenue").record(event.getTotalAmount().doubleValue());
        log.info("Reported booking created: bookingId={}, tripId={}, seats={}, amount={}",
                event.getBookingId(), event.getTripId(), event.getSeatCount(), event.getTotalAmount());
    }

    private void recordCancelled(BookingLifecycleEvent event) {
        String actor = event.getCancelledBy() != null ? event.getCancelledBy().name() : "UNKNOWN";
        meterRegistry.counter("reporting.bookings.cancelled", "actor", actor).increment();
        if (event.getRefundAmount() != null) {
            meterRegistry.summary("reporting.refunds").record(event.getRefundAmount().doubleValue());
        }
        log.info("Reported booking cancelled: bookingId={}, tripId={}, actor={}, refund={}",
                event.getBookingId(), event.getTripId(), actor, event.getRefundAmount());
    }
}
