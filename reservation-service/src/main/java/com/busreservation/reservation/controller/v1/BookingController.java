package com.busreservation.reservation.controller.v1;

import com.busreservation.reservation.constants.ReservationConstants;
import com.busreservation.reservation.dto.BookingEntry;
import com.busreservation.reservation.dto.CallerIdentity;
import com.busreservation.reservation.dto.CancellationResponse;
import com.busreservation.reservation.dto.PageResponse;
import com.busreservation.reservation.dto.ReservationRequest;
import com.busreservation.reservation.enums.BookingStatus;
import com.busreservation.reservation.service.BookingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/bookings")
@RequiredArgsConstructor
@Slf4j
public class BookingController {

    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<BookingEntry> create(
            @Valid @RequestBody ReservationRequest request,
            @RequestHeader(ReservationConstants.USER_ID_HEADER) String userId) {

        log.info("POST /v1/bookings - trip={}, user={}, seats={}",
                request.getTripId(), userId, request.getSeatNumbers());

        BookingEntry entry = bookingService.reserve(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping("/mine")
    public ResponseEntity<PageResponse<BookingEntry>> findMine(
            @RequestHeader(ReservationConstants.USER_ID_HEADER) String userId,
            @RequestParam(required = false) BookingStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + ReservationConstants.DEFAULT_PAGE_SIZE) int size) {

        log.debug("GET /v1/bookings/mine - user={}, status={}, page={}, size={}", userId, status, page, size);
        return ResponseEntity.ok(bookingService.findByUser(userId, status, page, size));
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingEntry> findById(
            @PathVariable String bookingId,
            @RequestHeader(ReservationConstants.USER_ID_HEADER) String userId,
            @RequestHeader(value = ReservationConstants.USER_ROLE_HEADER, required = false) String role) {

        log.debug("GET /v1/bookings/{}", bookingId);
        return ResponseEntity.ok(bookingService.findById(bookingId, CallerIdentity.of(userId, role)));
    }

    /**
     * Passenger-initiated cancellation. Always runs with the user's refund ratio
     * and cancellation window, whatever the caller's role.
     */
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<CancellationResponse> cancel(
            @PathVariable String bookingId,
            @RequestHeader(ReservationConstants.USER_ID_HEADER) String userId) {

        log.info("POST /v1/bookings/{}/cancel - user={}", bookingId, userId);
        CallerIdentity caller = CallerIdentity.of(userId, null);
        return ResponseEntity.ok(bookingService.cancelBooking(bookingId, caller));
    }
}
