package com.busreservation.reservation.controller.v1;

import com.busreservation.reservation.constants.ReservationConstants;
import com.busreservation.reservation.dto.BookingEntry;
import com.busreservation.reservation.dto.CallerIdentity;
import com.busreservation.reservation.dto.CancellationResponse;
import com.busreservation.reservation.dto.PageResponse;
import com.busreservation.reservation.dto.TripCancellationResult;
import com.busreservation.reservation.dto.TripEntry;
import com.busreservation.reservation.dto.TripRequest;
import com.busreservation.reservation.enums.BookingStatus;
import com.busreservation.reservation.service.BookingService;
import com.busreservation.reservation.service.TripLifecycleService;
import com.busreservation.reservation.service.TripService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * Admin operations. Every endpoint requires the ADMIN role header.
 */
@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final TripService tripService;
    private final TripLifecycleService tripLifecycleService;
    private final BookingService bookingService;

    @PostMapping("/trips")
    public ResponseEntity<TripEntry> createTrip(
            @Valid @RequestBody TripRequest request,
            @RequestHeader(ReservationConstants.USER_ID_HEADER) String userId,
            @RequestHeader(value = ReservationConstants.USER_ROLE_HEADER, required = false) String role) {

        CallerIdentity.of(userId, role).requireAdmin();
        log.info("POST /v1/admin/trips - bus={}, route={}, date={}",
                request.getBusId(), request.getRouteId(), request.getServiceDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(tripService.createTrip(request));
    }

    @GetMapping("/trips")
    public ResponseEntity<PageResponse<TripEntry>> findTrips(
            @RequestHeader(ReservationConstants.USER_ID_HEADER) String userId,
            @RequestHeader(value = ReservationConstants.USER_ROLE_HEADER, required = false) String role,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + ReservationConstants.DEFAULT_PAGE_SIZE) int size) {

        CallerIdentity.of(userId, role).requireAdmin();
        log.debug("GET /v1/admin/trips - date={}, page={}, size={}", date, page, size);
        return ResponseEntity.ok(tripService.findTrips(date, page, size));
    }

    @PutMapping("/trips/{tripId}/cancel")
    public ResponseEntity<TripCancellationResult> cancelTrip(
            @PathVariable String tripId,
            @RequestHeader(ReservationConstants.USER_ID_HEADER) String userId,
            @RequestHeader(value = ReservationConstants.USER_ROLE_HEADER, required = false) String role) {

        CallerIdentity.of(userId, role).requireAdmin();
        log.info("PUT /v1/admin/trips/{}/cancel - admin={}", tripId, userId);
        return ResponseEntity.ok(tripLifecycleService.cancelTrip(tripId));
    }

    @PostMapping("/bookings/{bookingId}/cancel")
    public ResponseEntity<CancellationResponse> cancelBooking(
            @PathVariable String bookingId,
            @RequestHeader(ReservationConstants.USER_ID_HEADER) String userId,
            @RequestHeader(value = ReservationConstants.USER_ROLE_HEADER, required = false) String role) {

        CallerIdentity caller = CallerIdentity.of(userId, role);
        caller.requireAdmin();
        log.info("POST /v1/admin/bookings/{}/cancel - admin={}", bookingId, userId);
        return ResponseEntity.ok(bookingService.cancelBooking(bookingId, caller));
    }

    @GetMapping("/bookings")
    public ResponseEntity<PageResponse<BookingEntry>> findBookings(
            @RequestHeader(ReservationConstants.USER_ID_HEADER) String userId,
            @RequestHeader(value = ReservationConstants.USER_ROLE_HEADER, required = false) String role,
            @RequestParam(required = false) BookingStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + ReservationConstants.DEFAULT_PAGE_SIZE) int size) {

        CallerIdentity.of(userId, role).requireAdmin();
        log.debug("GET /v1/admin/bookings - status={}, page={}, size={}", status, page, size);
        return ResponseEntity.ok(bookingService.findAll(status, page, size));
    }
}
