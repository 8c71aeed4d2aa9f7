package com.busreservation.reservation.controller.v1;

import com.busreservation.reservation.dto.SeatMapResponse;
import com.busreservation.reservation.dto.TripEntry;
import com.busreservation.reservation.service.TripService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/v1/trips")
@RequiredArgsConstructor
@Slf4j
public class TripController {

    private final TripService tripService;

    @GetMapping("/search")
    public ResponseEntity<List<TripEntry>> search(
            @RequestParam String origin,
            @RequestParam String destination,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        log.info("GET /v1/trips/search - {} -> {} on {}", origin, destination, date);
        return ResponseEntity.ok(tripService.searchTrips(origin, destination, date));
    }

    @GetMapping("/{tripId}")
    public ResponseEntity<TripEntry> findById(@PathVariable String tripId) {
        log.debug("GET /v1/trips/{}", tripId);
        return ResponseEntity.ok(tripService.getTrip(tripId));
    }

    @GetMapping("/{tripId}/seats")
    public ResponseEntity<SeatMapResponse> seatMap(@PathVariable String tripId) {
        log.debug("GET /v1/trips/{}/seats", tripId);
        return ResponseEntity.ok(tripService.getSeatMap(tripId));
    }
}
