package com.busreservation.reservation.service;

import com.busreservation.reservation.client.CatalogServiceClient;
import com.busreservation.reservation.constants.ValidationMessages;
import com.busreservation.reservation.dto.BusEntry;
import com.busreservation.reservation.dto.PageResponse;
import com.busreservation.reservation.dto.RouteEntry;
import com.busreservation.reservation.dto.SeatMapEntry;
import com.busreservation.reservation.dto.SeatMapResponse;
import com.busreservation.reservation.dto.TripEntry;
import com.busreservation.reservation.dto.TripRequest;
import com.busreservation.reservation.enums.TripStatus;
import com.busreservation.reservation.exception.CatalogEntryNotFoundException;
import com.busreservation.reservation.exception.ReservationValidationException;
import com.busreservation.reservation.mapper.TripMapper;
import com.busreservation.reservation.model.TripInstance;
import com.busreservation.reservation.repository.TripInstanceRepository;
import com.busreservation.reservation.util.IdGenerator;
import com.busreservation.reservation.util.PageRequests;
import com.busreservation.reservation.util.SeatNumbers;
import com.busreservation.reservation.validator.ReservationValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class TripService {

    private static final Sort LISTING_ORDER = Sort.by(Sort.Order.desc("serviceDate"), Sort.Order.asc("departureTime"));

    private final TripInstanceRepository tripRepository;
    private final TripInventoryService tripInventoryService;
    private final SeatLedgerService seatLedgerService;
    private final CatalogServiceClient catalogServiceClient;
    private final Clock clock;

    /**
     * Schedules a trip instance for a catalog bus on a catalog route. The trip
     * starts with every seat available.
     */
    @Transactional
    public TripEntry createTrip(TripRequest request) {
        validateTripRequest(request);

        BusEntry bus = catalogServiceClient.getBus(request.getBusId())
                .filter(BusEntry::isActive)
                .orElseThrow(() -> CatalogEntryNotFoundException.bus(request.getBusId()));
        RouteEntry route = catalogServiceClient.getRoute(request.getRouteId())
                .filter(RouteEntry::isActive)
                .orElseThrow(() -> CatalogEntryNotFoundException.route(request.getRouteId()));

        if (bus.getTotalSeats() == null || bus.getTotalSeats() <= 0) {
            throw new ReservationValidationException(ValidationMessages.BUS_SEATS_POSITIVE);
        }

        TripInstance trip = TripInstance.builder()
                .tripId(IdGenerator.generateTripId())
                .busId(bus.getBusId())
                .routeId(route.getRouteId())
                .operatorId(bus.getOperatorId())
                .busNumber(bus.getBusNumber())
                .origin(route.getOrigin())
                .destination(route.getDestination())
                .serviceDate(request.getServiceDate())
                .departureTime(request.getDepartureTime())
                .arrivalTime(request.getArrivalTime())
                .price(request.getPrice())
                .totalSeats(bus.getTotalSeats())
                .availableSeats(bus.getTotalSeats())
                .status(TripStatus.SCHEDULED)
                .build();

        TripInstance saved = tripRepository.save(trip);
        log.info("Trip created: tripId={}, {} -> {}, date={}, seats={}",
                saved.getTripId(), saved.getOrigin(), saved.getDestination(),
                saved.getServiceDate(), saved.getTotalSeats());
        return TripMapper.toEntry(saved);
    }

    /**
     * Scheduled trips between two places on one date, earliest departure first.
     * Place names match case-insensitively.
     */
    public List<TripEntry> searchTrips(String origin, String destination, LocalDate date) {
        ReservationValidator.validateId(origin, ValidationMessages.ORIGIN_REQUIRED);
        ReservationValidator.validateId(destination, ValidationMessages.DESTINATION_REQUIRED);
        if (date == null) {
            throw new ReservationValidationException(ValidationMessages.DATE_REQUIRED);
        }

        List<TripInstance> trips = tripRepository
                .findByOriginIgnoreCaseAndDestinationIgnoreCaseAndServiceDateAndStatusOrderByDepartureTimeAsc(
                        origin.trim(), destination.trim(), date, TripStatus.SCHEDULED);
        log.debug("Search {} -> {} on {}: {} trips", origin, destination, date, trips.size());
        return TripMapper.toEntryList(trips);
    }

    /**
     * Admin listing of trip instances in any status, latest service date first.
     * A null date lists every date.
     */
    public PageResponse<TripEntry> findTrips(LocalDate serviceDate, int page, int size) {
        Pageable pageable = PageRequests.of(page, size, LISTING_ORDER);
        Page<TripInstance> trips = serviceDate == null
                ? tripRepository.findAll(pageable)
                : tripRepository.findByServiceDate(serviceDate, pageable);
        return PageResponse.of(trips.map(TripMapper::toEntry));
    }

    public TripEntry getTrip(String tripId) {
        ReservationValidator.validateId(tripId, ValidationMessages.TRIP_ID_REQUIRED);
        TripInstance trip = tripInventoryService.getTrip(tripId);
        TripEntry entry = TripMapper.toEntry(trip);
        entry.setAvailableSeats(tripInventoryService.getAvailableSeats(tripId));
        return entry;
    }

    /**
     * Every seat on the bus with its booked flag, read from the seat ledger.
     */
    public SeatMapResponse getSeatMap(String tripId) {
        ReservationValidator.validateId(tripId, ValidationMessages.TRIP_ID_REQUIRED);
        TripInstance trip = tripInventoryService.getTrip(tripId);
        Set<String> booked = seatLedgerService.listActiveSeats(tripId);

        int totalSeats = trip.getTotalSeats();
        List<SeatMapEntry> seats = new ArrayList<>(totalSeats);
        for (int i = 1; i <= totalSeats; i++) {
            String seatNumber = SeatNumbers.format(i);
            seats.add(SeatMapEntry.builder()
                    .seatNumber(seatNumber)
                    .booked(booked.contains(seatNumber))
                    .row(SeatNumbers.row(i))
                    .column(SeatNumbers.column(i))
                    .build());
        }

        return SeatMapResponse.builder()
                .tripId(tripId)
                .totalSeats(totalSeats)
                .availableSeats(totalSeats - booked.size())
                .seats(seats)
                .build();
    }

    private void validateTripRequest(TripRequest request) {
        if (request == null) {
            throw new ReservationValidationException(ValidationMessages.TRIP_DATA_REQUIRED);
        }
        ReservationValidator.validateId(request.getBusId(), ValidationMessages.BUS_ID_REQUIRED);
        ReservationValidator.validateId(request.getRouteId(), ValidationMessages.ROUTE_ID_REQUIRED);
        if (request.getServiceDate() == null) {
            throw new ReservationValidationException(ValidationMessages.SERVICE_DATE_REQUIRED);
        }
        if (request.getServiceDate().isBefore(LocalDate.now(clock))) {
            throw new ReservationValidationException(ValidationMessages.SERVICE_DATE_NOT_PAST);
        }
        if (request.getDepartureTime() == null) {
            throw new ReservationValidationException(ValidationMessages.DEPARTURE_TIME_REQUIRED);
        }
        if (request.getArrivalTime() == null) {
            throw new ReservationValidationException(ValidationMessages.ARRIVAL_TIME_REQUIRED);
        }
        if (request.getPrice() == null) {
            throw new ReservationValidationException(ValidationMessages.PRICE_REQUIRED);
        }
        if (request.getPrice().compareTo(BigDecimal.ZERO) < 0) {
            throw new ReservationValidationException(ValidationMessages.PRICE_NON_NEGATIVE);
        }
    }
}
