package com.busreservation.reservation.service;

import com.busreservation.reservation.client.CatalogServiceClient;
import com.busreservation.reservation.dto.BusEntry;
import com.busreservation.reservation.dto.PageResponse;
import com.busreservation.reservation.dto.RouteEntry;
import com.busreservation.reservation.dto.SeatMapResponse;
import com.busreservation.reservation.dto.TripEntry;
import com.busreservation.reservation.dto.TripRequest;
import com.busreservation.reservation.enums.TripStatus;
import com.busreservation.reservation.exception.CatalogEntryNotFoundException;
import com.busreservation.reservation.exception.ReservationValidationException;
import com.busreservation.reservation.exception.ServiceUnavailableException;
import com.busreservation.reservation.model.TripInstance;
import com.busreservation.reservation.repository.TripInstanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("TripService Unit Tests")
class TripServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);

    @Mock
    private TripInstanceRepository tripRepository;

    @Mock
    private TripInventoryService tripInventoryService;

    @Mock
    private SeatLedgerService seatLedgerService;

    @Mock
    private CatalogServiceClient catalogServiceClient;

    private TripService tripService;
    private TripRequest validRequest;
    private BusEntry bus;
    private RouteEntry route;

    @BeforeEach
    void setUp() {
        tripService = new TripService(tripRepository, tripInventoryService, seatLedgerService,
                catalogServiceClient, CLOCK);

        validRequest = TripRequest.builder()
                .busId("BUS-1")
                .routeId("ROUTE-1")
                .serviceDate(LocalDate.of(2026, 3, 5))
                .departureTime(LocalTime.of(22, 0))
                .arrivalTime(LocalTime.of(6, 0))
                .price(new BigDecimal("750.00"))
                .build();
        bus = BusEntry.builder().busId("BUS-1").operatorId("OP-1").busNumber("MH12AB1234")
                .busType("SLEEPER").totalSeats(36).active(true).build();
        route = RouteEntry.builder().routeId("ROUTE-1").origin("Pune").destination("Goa")
                .distanceKm(450.0).estimatedDurationHours(8.0).active(true).build();

        when(catalogServiceClient.getBus("BUS-1")).thenReturn(Optional.of(bus));
        when(catalogServiceClient.getRoute("ROUTE-1")).thenReturn(Optional.of(route));
        when(tripRepository.save(any(TripInstance.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    @DisplayName("Create Trip Tests")
    class CreateTripTests {

        @Test
        @DisplayName("Should create scheduled trip with every seat available")
        void createTrip_ValidRequest_CreatesTrip() {
            TripEntry entry = tripService.createTrip(validRequest);

            assertThat(entry.getTripId()).startsWith("TR");
            assertThat(entry.getStatus()).isEqualTo("SCHEDULED");
            assertThat(entry.getTotalSeats()).isEqualTo(36);
            assertThat(entry.getAvailableSeats()).isEqualTo(36);
            assertThat(entry.getOrigin()).isEqualTo("Pune");
            assertThat(entry.getDestination()).isEqualTo("Goa");
            assertThat(entry.getOperatorId()).isEqualTo("OP-1");
        }

        @Test
        @DisplayName("Should reject unknown bus")
        void createTrip_UnknownBus_ThrowsNotFound() {
            when(catalogServiceClient.getBus("BUS-1")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> tripService.createTrip(validRequest))
                    .isInstanceOf(CatalogEntryNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "BUS_NOT_FOUND");
            verify(tripRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should treat inactive route as missing")
        void createTrip_InactiveRoute_ThrowsNotFound() {
            route.setActive(false);

            assertThatThrownBy(() -> tripService.createTrip(validRequest))
                    .isInstanceOf(CatalogEntryNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "ROUTE_NOT_FOUND");
        }

        @Test
        @DisplayName("Should reject service date in the past")
        void createTrip_PastDate_ThrowsValidation() {
            validRequest.setServiceDate(LocalDate.of(2026, 2, 28));

            assertThatThrownBy(() -> tripService.createTrip(validRequest))
                    .isInstanceOf(ReservationValidationException.class)
                    .hasMessageContaining("past");
            verifyNoInteractions(catalogServiceClient);
        }

        @Test
        @DisplayName("Should reject negative price")
        void createTrip_NegativePrice_ThrowsValidation() {
            validRequest.setPrice(new BigDecimal("-1.00"));

            assertThatThrownBy(() -> tripService.createTrip(validRequest))
                    .isInstanceOf(ReservationValidationException.class);
        }

        @Test
        @DisplayName("Should reject bus without seats")
        void createTrip_BusWithoutSeats_ThrowsValidation() {
            bus.setTotalSeats(0);

            assertThatThrownBy(() -> tripService.createTrip(validRequest))
                    .isInstanceOf(ReservationValidationException.class);
        }

        @Test
        @DisplayName("Should propagate catalog outage")
        void createTrip_CatalogDown_ThrowsServiceUnavailable() {
            when(catalogServiceClient.getBus(anyString()))
                    .thenThrow(new ServiceUnavailableException("Catalog service unavailable"));

            assertThatThrownBy(() -> tripService.createTrip(validRequest))
                    .isInstanceOf(ServiceUnavailableException.class)
                    .hasFieldOrPropertyWithValue("retryable", true);
        }
    }

    @Nested
    @DisplayName("Search Tests")
    class SearchTests {

        @Test
        @DisplayName("Should search scheduled trips only")
        void searchTrips_DelegatesWithScheduledStatus() {
            LocalDate date = LocalDate.of(2026, 3, 5);
            TripInstance trip = TripInstance.builder().tripId("TR1").origin("Pune").destination("Goa")
                    .serviceDate(date).departureTime(LocalTime.of(22, 0)).status(TripStatus.SCHEDULED).build();
            when(tripRepository.findByOriginIgnoreCaseAndDestinationIgnoreCaseAndServiceDateAndStatusOrderByDepartureTimeAsc(
                    "pune", "goa", date, TripStatus.SCHEDULED)).thenReturn(List.of(trip));

            List<TripEntry> results = tripService.searchTrips(" pune ", "goa", date);

            assertThat(results).extracting(TripEntry::getTripId).containsExactly("TR1");
        }

        @Test
        @DisplayName("Should require a date")
        void searchTrips_MissingDate_ThrowsValidation() {
            assertThatThrownBy(() -> tripService.searchTrips("Pune", "Goa", null))
                    .isInstanceOf(ReservationValidationException.class);
        }
    }

    @Nested
    @DisplayName("Listing Tests")
    class ListingTests {

        @Test
        @DisplayName("Should list trips in every status for one date")
        void findTrips_WithDate_FiltersByServiceDate() {
            LocalDate date = LocalDate.of(2026, 3, 5);
            TripInstance cancelled = TripInstance.builder().tripId("TR1").serviceDate(date)
                    .status(TripStatus.CANCELLED).build();
            TripInstance running = TripInstance.builder().tripId("TR2").serviceDate(date)
                    .status(TripStatus.RUNNING).build();
            when(tripRepository.findByServiceDate(eq(date), any(Pageable.class)))
                    .thenReturn(new PageImpl<>(List.of(cancelled, running), PageRequest.of(0, 20), 2));

            PageResponse<TripEntry> page = tripService.findTrips(date, 0, 20);

            assertThat(page.getContent()).extracting(TripEntry::getStatus).containsExactly("CANCELLED", "RUNNING");
            assertThat(page.getTotalElements()).isEqualTo(2);
            verify(tripRepository, never()).findAll(any(Pageable.class));
        }

        @Test
        @DisplayName("Should list every date latest first with a capped page size")
        void findTrips_NoDate_ListsAll() {
            when(tripRepository.findAll(any(Pageable.class))).thenReturn(new PageImpl<>(List.of()));

            tripService.findTrips(null, 0, 1000);

            ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
            verify(tripRepository).findAll(captor.capture());
            assertThat(captor.getValue().getPageSize()).isEqualTo(100);
            assertThat(captor.getValue().getSort().getOrderFor("serviceDate").isDescending()).isTrue();
        }
    }

    @Nested
    @DisplayName("Seat Map Tests")
    class SeatMapTests {

        @Test
        @DisplayName("Should flag booked seats and lay out four per row")
        void getSeatMap_FlagsBookedSeats() {
            TripInstance trip = TripInstance.builder().tripId("TR1").totalSeats(8).availableSeats(6).build();
            when(tripInventoryService.getTrip("TR1")).thenReturn(trip);
            Set<String> booked = new TreeSet<>(List.of("02", "05"));
            when(seatLedgerService.listActiveSeats("TR1")).thenReturn(booked);

            SeatMapResponse map = tripService.getSeatMap("TR1");

            assertThat(map.getSeats()).hasSize(8);
            assertThat(map.getAvailableSeats()).isEqualTo(6);
            assertThat(map.getSeats().get(1).isBooked()).isTrue();
            assertThat(map.getSeats().get(4).getSeatNumber()).isEqualTo("05");
            assertThat(map.getSeats().get(4).getRow()).isEqualTo(2);
            assertThat(map.getSeats().get(4).getColumn()).isEqualTo(1);
            assertThat(map.getSeats().get(0).isBooked()).isFalse();
        }
    }

    @Test
    @DisplayName("Should report display availability from the inventory cache")
    void getTrip_UsesDisplayAvailability() {
        TripInstance trip = TripInstance.builder().tripId("TR1").totalSeats(40).availableSeats(40)
                .status(TripStatus.SCHEDULED).build();
        when(tripInventoryService.getTrip("TR1")).thenReturn(trip);
        when(tripInventoryService.getAvailableSeats("TR1")).thenReturn(31);

        assertThat(tripService.getTrip("TR1").getAvailableSeats()).isEqualTo(31);
    }
}
