package com.busreservation.reservation.service;

import com.busreservation.reservation.dto.PassengerDetails;
import com.busreservation.reservation.enums.Gender;
import com.busreservation.reservation.exception.SeatUnavailableException;
import com.busreservation.reservation.model.SeatClaim;
import com.busreservation.reservation.repository.SeatClaimRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SeatLedgerService Unit Tests")
class SeatLedgerServiceTest {

    private static final String TRIP_ID = "TR0000000001";
    private static final String BOOKING_ID = "BK0000000001";

    @Mock
    private SeatClaimRepository claimRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    @InjectMocks
    private SeatLedgerService seatLedgerService;

    @Captor
    private ArgumentCaptor<List<SeatClaim>> claimsCaptor;

    private List<PassengerDetails> passengers;

    @BeforeEach
    void setUp() {
        passengers = List.of(
                PassengerDetails.builder().name("  Asha ").age(31).gender(Gender.FEMALE).build(),
                PassengerDetails.builder().name("Ravi").age(29).gender(Gender.MALE).build()
        );
        when(claimRepository.saveAllAndFlush(anyList())).thenAnswer(inv -> inv.getArgument(0));
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
    }

    @Nested
    @DisplayName("Claim Tests")
    class ClaimTests {

        @Test
        @DisplayName("Should create one active claim per seat in request order")
        void claim_FreeSeats_CreatesClaims() {
            when(claimRepository.findActiveSeatNumbersIn(TRIP_ID, List.of("03", "04"))).thenReturn(List.of());

            List<SeatClaim> claims = seatLedgerService.claim(TRIP_ID, BOOKING_ID, List.of("03", "04"), passengers);

            assertThat(claims).hasSize(2);
            assertThat(claims.get(0).getSeatNumber()).isEqualTo("03");
            assertThat(claims.get(0).getPassengerName()).isEqualTo("Asha");
            assertThat(claims.get(0).getActiveSeatKey()).isEqualTo(TRIP_ID + ":03");
            assertThat(claims.get(1).getSeatOrder()).isEqualTo(1);
            assertThat(claims).allMatch(SeatClaim::isActive);

            verify(claimRepository).saveAllAndFlush(claimsCaptor.capture());
            assertThat(claimsCaptor.getValue()).extracting(SeatClaim::getBookingId).containsOnly(BOOKING_ID);
        }

        @Test
        @DisplayName("Should name every contested seat and write nothing")
        void claim_SomeSeatsTaken_ThrowsWithContestedSeats() {
            when(claimRepository.findActiveSeatNumbersIn(eq(TRIP_ID), anyCollection()))
                    .thenReturn(List.of("04", "02"));

            assertThatThrownBy(() -> seatLedgerService.claim(TRIP_ID, BOOKING_ID, List.of("02", "03", "04"),
                    List.of(passengers.get(0), passengers.get(1), passengers.get(0))))
                    .isInstanceOf(SeatUnavailableException.class)
                    .satisfies(e -> assertThat(((SeatUnavailableException) e).getSeats())
                            .containsExactly("02", "04"));

            verify(claimRepository, never()).saveAllAndFlush(anyList());
        }

        @Test
        @DisplayName("Should translate unique-key violation into seat conflict")
        void claim_UniqueKeyViolation_ThrowsSeatUnavailable() {
            when(claimRepository.findActiveSeatNumbersIn(eq(TRIP_ID), anyCollection())).thenReturn(List.of());
            when(claimRepository.saveAllAndFlush(anyList()))
                    .thenThrow(new DataIntegrityViolationException("uk_seat_claim_active"));

            assertThatThrownBy(() -> seatLedgerService.claim(TRIP_ID, BOOKING_ID, List.of("03", "04"), passengers))
                    .isInstanceOf(SeatUnavailableException.class)
                    .hasCauseInstanceOf(DataIntegrityViolationException.class);
        }

        @Test
        @DisplayName("Should name only the seats another writer committed after a unique-key violation")
        void claim_UniqueKeyViolation_NamesContestedSeatsOnly() {
            when(claimRepository.findActiveSeatNumbersIn(eq(TRIP_ID), anyCollection()))
                    .thenReturn(List.of())
                    .thenReturn(List.of("04"));
            when(claimRepository.saveAllAndFlush(anyList()))
                    .thenThrow(new DataIntegrityViolationException("uk_seat_claim_active"));

            assertThatThrownBy(() -> seatLedgerService.claim(TRIP_ID, BOOKING_ID, List.of("03", "04"), passengers))
                    .isInstanceOfSatisfying(SeatUnavailableException.class,
                            e -> assertThat(e.getSeats()).containsExactly("04"));

            verify(transactionManager).getTransaction(any());
        }
    }

    @Nested
    @DisplayName("Release Tests")
    class ReleaseTests {

        @Test
        @DisplayName("Should release active claims and clear their seat keys")
        void release_ActiveClaims_ReleasesAll() {
            SeatClaim first = SeatClaim.builder().tripId(TRIP_ID).bookingId(BOOKING_ID).seatNumber("01")
                    .activeSeatKey(TRIP_ID + ":01").build();
            SeatClaim second = SeatClaim.builder().tripId(TRIP_ID).bookingId(BOOKING_ID).seatNumber("02")
                    .activeSeatKey(TRIP_ID + ":02").build();
            when(claimRepository.findActiveByTripIdAndBookingId(TRIP_ID, BOOKING_ID))
                    .thenReturn(List.of(first, second));
            LocalDateTime when = LocalDateTime.of(2026, 3, 1, 8, 0);

            int released = seatLedgerService.release(TRIP_ID, BOOKING_ID, when);

            assertThat(released).isEqualTo(2);
            assertThat(first.isActive()).isFalse();
            assertThat(first.getActiveSeatKey()).isNull();
            assertThat(second.getReleasedAt()).isEqualTo(when);
            verify(claimRepository).saveAll(List.of(first, second));
        }

        @Test
        @DisplayName("Should release nothing when booking holds no claims")
        void release_NoClaims_ReturnsZero() {
            when(claimRepository.findActiveByTripIdAndBookingId(TRIP_ID, BOOKING_ID)).thenReturn(List.of());

            assertThat(seatLedgerService.release(TRIP_ID, BOOKING_ID, LocalDateTime.now())).isZero();
            verify(claimRepository, never()).saveAll(anyList());
        }
    }

    @Test
    @DisplayName("Should list active seats sorted")
    void listActiveSeats_ReturnsSortedSet() {
        when(claimRepository.findActiveSeatNumbers(TRIP_ID)).thenReturn(List.of("10", "02", "07"));

        assertThat(seatLedgerService.listActiveSeats(TRIP_ID)).containsExactly("02", "07", "10");
    }

    @Test
    @DisplayName("Should skip lookup for empty booking list")
    void findByBookings_Empty_ReturnsEmpty() {
        assertThat(seatLedgerService.findByBookings(List.of())).isEmpty();
        verifyNoInteractions(claimRepository);
    }
}
