package com.busreservation.reservation.service;

import com.busreservation.reservation.dto.PassengerDetails;
import com.busreservation.reservation.exception.SeatUnavailableException;
import com.busreservation.reservation.model.SeatClaim;
import com.busreservation.reservation.repository.SeatClaimRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Authoritative record of which seats are held on each trip, and by which booking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeatLedgerService {

    private final SeatClaimRepository claimRepository;
    private final PlatformTransactionManager transactionManager;

    public Set<String> listActiveSeats(String tripId) {
        return new TreeSet<>(claimRepository.findActiveSeatNumbers(tripId));
    }

    public long countActive(String tripId) {
        return claimRepository.countActiveByTripId(tripId);
    }

    /**
     * Claims every requested seat for the booking, or none of them.
     *
     * @throws SeatUnavailableException naming the requested seats that are already held
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<SeatClaim> claim(String tripId, String bookingId,
                                 List<String> seatNumbers, List<PassengerDetails> passengers) {
        Set<String> taken = new HashSet<>(claimRepository.findActiveSeatNumbersIn(tripId, seatNumbers));
        if (!taken.isEmpty()) {
            List<String> conflicting = seatNumbers.stream().filter(taken::contains).toList();
            log.warn("Seat claim rejected: tripId={}, bookingId={}, conflicting={}", tripId, bookingId, conflicting);
            throw new SeatUnavailableException(tripId, conflicting);
        }

        List<SeatClaim> claims = new ArrayList<>(seatNumbers.size());
        for (int i = 0; i < seatNumbers.size(); i++) {
            String seatNumber = seatNumbers.get(i);
            PassengerDetails passenger = passengers.get(i);
            claims.add(SeatClaim.builder()
                    .tripId(tripId)
                    .seatNumber(seatNumber)
                    .bookingId(bookingId)
                    .seatOrder(i)
                    .passengerName(passenger.getName().trim())
                    .passengerAge(passenger.getAge())
                    .passengerGender(passenger.getGender())
                    .activeSeatKey(SeatClaim.activeKey(tripId, seatNumber))
                    .build());
        }

        try {
            List<SeatClaim> saved = claimRepository.saveAllAndFlush(claims);
            log.debug("Claimed seats: tripId={}, bookingId={}, seats={}", tripId, bookingId, seatNumbers);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // another writer got past the lock (e.g. a second instance on local locks)
            List<String> conflicting = findCommittedConflicts(tripId, seatNumbers);
            log.warn("Seat claim hit unique constraint: tripId={}, bookingId={}, conflicting={}",
                    tripId, bookingId, conflicting);
            throw new SeatUnavailableException(tripId, conflicting, e);
        }
    }

    /**
     * Re-reads the contested seats outside the failed transaction, whose session can no
     * longer be queried. Falls back to the full request when the winner is not visible yet.
     */
    private List<String> findCommittedConflicts(String tripId, List<String> seatNumbers) {
        TransactionTemplate readTransaction = new TransactionTemplate(transactionManager);
        readTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        readTransaction.setReadOnly(true);

        List<String> held = readTransaction.execute(status ->
                claimRepository.findActiveSeatNumbersIn(tripId, seatNumbers));
        if (held == null || held.isEmpty()) {
            return seatNumbers;
        }
        Set<String> heldSet = new HashSet<>(held);
        return seatNumbers.stream().filter(heldSet::contains).toList();
    }

    /**
     * Releases every active claim the booking holds on the trip.
     *
     * @return number of seats released
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int release(String tripId, String bookingId, LocalDateTime when) {
        List<SeatClaim> claims = claimRepository.findActiveByTripIdAndBookingId(tripId, bookingId);
        if (claims.isEmpty()) {
            log.debug("No active claims to release: tripId={}, bookingId={}", tripId, bookingId);
            return 0;
        }

        claims.forEach(claim -> claim.release(when));
        claimRepository.saveAll(claims);

        log.debug("Released {} seats: tripId={}, bookingId={}", claims.size(), tripId, bookingId);
        return claims.size();
    }

    public List<SeatClaim> findByBooking(String bookingId) {
        return claimRepository.findByBookingIdOrderBySeatOrder(bookingId);
    }

    public List<SeatClaim> findByBookings(List<String> bookingIds) {
        if (bookingIds.isEmpty()) {
            return List.of();
        }
        return claimRepository.findByBookingIdInOrderBySeatOrder(bookingIds);
    }
}
