package com.busreservation.reservation.repository;

import com.busreservation.reservation.model.SeatClaim;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SeatClaimRepository extends JpaRepository<SeatClaim, Long> {

    @Query("SELECT c.seatNumber FROM SeatClaim c WHERE c.tripId = :tripId AND c.releasedAt IS NULL")
    List<String> findActiveSeatNumbers(@Param("tripId") String tripId);

    @Query("SELECT c.seatNumber FROM SeatClaim c WHERE c.tripId = :tripId AND c.releasedAt IS NULL " +
            "AND c.seatNumber IN :seatNumbers")
    List<String> findActiveSeatNumbersIn(@Param("tripId") String tripId,
                                         @Param("seatNumbers") Collection<String> seatNumbers);

    @Query("SELECT c FROM SeatClaim c WHERE c.tripId = :tripId AND c.bookingId = :bookingId " +
            "AND c.releasedAt IS NULL ORDER BY c.seatOrder")
    List<SeatClaim> findActiveByTripIdAndBookingId(@Param("tripId") String tripId,
                                                   @Param("bookingId") String bookingId);

    @Query("SELECT COUNT(c) FROM SeatClaim c WHERE c.tripId = :tripId AND c.releasedAt IS NULL")
    long countActiveByTripId(@Param("tripId") String tripId);

    List<SeatClaim> findByBookingIdOrderBySeatOrder(String bookingId);

    List<SeatClaim> findByBookingIdInOrderBySeatOrder(Collection<String> bookingIds);
}
