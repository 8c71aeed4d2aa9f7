package com.busreservation.reservation.repository;

import com.busreservation.reservation.enums.TripStatus;
import com.busreservation.reservation.model.TripInstance;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TripInstanceRepository extends JpaRepository<TripInstance, Long> {

    Optional<TripInstance> findByTripId(String tripId);

    boolean existsByTripId(String tripId);

    List<TripInstance> findByOriginIgnoreCaseAndDestinationIgnoreCaseAndServiceDateAndStatusOrderByDepartureTimeAsc(
            String origin, String destination, LocalDate serviceDate, TripStatus status);

    Page<TripInstance> findByServiceDate(LocalDate serviceDate, Pageable pageable);

    List<TripInstance> findByStatusInAndServiceDateLessThanEqual(Collection<TripStatus> statuses, LocalDate date);

    @Query("SELECT t.availableSeats FROM TripInstance t WHERE t.tripId = :tripId")
    Optional<Integer> findAvailableSeats(@Param("tripId") String tripId);

    /**
     * Takes seats only while the trip is still scheduled and has enough left.
     * Returns 0 when either condition fails.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE TripInstance t SET t.availableSeats = t.availableSeats - :seats, t.version = t.version + 1 " +
            "WHERE t.tripId = :tripId AND t.availableSeats >= :seats AND t.status = :status")
    int reserveSeats(@Param("tripId") String tripId, @Param("seats") int seats, @Param("status") TripStatus status);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE TripInstance t SET t.availableSeats = t.availableSeats + :seats, t.version = t.version + 1 " +
            "WHERE t.tripId = :tripId AND t.availableSeats + :seats <= t.totalSeats")
    int restoreSeats(@Param("tripId") String tripId, @Param("seats") int seats);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE TripInstance t SET t.availableSeats = :seats, t.version = t.version + 1 " +
            "WHERE t.tripId = :tripId AND t.totalSeats >= :seats")
    int overwriteAvailableSeats(@Param("tripId") String tripId, @Param("seats") int seats);
}
