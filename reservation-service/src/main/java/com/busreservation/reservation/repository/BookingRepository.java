package com.busreservation.reservation.repository;

import com.busreservation.reservation.enums.BookingStatus;
import com.busreservation.reservation.model.Booking;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BookingRepository extends JpaRepository<Booking, String> {

    Page<Booking> findByUserId(String userId, Pageable pageable);

    Page<Booking> findByUserIdAndStatus(String userId, BookingStatus status, Pageable pageable);

    List<Booking> findByTripIdAndStatus(String tripId, BookingStatus status);

    Page<Booking> findByStatus(BookingStatus status, Pageable pageable);
}
