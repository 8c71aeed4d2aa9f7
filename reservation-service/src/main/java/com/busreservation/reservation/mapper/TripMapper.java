package com.busreservation.reservation.mapper;

import com.busreservation.reservation.dto.TripEntry;
import com.busreservation.reservation.model.TripInstance;

import java.util.ArrayList;
import java.util.List;

public final class TripMapper {

    private TripMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static TripEntry toEntry(TripInstance trip) {
        if (trip == null) {
            return null;
        }

        return TripEntry.builder()
                .tripId(trip.getTripId())
                .busId(trip.getBusId())
                .routeId(trip.getRouteId())
                .operatorId(trip.getOperatorId())
                .busNumber(trip.getBusNumber())
                .origin(trip.getOrigin())
                .destination(trip.getDestination())
                .serviceDate(trip.getServiceDate())
                .departureTime(trip.getDepartureTime())
                .arrivalTime(trip.getArrivalTime())
                .price(trip.getPrice())
                .totalSeats(trip.getTotalSeats())
                .availableSeats(trip.getAvailableSeats())
                .status(trip.getStatus() != null ? trip.getStatus().name() : null)
                .cancelledAt(trip.getCancelledAt())
                .build();
    }

    public static List<TripEntry> toEntryList(List<TripInstance> trips) {
        if (trips == null || trips.isEmpty()) {
            return new ArrayList<>();
        }

        List<TripEntry> result = new ArrayList<>(trips.size());
        for (TripInstance trip : trips) {
            result.add(toEntry(trip));
        }
        return result;
    }
}
