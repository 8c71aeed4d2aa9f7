package com.busreservation.reservation.exception;

/**
 * Thrown when the catalog does not know (or has deactivated) a bus or route.
 */
public class CatalogEntryNotFoundException extends ReservationException {

    private CatalogEntryNotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static CatalogEntryNotFoundException bus(String busId) {
        return new CatalogEntryNotFoundException("BUS_NOT_FOUND", "Bus not found: " + busId);
    }

    public static CatalogEntryNotFoundException route(String routeId) {
        return new CatalogEntryNotFoundException("ROUTE_NOT_FOUND", "Route not found: " + routeId);
    }
}
