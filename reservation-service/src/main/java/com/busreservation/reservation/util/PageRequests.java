package com.busreservation.reservation.util;

import com.busreservation.reservation.constants.ReservationConstants;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

public final class PageRequests {

    private PageRequests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Zero-based page. A non-positive size falls back to the default; larger sizes are capped.
     */
    public static PageRequest of(int page, int size, Sort sort) {
        return PageRequest.of(Math.max(0, page), normalizeSize(size), sort);
    }

    static int normalizeSize(int size) {
        if (size <= 0) {
            return ReservationConstants.DEFAULT_PAGE_SIZE;
        }
        return Math.min(size, ReservationConstants.MAX_PAGE_SIZE);
    }
}
