package com.busreservation.reservation.dto;

import com.busreservation.reservation.enums.CallerRole;
import com.busreservation.reservation.exception.ForbiddenOperationException;
import com.busreservation.reservation.exception.ReservationValidationException;
import com.busreservation.reservation.constants.ValidationMessages;
import org.springframework.util.StringUtils;

/**
 * Authenticated caller as asserted by the identity provider (gateway headers).
 */
public record CallerIdentity(String userId, CallerRole role) {

    public static CallerIdentity of(String userId, String role) {
        if (!StringUtils.hasText(userId)) {
            throw new ReservationValidationException(ValidationMessages.USER_ID_REQUIRED);
        }
        CallerRole callerRole = StringUtils.hasText(role) && CallerRole.ADMIN.name().equalsIgnoreCase(role.trim())
                ? CallerRole.ADMIN
                : CallerRole.USER;
        return new CallerIdentity(userId.trim(), callerRole);
    }

    public static CallerIdentity user(String userId) {
        return new CallerIdentity(userId, CallerRole.USER);
    }

    public static CallerIdentity admin(String userId) {
        return new CallerIdentity(userId, CallerRole.ADMIN);
    }

    public boolean isAdmin() {
        return role == CallerRole.ADMIN;
    }

    public void requireAdmin() {
        if (!isAdmin()) {
            throw new ForbiddenOperationException("Admin access required");
        }
    }
}
