package com.cred.freestyle.eventbooking.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Static access to the calling user's id, as set by {@link HeaderAuthenticationFilter}.
 *
 * @author Event Booking Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * @return the caller id, or null for anonymous requests
     */
    public static String getCurrentUserId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || auth instanceof AnonymousAuthenticationToken || !auth.isAuthenticated()) {
            return null;
        }
        return auth.getName();
    }

    /**
     * Caller id for operations that act on the caller's own bookings.
     *
     * @throws AccessDeniedException when the request carries no identity
     */
    public static String requireCurrentUserId() {
        String userId = getCurrentUserId();
        if (userId == null) {
            throw new AccessDeniedException("User not authenticated");
        }
        return userId;
    }
}
