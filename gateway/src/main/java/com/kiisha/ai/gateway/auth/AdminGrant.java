package com.kiisha.ai.gateway.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Evidence that a superuser check passed for a user. Administrative operations
 * refuse to run without one, and the only way to obtain one is {@link #issue}.
 */
public final class AdminGrant {

    public static final String CAPABILITY = "superuser";

    private final String userId;
    private final Instant issuedAt;

    private AdminGrant(String userId, Instant issuedAt) {
        this.userId = userId;
        this.issuedAt = issuedAt;
    }

    public static AdminGrant issue(String userId, CapabilityCheck capabilityCheck)
            throws AuthorizationException {
        return issue(userId, capabilityCheck, Clock.systemUTC());
    }

    public static AdminGrant issue(String userId, CapabilityCheck capabilityCheck, Clock clock)
            throws AuthorizationException {
        Objects.requireNonNull(capabilityCheck, "capabilityCheck");
        if (userId == null || !capabilityCheck.isSuperuser(userId)) {
            throw new AuthorizationException("User is not a superuser: " + userId, userId, CAPABILITY);
        }
        return new AdminGrant(userId, clock.instant());
    }

    public String getUserId() {
        return userId;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    @Override
    public String toString() {
        return "AdminGrant{userId='" + userId + "', issuedAt=" + issuedAt + '}';
    }
}
