package com.kiisha.ai.gateway.auth;

import com.kiisha.ai.common.model.Role;
import com.kiisha.ai.gateway.MutableClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdminGrantTest {

    private final StaticCapabilityCheck capabilities = StaticCapabilityCheck.builder()
            .superuser("root")
            .role("org-1", "alice", Role.EDITOR)
            .build();

    @Test
    void testIssue_superuser() throws AuthorizationException {
        MutableClock clock = MutableClock.at("2025-01-01T00:00:00Z");
        AdminGrant grant = AdminGrant.issue("root", capabilities, clock);

        assertEquals("root", grant.getUserId());
        assertEquals(clock.instant(), grant.getIssuedAt());
    }

    @Test
    void testIssue_nonSuperuserRefused() {
        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> AdminGrant.issue("alice", capabilities));
        assertEquals("alice", e.getUserId());
        assertEquals(AdminGrant.CAPABILITY, e.getRequiredCapability());
    }

    @Test
    void testIssue_nullUserRefused() {
        assertThrows(AuthorizationException.class, () -> AdminGrant.issue(null, capabilities));
    }

    @Test
    void testStaticCapabilityCheck_rolesAreScopedByOrg() {
        assertEquals(Role.EDITOR, capabilities.resolveRole("alice", "org-1").orElseThrow());
        assertTrue(capabilities.resolveRole("alice", "org-2").isEmpty());
        assertTrue(StaticCapabilityCheck.empty().resolveRole("alice", "org-1").isEmpty());
        assertFalse(StaticCapabilityCheck.empty().isSuperuser("root"));
    }
}
