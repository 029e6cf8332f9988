package com.kiisha.ai.gateway.admin;

import com.kiisha.ai.common.AiGatewayConstants;
import com.kiisha.ai.gateway.MutableClock;
import com.kiisha.ai.gateway.audit.AuditEntry;
import com.kiisha.ai.gateway.audit.InMemoryAuditStore;
import com.kiisha.ai.gateway.auth.AdminGrant;
import com.kiisha.ai.gateway.auth.AuthorizationException;
import com.kiisha.ai.gateway.auth.StaticCapabilityCheck;
import com.kiisha.ai.gateway.budget.BudgetLedger;
import com.kiisha.ai.gateway.budget.InMemoryBudgetStore;
import com.kiisha.ai.gateway.budget.OrgBudgetStatus;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.ProviderRegistry;
import com.kiisha.ai.gateway.routing.GlobalRoutingConfig;
import com.kiisha.ai.gateway.routing.Router;
import com.kiisha.ai.gateway.telemetry.CostTable;
import com.kiisha.ai.gateway.telemetry.TelemetryRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GatewayAdmin.
 */
class GatewayAdminTest {

    private MutableClock clock;
    private Router router;
    private BudgetLedger ledger;
    private InMemoryAuditStore auditStore;
    private GatewayAdmin admin;
    private AdminGrant grant;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2025-02-01T08:00:00Z");
        router = new Router(new ProviderRegistry(), GlobalRoutingConfig.defaults());
        ledger = new BudgetLedger(new InMemoryBudgetStore(), clock);
        auditStore = new InMemoryAuditStore();
        admin = new GatewayAdmin(router, ledger, new TelemetryRecorder(auditStore, CostTable.defaults(), clock));
        grant = AdminGrant.issue("root", StaticCapabilityCheck.builder().superuser("root").build(), clock);
    }

    // ========== Routing ==========

    @Test
    void testSetRoutingConfig_appliesAndAudits() throws Exception {
        GlobalRoutingConfig updated = GlobalRoutingConfig.defaults().toBuilder()
                .defaultProvider(ProviderId.OPENAI)
                .defaultModel("gpt-4o")
                .build();

        admin.setRoutingConfig(updated, grant);

        assertSame(updated, admin.getRoutingConfig());
        List<AuditEntry> audit = auditStore.getAuditLog();
        assertEquals(1, audit.size());
        assertEquals(AiGatewayConstants.AUDIT_CATEGORY_ADMIN, audit.get(0).getCategory());
        assertEquals(GatewayAdmin.EVENT_ROUTING_UPDATED, audit.get(0).getEventType());
        assertEquals("root", audit.get(0).getUserId());
    }

    @Test
    void testSetRoutingConfig_withoutGrantRefused() {
        GlobalRoutingConfig before = admin.getRoutingConfig();
        GlobalRoutingConfig updated = before.toBuilder().defaultProvider(ProviderId.OPENAI).build();

        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> admin.setRoutingConfig(updated, null));

        assertEquals(AdminGrant.CAPABILITY, e.getRequiredCapability());
        assertSame(before, admin.getRoutingConfig());
        assertTrue(auditStore.getAuditLog().isEmpty());
    }

    @Test
    void testSetRoutingConfig_invalidRejected() {
        GlobalRoutingConfig before = admin.getRoutingConfig();
        GlobalRoutingConfig invalid = before.toBuilder().defaultProvider(null).build();

        assertThrows(IllegalArgumentException.class, () -> admin.setRoutingConfig(invalid, grant));

        assertSame(before, admin.getRoutingConfig());
        assertFalse(auditStore.getAuditLog().get(0).isSuccess());
    }

    // ========== Budgets ==========

    @Test
    void testSetBudget_appliesAndAudits() throws Exception {
        admin.setBudget("org-1", 50_000, 90, true, grant);

        OrgBudgetStatus status = admin.getBudgetStatus("org-1");
        assertEquals(50_000, status.getAllocatedTokens());
        assertFalse(status.isUnlimited());
        assertEquals("org-1", auditStore.getAuditLog().get(0).getOrgId());
        assertEquals(GatewayAdmin.EVENT_BUDGET_UPDATED, auditStore.getAuditLog().get(0).getEventType());
    }

    @Test
    void testSetBudget_withoutGrantRefused() {
        assertThrows(AuthorizationException.class, () -> admin.setBudget("org-1", 50_000, 80, false, null));
        assertTrue(admin.getBudgetStatus("org-1").isUnlimited());
    }

    @Test
    void testGetUsageMetrics_emptyPeriod() {
        assertEquals(0, admin.getUsageMetrics("org-1").getCallCount());
    }
}
