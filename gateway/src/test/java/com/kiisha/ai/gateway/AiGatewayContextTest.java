package com.kiisha.ai.gateway;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.gateway.audit.InMemoryAuditStore;
import com.kiisha.ai.gateway.auth.StaticCapabilityCheck;
import com.kiisha.ai.gateway.budget.InMemoryBudgetStore;
import com.kiisha.ai.gateway.config.GatewaySettings;
import com.kiisha.ai.gateway.confirmation.ConfirmationRequest;
import com.kiisha.ai.gateway.confirmation.ConfirmationResult;
import com.kiisha.ai.gateway.confirmation.ConfirmationStatus;
import com.kiisha.ai.gateway.confirmation.InMemoryConfirmationStore;
import com.kiisha.ai.gateway.providers.AiMessage;
import com.kiisha.ai.gateway.providers.ProviderId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AiGatewayContext wiring and lifecycle.
 */
class AiGatewayContextTest {

    private AiGatewayContext context;
    private MutableClock clock;
    private InMemoryConfirmationStore confirmationStore;

    private AiGatewayContext start(Map<String, String> environment) {
        clock = MutableClock.at("2025-05-05T12:00:00Z");
        confirmationStore = new InMemoryConfirmationStore();
        context = new AiGatewayContext(
                GatewaySettings.builder().workerThreads(2).confirmationExpiryMinutes(5).build(),
                StaticCapabilityCheck.empty(),
                environment::get,
                new InMemoryBudgetStore(),
                confirmationStore,
                new InMemoryAuditStore(),
                clock);
        return context;
    }

    @AfterEach
    void tearDown() {
        if (context != null) {
            context.shutdown();
        }
    }

    @Test
    void testContext_registersProvidersWithKeys() {
        start(Map.of(
                "OPENAI_API_KEY", "sk-test",
                "FORGE_API_KEY", "forge-key",
                "FORGE_API_BASE_URL", "https://forge.internal/v1"));

        assertTrue(context.getProviderRegistry().isAvailable(ProviderId.OPENAI));
        assertTrue(context.getProviderRegistry().isAvailable(ProviderId.FORGE));
        assertFalse(context.getProviderRegistry().getProvider(ProviderId.ANTHROPIC).isPresent());
        assertTrue(context.isRunning());
    }

    @Test
    void testContext_forgeWithoutEndpointUnavailable() {
        start(Map.of("FORGE_API_KEY", "forge-key"));
        assertFalse(context.getProviderRegistry().isAvailable(ProviderId.FORGE));
    }

    @Test
    void testContext_loadsBundledRouting() {
        start(Map.of());
        assertEquals(ProviderId.FORGE, context.getRouter().getRoutingConfig().getDefaultProvider());
        assertTrue(context.getRouter().getRoutingConfig().getTaskRouting(AiTask.INTENT_CLASSIFY).isPresent());
    }

    @Test
    void testContext_noProvidersGivesStructuredFailure() {
        start(Map.of());

        GatewayResponse response = context.getGatewayTasks().classifyIntent("hello", "u1", "o1");

        assertFalse(response.isSuccess());
        assertEquals(GatewayErrorCode.NO_PROVIDER_AVAILABLE, response.getErrorCode());
    }

    @Test
    void testRunMaintenance_expiresConfirmationsPastSettingsExpiry() {
        start(Map.of());
        ConfirmationResult created = context.getConfirmationGate().create(ConfirmationRequest.builder()
                .userId("u1")
                .orgId("o1")
                .actionType("delete_document")
                .actionDescription("Delete the old lease")
                .build());

        clock.advance(Duration.ofMinutes(4));
        context.runMaintenance();
        assertEquals(ConfirmationStatus.PENDING,
                confirmationStore.find(created.getConfirmationId()).orElseThrow().getStatus());

        clock.advance(Duration.ofMinutes(2));
        context.runMaintenance();
        assertEquals(ConfirmationStatus.EXPIRED,
                confirmationStore.find(created.getConfirmationId()).orElseThrow().getStatus());
    }

    @Test
    void testShutdown_idempotent() {
        start(Map.of());
        context.shutdown();
        assertFalse(context.isRunning());
        assertTrue(context.getExecutorService().isShutdown());
        context.shutdown();
    }

    @Test
    void testContext_gatewayRunsWithoutAuditFailure() {
        start(Map.of());
        GatewayResponse response = context.getGateway().runTask(GatewayRequest.builder()
                .taskName("NOT_A_TASK")
                .addMessage(AiMessage.user("x"))
                .userId("u1")
                .orgId("o1")
                .build());
        assertEquals(GatewayErrorCode.UNKNOWN_TASK, response.getErrorCode());
    }
}
