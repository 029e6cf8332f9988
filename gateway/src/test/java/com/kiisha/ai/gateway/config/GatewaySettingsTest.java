package com.kiisha.ai.gateway.config;

import com.kiisha.ai.common.AiGatewayConstants;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GatewaySettings.
 */
class GatewaySettingsTest {

    @Test
    void testFromProperties_emptyUsesDefaults() {
        GatewaySettings settings = GatewaySettings.fromProperties(new Properties());

        assertNull(settings.getRoutingConfigPath());
        assertEquals(AiGatewayConstants.DEFAULT_CONFIRMATION_EXPIRY_MINUTES, settings.getConfirmationExpiryMinutes());
        assertEquals(AiGatewayConstants.DEFAULT_SOFT_LIMIT_PERCENT, settings.getBudgetSoftLimitPercent());
        assertEquals(Duration.ofMillis(AiGatewayConstants.DEFAULT_SIDE_EFFECT_TIMEOUT_MS),
                settings.getSideEffectTimeout());
        assertTrue(settings.getWorkerThreads() >= 2);
    }

    @Test
    void testFromProperties_readsPrefixedKeys() {
        Properties properties = new Properties();
        properties.setProperty("kiisha.ai.routing.config", "/etc/kiisha/routing.json");
        properties.setProperty("kiisha.ai.confirmation.expiry.minutes", "15");
        properties.setProperty("kiisha.ai.budget.soft.limit.percent", "75");
        properties.setProperty("kiisha.ai.side.effect.timeout.ms", "500");
        properties.setProperty("kiisha.ai.worker.threads", "4");

        GatewaySettings settings = GatewaySettings.fromProperties(properties);

        assertEquals("/etc/kiisha/routing.json", settings.getRoutingConfigPath());
        assertEquals(Duration.ofMinutes(15), settings.getConfirmationExpiry());
        assertEquals(75, settings.getBudgetSoftLimitPercent());
        assertEquals(Duration.ofMillis(500), settings.getSideEffectTimeout());
        assertEquals(4, settings.getWorkerThreads());
    }

    @Test
    void testFromProperties_invalidValuesFallBack() {
        Properties properties = new Properties();
        properties.setProperty(GatewaySettings.CONFIRMATION_EXPIRY_MINUTES, "soon");
        properties.setProperty(GatewaySettings.BUDGET_SOFT_LIMIT_PERCENT, "150");
        properties.setProperty(GatewaySettings.WORKER_THREADS, "0");

        GatewaySettings settings = GatewaySettings.fromProperties(properties);

        assertEquals(AiGatewayConstants.DEFAULT_CONFIRMATION_EXPIRY_MINUTES, settings.getConfirmationExpiryMinutes());
        assertEquals(AiGatewayConstants.DEFAULT_SOFT_LIMIT_PERCENT, settings.getBudgetSoftLimitPercent());
        assertEquals(GatewaySettings.defaults().getWorkerThreads(), settings.getWorkerThreads());
    }
}
