package com.kiisha.ai.gateway.config;

import com.kiisha.ai.common.AiGatewayConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Properties;

/**
 * Startup settings for the gateway. Read from {@code kiisha.ai.*} system properties,
 * falling back to defaults for anything missing or unparsable.
 */
public final class GatewaySettings {

    private static final Logger logger = LoggerFactory.getLogger(GatewaySettings.class);

    public static final String ROUTING_CONFIG = AiGatewayConstants.PROPERTY_PREFIX + "routing.config";
    public static final String CONFIRMATION_EXPIRY_MINUTES =
            AiGatewayConstants.PROPERTY_PREFIX + "confirmation.expiry.minutes";
    public static final String BUDGET_SOFT_LIMIT_PERCENT =
            AiGatewayConstants.PROPERTY_PREFIX + "budget.soft.limit.percent";
    public static final String SIDE_EFFECT_TIMEOUT_MS = AiGatewayConstants.PROPERTY_PREFIX + "side.effect.timeout.ms";
    public static final String WORKER_THREADS = AiGatewayConstants.PROPERTY_PREFIX + "worker.threads";

    private final String routingConfigPath;
    private final int confirmationExpiryMinutes;
    private final int budgetSoftLimitPercent;
    private final long sideEffectTimeoutMs;
    private final int workerThreads;

    private GatewaySettings(Builder builder) {
        this.routingConfigPath = builder.routingConfigPath;
        this.confirmationExpiryMinutes = builder.confirmationExpiryMinutes;
        this.budgetSoftLimitPercent = builder.budgetSoftLimitPercent;
        this.sideEffectTimeoutMs = builder.sideEffectTimeoutMs;
        this.workerThreads = builder.workerThreads;
    }

    public static GatewaySettings defaults() {
        return builder().build();
    }

    public static GatewaySettings fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static GatewaySettings fromProperties(Properties properties) {
        Builder defaults = builder();
        return builder()
                .routingConfigPath(properties.getProperty(ROUTING_CONFIG))
                .confirmationExpiryMinutes(readInt(properties, CONFIRMATION_EXPIRY_MINUTES,
                        defaults.confirmationExpiryMinutes, 1, Integer.MAX_VALUE))
                .budgetSoftLimitPercent(readInt(properties, BUDGET_SOFT_LIMIT_PERCENT,
                        defaults.budgetSoftLimitPercent, 1, 100))
                .sideEffectTimeoutMs(readInt(properties, SIDE_EFFECT_TIMEOUT_MS,
                        (int) defaults.sideEffectTimeoutMs, 1, Integer.MAX_VALUE))
                .workerThreads(readInt(properties, WORKER_THREADS, defaults.workerThreads, 1, 256))
                .build();
    }

    private static int readInt(Properties properties, String key, int defaultValue, int min, int max) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min || value > max) {
                logger.warn("Property {}={} outside [{}, {}], using default {}", key, raw, min, max, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Property {}={} is not a number, using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Routing config file, or null to use the bundled classpath resource
     */
    public String getRoutingConfigPath() {
        return routingConfigPath;
    }

    public int getConfirmationExpiryMinutes() {
        return confirmationExpiryMinutes;
    }

    public Duration getConfirmationExpiry() {
        return Duration.ofMinutes(confirmationExpiryMinutes);
    }

    public int getBudgetSoftLimitPercent() {
        return budgetSoftLimitPercent;
    }

    public Duration getSideEffectTimeout() {
        return Duration.ofMillis(sideEffectTimeoutMs);
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    @Override
    public String toString() {
        return "GatewaySettings{" +
                "routingConfig=" + (routingConfigPath != null ? routingConfigPath : "<classpath>") +
                ", confirmationExpiry=" + confirmationExpiryMinutes + "min" +
                ", softLimit=" + budgetSoftLimitPercent + "%" +
                ", sideEffectTimeout=" + sideEffectTimeoutMs + "ms" +
                ", workerThreads=" + workerThreads +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String routingConfigPath;
        private int confirmationExpiryMinutes = AiGatewayConstants.DEFAULT_CONFIRMATION_EXPIRY_MINUTES;
        private int budgetSoftLimitPercent = AiGatewayConstants.DEFAULT_SOFT_LIMIT_PERCENT;
        private long sideEffectTimeoutMs = AiGatewayConstants.DEFAULT_SIDE_EFFECT_TIMEOUT_MS;
        private int workerThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

        public Builder routingConfigPath(String routingConfigPath) {
            this.routingConfigPath = routingConfigPath;
            return this;
        }

        public Builder confirmationExpiryMinutes(int confirmationExpiryMinutes) {
            this.confirmationExpiryMinutes = confirmationExpiryMinutes;
            return this;
        }

        public Builder budgetSoftLimitPercent(int budgetSoftLimitPercent) {
            this.budgetSoftLimitPercent = budgetSoftLimitPercent;
            return this;
        }

        public Builder sideEffectTimeoutMs(long sideEffectTimeoutMs) {
            this.sideEffectTimeoutMs = sideEffectTimeoutMs;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public GatewaySettings build() {
            return new GatewaySettings(this);
        }
    }
}
