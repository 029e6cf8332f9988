package com.kiisha.ai.common;

/**
 * Constants used throughout the AI gateway.
 */
public final class AiGatewayConstants {

    private AiGatewayConstants() {
        // Prevent instantiation
    }

    // Identification
    public static final String GATEWAY_NAME = "KIISHA AI Gateway";
    public static final String GATEWAY_VERSION = "1.0.0";

    // Configuration
    public static final String PROPERTY_PREFIX = "kiisha.ai.";
    public static final String DEFAULT_ROUTING_RESOURCE = "kiisha-ai-routing.json";

    // Audit Log Categories
    public static final String AUDIT_CATEGORY_CALL = "AI_CALL";
    public static final String AUDIT_CATEGORY_ADMIN = "AI_ADMIN";

    // Budget
    public static final int DEFAULT_SOFT_LIMIT_PERCENT = 80;
    public static final int DEFAULT_BUDGET_HISTORY_PERIODS = 6;

    // Confirmations
    public static final int DEFAULT_CONFIRMATION_EXPIRY_MINUTES = 30;

    // Telemetry
    public static final int PROMPT_HASH_LENGTH = 16;
    public static final int OUTPUT_SUMMARY_MAX_LENGTH = 500;

    // Default Timeouts (milliseconds)
    public static final long DEFAULT_SIDE_EFFECT_TIMEOUT_MS = 2000;
    public static final long DEFAULT_PROVIDER_TIMEOUT_MS = 120000;
}
