package com.kiisha.ai.gateway;

/**
 * Machine-readable reason a gateway call failed.
 */
public enum GatewayErrorCode {
    /** Task name is outside the closed set or has no policy */
    UNKNOWN_TASK,
    /** Caller's role is not in the task's allowed roles */
    ROLE_NOT_PERMITTED,
    /** Per-task call limit for the caller exceeded */
    RATE_LIMITED,
    /** Organization's hard budget limit reached */
    BUDGET_EXHAUSTED,
    /** No configured provider is available for the task */
    NO_PROVIDER_AVAILABLE,
    /** Provider or model override requested by a non-superuser */
    OVERRIDE_NOT_PERMITTED,
    /** Every attempted route failed */
    ALL_PROVIDERS_FAILED,
    /** Caller cancelled or the deadline passed */
    CANCELLED,
    /** Unexpected failure inside the gateway */
    INTERNAL_ERROR;

    /**
     * Whether the failure was decided before any provider was contacted.
     */
    public boolean isPreFlight() {
        switch (this) {
            case UNKNOWN_TASK:
            case ROLE_NOT_PERMITTED:
            case RATE_LIMITED:
            case BUDGET_EXHAUSTED:
            case NO_PROVIDER_AVAILABLE:
            case OVERRIDE_NOT_PERMITTED:
                return true;
            default:
                return false;
        }
    }
}
