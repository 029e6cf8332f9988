package com.kiisha.ai.gateway.confirmation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a pending confirmation. Only {@link #PENDING} may change.
 */
public enum ConfirmationStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    DECLINED("declined"),
    EXPIRED("expired");

    private final String code;

    ConfirmationStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    @Override
    public String toString() {
        return code;
    }
}
