package com.kiisha.ai.gateway.confirmation;

/**
 * What the caller shows the user after a confirmation is created.
 */
public final class ConfirmationResult {

    private final String confirmationId;
    private final ConfirmationStatus status;
    private final String message;

    public ConfirmationResult(String confirmationId, ConfirmationStatus status, String message) {
        this.confirmationId = confirmationId;
        this.status = status;
        this.message = message;
    }

    public String getConfirmationId() {
        return confirmationId;
    }

    public ConfirmationStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "ConfirmationResult{id='" + confirmationId + "', status=" + status + '}';
    }
}
