package com.kiisha.ai.gateway.confirmation;

/**
 * A confirm or decline that cannot be applied.
 */
public class ConfirmationException extends Exception {

    public enum Reason {
        NOT_FOUND,
        WRONG_OWNER,
        ALREADY_RESOLVED,
        EXPIRED
    }

    private final Reason reason;
    private final String confirmationId;

    public ConfirmationException(Reason reason, String confirmationId, String message) {
        super(message);
        this.reason = reason;
        this.confirmationId = confirmationId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getConfirmationId() {
        return confirmationId;
    }

    static ConfirmationException notFound(String id) {
        return new ConfirmationException(Reason.NOT_FOUND, id, "Confirmation not found");
    }

    static ConfirmationException wrongOwner(String id) {
        return new ConfirmationException(Reason.WRONG_OWNER, id, "Confirmation belongs to another user");
    }

    static ConfirmationException alreadyResolved(String id, ConfirmationStatus status) {
        return new ConfirmationException(Reason.ALREADY_RESOLVED, id, "Confirmation already " + status);
    }

    static ConfirmationException expired(String id) {
        return new ConfirmationException(Reason.EXPIRED, id, "Confirmation expired");
    }
}
