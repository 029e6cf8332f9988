package com.kiisha.ai.gateway.auth;

/**
 * Exception thrown when a caller lacks the capability an operation needs.
 */
public class AuthorizationException extends Exception {

    private final String userId;
    private final String requiredCapability;

    public AuthorizationException(String message) {
        super(message);
        this.userId = null;
        this.requiredCapability = null;
    }

    public AuthorizationException(String message, String userId, String requiredCapability) {
        super(message);
        this.userId = userId;
        this.requiredCapability = requiredCapability;
    }

    public String getUserId() {
        return userId;
    }

    public String getRequiredCapability() {
        return requiredCapability;
    }
}
