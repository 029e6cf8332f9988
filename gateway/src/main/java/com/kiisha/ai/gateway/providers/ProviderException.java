package com.kiisha.ai.gateway.providers;

/**
 * Exception thrown by provider adapters when a call fails.
 */
public class ProviderException extends Exception {

    private final ProviderId providerId;
    private final int statusCode;
    private final boolean retryable;

    public ProviderException(String message) {
        this(null, message, -1, false);
    }

    public ProviderException(String message, Throwable cause) {
        this(null, message, -1, false, cause);
    }

    public ProviderException(ProviderId providerId, String message, int statusCode, boolean retryable) {
        super(message);
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public ProviderException(ProviderId providerId, String message, int statusCode, boolean retryable,
                             Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    /**
     * HTTP status of the failed call, or -1 when the call never got a response
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static ProviderException rateLimited(ProviderId providerId, String message) {
        return new ProviderException(providerId, message, 429, true);
    }

    public static ProviderException unauthorized(ProviderId providerId, String message) {
        return new ProviderException(providerId, message, 401, false);
    }

    public static ProviderException serverError(ProviderId providerId, String message) {
        return new ProviderException(providerId, message, 500, true);
    }

    public static ProviderException timeout(ProviderId providerId, Throwable cause) {
        return new ProviderException(providerId, "Request timed out", 408, true, cause);
    }

    /**
     * Maps an HTTP error status onto the exception the gateway expects.
     */
    public static ProviderException fromStatus(ProviderId providerId, int statusCode, String message) {
        if (statusCode == 429) {
            return rateLimited(providerId, message);
        }
        if (statusCode == 401 || statusCode == 403) {
            return unauthorized(providerId, message);
        }
        if (statusCode >= 500) {
            return new ProviderException(providerId, message, statusCode, true);
        }
        return new ProviderException(providerId, message, statusCode, false);
    }
}
