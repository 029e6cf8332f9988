package com.kiisha.ai.gateway.providers;

import com.kiisha.ai.common.model.ValidationResult;

import java.util.List;

/**
 * Uniform adapter contract for model providers.
 * The router and gateway depend only on this interface.
 */
public interface AiProvider {

    ProviderId getProviderId();

    /**
     * Display name for logs and admin views
     */
    default String getDisplayName() {
        return getProviderId().getDisplayName();
    }

    /**
     * Whether the provider is configured and may be routed to
     */
    boolean isAvailable();

    /**
     * Models this provider serves, first entry is its preferred model
     */
    List<String> getAvailableModels();

    /**
     * Sends the request and blocks until the vendor answers or the request timeout elapses.
     */
    CompletionResponse complete(CompletionRequest request) throws ProviderException;

    ValidationResult validateConfig(ProviderConfig config);
}
