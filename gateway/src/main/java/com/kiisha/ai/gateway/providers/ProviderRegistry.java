package com.kiisha.ai.gateway.providers;

import com.kiisha.ai.gateway.providers.impl.AnthropicProvider;
import com.kiisha.ai.gateway.providers.impl.OpenAiCompatibleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the adapter instance for each provider id. The router asks it which
 * providers are available; the gateway asks it for the adapter to call.
 */
public class ProviderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<ProviderId, AiProvider> providers = new ConcurrentHashMap<>();
    private final Map<ProviderId, ProviderConfig> configs = new ConcurrentHashMap<>();

    public ProviderRegistry() {
        logger.info("ProviderRegistry initialized");
    }

    /**
     * Creates the reference adapter for the config's provider id and registers it.
     */
    public AiProvider registerProvider(ProviderConfig config) {
        AiProvider provider = createProvider(config);
        providers.put(config.getProviderId(), provider);
        configs.put(config.getProviderId(), config);
        logger.info("Registered provider: {} ({}, available={})",
                config.getProviderId(), provider.getDisplayName(), provider.isAvailable());
        return provider;
    }

    /**
     * Registers an externally built adapter, replacing any previous one for the same id.
     */
    public void register(AiProvider provider) {
        providers.put(provider.getProviderId(), provider);
        logger.info("Registered provider: {} ({})", provider.getProviderId(), provider.getDisplayName());
    }

    private AiProvider createProvider(ProviderConfig config) {
        switch (config.getProviderId()) {
            case ANTHROPIC:
                return new AnthropicProvider(config);
            case OPENAI:
            case FORGE:
            case AZURE_OPENAI:
            case GEMINI:
            case DEEPSEEK:
                return new OpenAiCompatibleProvider(config);
            default:
                throw new IllegalArgumentException("Unsupported provider: " + config.getProviderId());
        }
    }

    public Optional<AiProvider> getProvider(ProviderId providerId) {
        return Optional.ofNullable(providers.get(providerId));
    }

    public Collection<AiProvider> getAllProviders() {
        return providers.values();
    }

    public Collection<AiProvider> getAvailableProviders() {
        return providers.values().stream()
                .filter(AiProvider::isAvailable)
                .toList();
    }

    public Optional<ProviderConfig> getConfig(ProviderId providerId) {
        return Optional.ofNullable(configs.get(providerId));
    }

    /**
     * Rebuilds the adapter for a changed config.
     */
    public void updateConfig(ProviderConfig config) {
        removeProvider(config.getProviderId());
        registerProvider(config);
    }

    public void removeProvider(ProviderId providerId) {
        providers.remove(providerId);
        configs.remove(providerId);
        logger.info("Removed provider: {}", providerId);
    }

    /**
     * Whether a provider is registered and reports itself available.
     * Adapter failures while answering count as unavailable.
     */
    public boolean isAvailable(ProviderId providerId) {
        AiProvider provider = providers.get(providerId);
        if (provider == null) {
            return false;
        }
        try {
            return provider.isAvailable();
        } catch (RuntimeException e) {
            logger.warn("Availability check failed for provider {}: {}", providerId, e.getMessage());
            return false;
        }
    }
}
