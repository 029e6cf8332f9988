package com.kiisha.ai.gateway.providers;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection settings for one provider adapter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProviderConfig {

    private final ProviderId providerId;
    private final String apiKey;
    private final String apiBaseUrl;
    private final String defaultModel;
    private final List<String> models;
    private final Integer maxTokens;
    private final Double temperature;
    private final Map<String, String> customHeaders;
    private final boolean enabled;
    private final Duration timeout;

    private ProviderConfig(Builder builder) {
        this.providerId = builder.providerId;
        this.apiKey = builder.apiKey;
        this.apiBaseUrl = builder.apiBaseUrl;
        this.defaultModel = builder.defaultModel;
        this.models = builder.models != null ?
                Collections.unmodifiableList(new ArrayList<>(builder.models)) :
                Collections.emptyList();
        this.maxTokens = builder.maxTokens;
        this.temperature = builder.temperature;
        this.customHeaders = builder.customHeaders != null ?
                Collections.unmodifiableMap(new HashMap<>(builder.customHeaders)) :
                Collections.emptyMap();
        this.enabled = builder.enabled;
        this.timeout = builder.timeout;
    }

    public ProviderId getProviderId() {
        return providerId;
    }

    /**
     * API key (never logged)
     */
    public String getApiKey() {
        return apiKey;
    }

    /**
     * Base URL for API calls (custom endpoints such as Azure deployments or Forge)
     */
    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    /**
     * Models served by this provider; the default model is implied when empty.
     */
    public List<String> getModels() {
        return models;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Map<String, String> getCustomHeaders() {
        return customHeaders;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .providerId(this.providerId)
                .apiKey(this.apiKey)
                .apiBaseUrl(this.apiBaseUrl)
                .defaultModel(this.defaultModel)
                .models(this.models)
                .maxTokens(this.maxTokens)
                .temperature(this.temperature)
                .customHeaders(this.customHeaders)
                .enabled(this.enabled)
                .timeout(this.timeout);
    }

    public static class Builder {
        private ProviderId providerId;
        private String apiKey;
        private String apiBaseUrl;
        private String defaultModel;
        private List<String> models;
        private Integer maxTokens;
        private Double temperature;
        private Map<String, String> customHeaders;
        private boolean enabled = true;
        private Duration timeout;

        public Builder providerId(ProviderId providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
            return this;
        }

        public Builder defaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder models(List<String> models) {
            this.models = models != null ? new ArrayList<>(models) : null;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder customHeaders(Map<String, String> customHeaders) {
            this.customHeaders = customHeaders != null ? new HashMap<>(customHeaders) : null;
            return this;
        }

        public Builder addCustomHeader(String key, String value) {
            if (this.customHeaders == null) {
                this.customHeaders = new HashMap<>();
            }
            this.customHeaders.put(key, value);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public ProviderConfig build() {
            if (providerId == null) {
                throw new IllegalStateException("providerId is required");
            }
            return new ProviderConfig(this);
        }
    }
}
