package com.kiisha.ai.gateway.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.ValidationResult;
import com.kiisha.ai.gateway.providers.ProviderId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable routing snapshot. The router holds exactly one and swaps it whole,
 * so readers always see a consistent table.
 */
public final class GlobalRoutingConfig {

    private final ProviderId defaultProvider;
    private final String defaultModel;
    private final Map<AiTask, TaskRoutingConfig> taskRoutes;
    private final List<ProviderId> fallbackChain;
    private final RetryConfig retryConfig;

    @JsonCreator
    public GlobalRoutingConfig(@JsonProperty("defaultProvider") ProviderId defaultProvider,
                               @JsonProperty("defaultModel") String defaultModel,
                               @JsonProperty("taskRoutes") Map<AiTask, TaskRoutingConfig> taskRoutes,
                               @JsonProperty("fallbackChain") List<ProviderId> fallbackChain,
                               @JsonProperty("retryConfig") RetryConfig retryConfig) {
        this.defaultProvider = defaultProvider;
        this.defaultModel = defaultModel;
        Map<AiTask, TaskRoutingConfig> routes = new EnumMap<>(AiTask.class);
        if (taskRoutes != null) {
            routes.putAll(taskRoutes);
        }
        this.taskRoutes = Collections.unmodifiableMap(routes);
        this.fallbackChain = fallbackChain != null ?
                Collections.unmodifiableList(new ArrayList<>(fallbackChain)) : Collections.emptyList();
        this.retryConfig = retryConfig != null ? retryConfig : RetryConfig.defaults();
    }

    /**
     * Built-in routing: Forge first everywhere, lighter models for classification,
     * OpenAI and Anthropic behind it.
     */
    public static GlobalRoutingConfig defaults() {
        return builder()
                .defaultProvider(ProviderId.FORGE)
                .defaultModel("forge-default")
                .taskRoute(TaskRoutingConfig.of(AiTask.DOC_EXTRACT_FIELDS, true,
                        Route.of(ProviderId.FORGE, "forge-default", 1),
                        Route.of(ProviderId.OPENAI, "gpt-4o", 2),
                        Route.of(ProviderId.ANTHROPIC, "claude-3-5-sonnet-20241022", 3)))
                .taskRoute(TaskRoutingConfig.of(AiTask.VALIDATE_CONSISTENCY, true,
                        Route.of(ProviderId.FORGE, "forge-default", 1),
                        Route.of(ProviderId.OPENAI, "gpt-4o", 2)))
                .taskRoute(TaskRoutingConfig.of(AiTask.INTENT_CLASSIFY, true,
                        Route.of(ProviderId.FORGE, "forge-fast", 1),
                        Route.of(ProviderId.OPENAI, "gpt-4o-mini", 2)))
                .taskRoute(TaskRoutingConfig.of(AiTask.DOC_CLASSIFY, true,
                        Route.of(ProviderId.FORGE, "forge-fast", 1),
                        Route.of(ProviderId.OPENAI, "gpt-4o-mini", 2)))
                .fallbackChain(List.of(ProviderId.FORGE, ProviderId.OPENAI, ProviderId.ANTHROPIC))
                .retryConfig(RetryConfig.defaults())
                .build();
    }

    @JsonProperty("defaultProvider")
    public ProviderId getDefaultProvider() {
        return defaultProvider;
    }

    @JsonProperty("defaultModel")
    public String getDefaultModel() {
        return defaultModel;
    }

    @JsonProperty("taskRoutes")
    public Map<AiTask, TaskRoutingConfig> getTaskRoutes() {
        return taskRoutes;
    }

    public Optional<TaskRoutingConfig> getTaskRouting(AiTask task) {
        return Optional.ofNullable(taskRoutes.get(task));
    }

    @JsonProperty("fallbackChain")
    public List<ProviderId> getFallbackChain() {
        return fallbackChain;
    }

    @JsonProperty("retryConfig")
    public RetryConfig getRetryConfig() {
        return retryConfig;
    }

    /**
     * Checks the snapshot is usable before it is swapped in.
     */
    public ValidationResult validate() {
        ValidationResult.Builder result = ValidationResult.builder();

        if (defaultProvider == null) {
            result.addError("defaultProvider", "Default provider is required");
        }
        if (defaultModel == null || defaultModel.isBlank()) {
            result.addError("defaultModel", "Default model is required");
        }

        for (Map.Entry<AiTask, TaskRoutingConfig> entry : taskRoutes.entrySet()) {
            String field = "taskRoutes." + entry.getKey();
            TaskRoutingConfig config = entry.getValue();
            if (config == null) {
                result.addError(field, "Routing entry is null");
                continue;
            }
            if (config.getTask() != entry.getKey()) {
                result.addError(field, "Entry is for task " + config.getTask());
            }
            if (!config.hasRoutes()) {
                result.addWarning(field, "No routes; the default provider will be used");
            }
            Set<Integer> priorities = new HashSet<>();
            for (Route route : config.getRoutes()) {
                if (route.getModel().isBlank()) {
                    result.addError(field, "Route for " + route.getProvider() + " has a blank model");
                }
                if (!priorities.add(route.getPriority())) {
                    result.addWarning(field, "Duplicate priority " + route.getPriority());
                }
            }
        }

        if (fallbackChain.isEmpty()) {
            result.addWarning("fallbackChain", "Fallback chain is empty");
        } else if (new HashSet<>(fallbackChain).size() != fallbackChain.size()) {
            result.addError("fallbackChain", "Fallback chain lists a provider twice");
        }

        if (retryConfig.getMaxRetries() < 0) {
            result.addError("retryConfig.maxRetries", "must not be negative");
        }
        if (retryConfig.getInitialDelayMs() < 0) {
            result.addError("retryConfig.initialDelayMs", "must not be negative");
        }
        if (retryConfig.getMaxDelayMs() < retryConfig.getInitialDelayMs()) {
            result.addError("retryConfig.maxDelayMs", "must not be below initialDelayMs");
        }
        if (retryConfig.getBackoffMultiplier() < 1.0) {
            result.addError("retryConfig.backoffMultiplier", "must be at least 1");
        }

        return result.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .defaultProvider(defaultProvider)
                .defaultModel(defaultModel)
                .fallbackChain(fallbackChain)
                .retryConfig(retryConfig);
        taskRoutes.values().forEach(builder::taskRoute);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GlobalRoutingConfig{default=" + defaultProvider + "/" + defaultModel +
                ", tasks=" + taskRoutes.keySet() +
                ", fallbackChain=" + fallbackChain +
                ", retry=" + retryConfig + '}';
    }

    public static class Builder {
        private ProviderId defaultProvider;
        private String defaultModel;
        private final Map<AiTask, TaskRoutingConfig> taskRoutes = new EnumMap<>(AiTask.class);
        private List<ProviderId> fallbackChain = new ArrayList<>();
        private RetryConfig retryConfig;

        public Builder defaultProvider(ProviderId defaultProvider) {
            this.defaultProvider = defaultProvider;
            return this;
        }

        public Builder defaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder taskRoute(TaskRoutingConfig config) {
            this.taskRoutes.put(config.getTask(), config);
            return this;
        }

        public Builder removeTaskRoute(AiTask task) {
            this.taskRoutes.remove(task);
            return this;
        }

        public Builder fallbackChain(List<ProviderId> fallbackChain) {
            this.fallbackChain = new ArrayList<>(fallbackChain);
            return this;
        }

        public Builder retryConfig(RetryConfig retryConfig) {
            this.retryConfig = retryConfig;
            return this;
        }

        public GlobalRoutingConfig build() {
            return new GlobalRoutingConfig(defaultProvider, defaultModel, taskRoutes, fallbackChain, retryConfig);
        }
    }
}
