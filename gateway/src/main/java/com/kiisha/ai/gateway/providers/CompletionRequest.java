package com.kiisha.ai.gateway.providers;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request handed to a provider adapter. Carries only the provider-neutral shape;
 * adapters translate it into their vendor wire format.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CompletionRequest {

    private final List<AiMessage> messages;
    private final List<ToolDefinition> tools;
    private final ToolChoice toolChoice;
    private final ResponseFormat responseFormat;
    private final String model;
    private final Integer maxTokens;
    private final Double temperature;
    private final Duration timeout;

    private CompletionRequest(Builder builder) {
        this.messages = Collections.unmodifiableList(new ArrayList<>(builder.messages));
        this.tools = builder.tools != null ?
                Collections.unmodifiableList(new ArrayList<>(builder.tools)) : null;
        this.toolChoice = builder.toolChoice;
        this.responseFormat = builder.responseFormat;
        this.model = builder.model;
        this.maxTokens = builder.maxTokens;
        this.temperature = builder.temperature;
        this.timeout = builder.timeout;
    }

    public List<AiMessage> getMessages() {
        return messages;
    }

    public List<ToolDefinition> getTools() {
        return tools;
    }

    public ToolChoice getToolChoice() {
        return toolChoice;
    }

    public ResponseFormat getResponseFormat() {
        return responseFormat;
    }

    /**
     * Model selected by the router for this attempt
     */
    public String getModel() {
        return model;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public Double getTemperature() {
        return temperature;
    }

    /**
     * Upper bound for the adapter's HTTP call; null means the adapter default.
     */
    @JsonIgnore
    public Duration getTimeout() {
        return timeout;
    }

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder()
                .messages(messages)
                .tools(tools)
                .toolChoice(toolChoice)
                .responseFormat(responseFormat)
                .model(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeout(timeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<AiMessage> messages = new ArrayList<>();
        private List<ToolDefinition> tools;
        private ToolChoice toolChoice;
        private ResponseFormat responseFormat;
        private String model;
        private Integer maxTokens;
        private Double temperature;
        private Duration timeout;

        public Builder messages(List<AiMessage> messages) {
            this.messages = messages != null ? new ArrayList<>(messages) : new ArrayList<>();
            return this;
        }

        public Builder addMessage(AiMessage message) {
            this.messages.add(message);
            return this;
        }

        public Builder tools(List<ToolDefinition> tools) {
            this.tools = tools;
            return this;
        }

        public Builder toolChoice(ToolChoice toolChoice) {
            this.toolChoice = toolChoice;
            return this;
        }

        public Builder responseFormat(ResponseFormat responseFormat) {
            this.responseFormat = responseFormat;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
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

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public CompletionRequest build() {
            if (messages.isEmpty()) {
                throw new IllegalStateException("At least one message is required");
            }
            return new CompletionRequest(this);
        }
    }
}
