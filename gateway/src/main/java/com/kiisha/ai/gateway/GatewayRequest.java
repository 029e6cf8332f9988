package com.kiisha.ai.gateway;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.Channel;
import com.kiisha.ai.common.model.Role;
import com.kiisha.ai.gateway.providers.AiMessage;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.ResponseFormat;
import com.kiisha.ai.gateway.providers.ToolChoice;
import com.kiisha.ai.gateway.providers.ToolDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One call into the gateway. The task is carried by name so that callers passing a
 * name outside the closed task set still get a structured {@code UNKNOWN_TASK} response.
 */
public final class GatewayRequest {

    private final String taskName;
    private final List<AiMessage> messages;
    private final List<ToolDefinition> tools;
    private final ToolChoice toolChoice;
    private final ResponseFormat responseFormat;
    private final Integer maxTokens;
    private final Double temperature;
    private final String userId;
    private final String orgId;
    private final Role role;
    private final String correlationId;
    private final Channel channel;
    private final ProviderId providerOverride;
    private final String modelOverride;
    private final CancellationSignal cancellationSignal;

    private GatewayRequest(Builder builder) {
        this.taskName = Objects.requireNonNull(builder.taskName, "task");
        this.messages = Collections.unmodifiableList(new ArrayList<>(builder.messages));
        this.tools = builder.tools != null ?
                Collections.unmodifiableList(new ArrayList<>(builder.tools)) : null;
        this.toolChoice = builder.toolChoice;
        this.responseFormat = builder.responseFormat;
        this.maxTokens = builder.maxTokens;
        this.temperature = builder.temperature;
        this.userId = Objects.requireNonNull(builder.userId, "userId");
        this.orgId = Objects.requireNonNull(builder.orgId, "orgId");
        this.role = builder.role;
        this.correlationId = builder.correlationId;
        this.channel = builder.channel != null ? builder.channel : Channel.WEB;
        this.providerOverride = builder.providerOverride;
        this.modelOverride = builder.modelOverride;
        this.cancellationSignal = builder.cancellationSignal != null ?
                builder.cancellationSignal : CancellationSignal.none();
    }

    /**
     * The task as requested, possibly outside the closed set.
     */
    public String getTaskName() {
        return taskName;
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

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public Double getTemperature() {
        return temperature;
    }

    public String getUserId() {
        return userId;
    }

    public String getOrgId() {
        return orgId;
    }

    /**
     * Caller's role if the caller supplied it; otherwise the capability check is asked.
     */
    public Role getRole() {
        return role;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Channel getChannel() {
        return channel;
    }

    public ProviderId getProviderOverride() {
        return providerOverride;
    }

    public String getModelOverride() {
        return modelOverride;
    }

    public boolean hasOverride() {
        return providerOverride != null || modelOverride != null;
    }

    public CancellationSignal getCancellationSignal() {
        return cancellationSignal;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.taskName = taskName;
        builder.messages = new ArrayList<>(messages);
        builder.tools = tools;
        builder.toolChoice = toolChoice;
        builder.responseFormat = responseFormat;
        builder.maxTokens = maxTokens;
        builder.temperature = temperature;
        builder.userId = userId;
        builder.orgId = orgId;
        builder.role = role;
        builder.correlationId = correlationId;
        builder.channel = channel;
        builder.providerOverride = providerOverride;
        builder.modelOverride = modelOverride;
        builder.cancellationSignal = cancellationSignal;
        return builder;
    }

    @Override
    public String toString() {
        return "GatewayRequest{" +
                "task=" + taskName +
                ", user=" + userId +
                ", org=" + orgId +
                ", channel=" + channel +
                ", messages=" + messages.size() +
                (providerOverride != null ? ", providerOverride=" + providerOverride : "") +
                (correlationId != null ? ", corr=" + correlationId : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String taskName;
        private List<AiMessage> messages = new ArrayList<>();
        private List<ToolDefinition> tools;
        private ToolChoice toolChoice;
        private ResponseFormat responseFormat;
        private Integer maxTokens;
        private Double temperature;
        private String userId;
        private String orgId;
        private Role role;
        private String correlationId;
        private Channel channel;
        private ProviderId providerOverride;
        private String modelOverride;
        private CancellationSignal cancellationSignal;

        public Builder task(AiTask task) {
            this.taskName = task.name();
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
            return this;
        }

        public Builder messages(List<AiMessage> messages) {
            this.messages = new ArrayList<>(messages);
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

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder orgId(String orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder role(Role role) {
            this.role = role;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder channel(Channel channel) {
            this.channel = channel;
            return this;
        }

        public Builder providerOverride(ProviderId providerOverride) {
            this.providerOverride = providerOverride;
            return this;
        }

        public Builder modelOverride(String modelOverride) {
            this.modelOverride = modelOverride;
            return this;
        }

        public Builder cancellationSignal(CancellationSignal cancellationSignal) {
            this.cancellationSignal = cancellationSignal;
            return this;
        }

        public GatewayRequest build() {
            return new GatewayRequest(this);
        }
    }
}
