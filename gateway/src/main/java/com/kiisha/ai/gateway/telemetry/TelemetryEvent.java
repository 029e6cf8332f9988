package com.kiisha.ai.gateway.telemetry;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.Channel;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.ToolCall;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything the telemetry sink learns about one call. Built once by the gateway and fanned
 * out into the audit entry and the usage record.
 */
public final class TelemetryEvent {

    private final String auditId;
    private final String eventType;
    private final AiTask task;
    private final String taskName;
    private final String userId;
    private final String orgId;
    private final Channel channel;
    private final String correlationId;
    private final ProviderId provider;
    private final String model;
    private final String promptHash;
    private final int inputTokens;
    private final int outputTokens;
    private final int totalTokens;
    private final long latencyMs;
    private final boolean success;
    private final List<ToolCall> toolCalls;
    private final String outputSummary;
    private final String errorCode;
    private final String errorMessage;

    private TelemetryEvent(Builder builder) {
        this.auditId = Objects.requireNonNull(builder.auditId, "auditId");
        this.eventType = builder.eventType;
        this.task = builder.task;
        this.taskName = builder.taskName;
        this.userId = builder.userId;
        this.orgId = builder.orgId;
        this.channel = builder.channel;
        this.correlationId = Objects.requireNonNull(builder.correlationId, "correlationId");
        this.provider = builder.provider;
        this.model = builder.model;
        this.promptHash = builder.promptHash;
        this.inputTokens = builder.inputTokens;
        this.outputTokens = builder.outputTokens;
        this.totalTokens = builder.totalTokens != null ?
                builder.totalTokens : builder.inputTokens + builder.outputTokens;
        this.latencyMs = builder.latencyMs;
        this.success = builder.success;
        this.toolCalls = builder.toolCalls != null ? builder.toolCalls : Collections.emptyList();
        this.outputSummary = builder.outputSummary;
        this.errorCode = builder.errorCode;
        this.errorMessage = builder.errorMessage;
    }

    public String getAuditId() {
        return auditId;
    }

    public String getEventType() {
        return eventType;
    }

    public AiTask getTask() {
        return task;
    }

    public String getTaskName() {
        return taskName;
    }

    public String getUserId() {
        return userId;
    }

    public String getOrgId() {
        return orgId;
    }

    public Channel getChannel() {
        return channel;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public ProviderId getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public String getPromptHash() {
        return promptHash;
    }

    public int getInputTokens() {
        return inputTokens;
    }

    public int getOutputTokens() {
        return outputTokens;
    }

    /**
     * Total as reported by the provider, which is what the budget is charged.
     */
    public int getTotalTokens() {
        return totalTokens;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<ToolCall> getToolCalls() {
        return toolCalls;
    }

    public String getOutputSummary() {
        return outputSummary;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String auditId;
        private String eventType;
        private AiTask task;
        private String taskName;
        private String userId;
        private String orgId;
        private Channel channel;
        private String correlationId;
        private ProviderId provider;
        private String model;
        private String promptHash;
        private int inputTokens;
        private int outputTokens;
        private Integer totalTokens;
        private long latencyMs;
        private boolean success;
        private List<ToolCall> toolCalls;
        private String outputSummary;
        private String errorCode;
        private String errorMessage;

        public Builder auditId(String auditId) {
            this.auditId = auditId;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder task(AiTask task) {
            this.task = task;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
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

        public Builder channel(Channel channel) {
            this.channel = channel;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder provider(ProviderId provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder promptHash(String promptHash) {
            this.promptHash = promptHash;
            return this;
        }

        public Builder inputTokens(int inputTokens) {
            this.inputTokens = inputTokens;
            return this;
        }

        public Builder outputTokens(int outputTokens) {
            this.outputTokens = outputTokens;
            return this;
        }

        public Builder totalTokens(int totalTokens) {
            this.totalTokens = totalTokens;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder toolCalls(List<ToolCall> toolCalls) {
            this.toolCalls = toolCalls;
            return this;
        }

        public Builder outputSummary(String outputSummary) {
            this.outputSummary = outputSummary;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public TelemetryEvent build() {
            return new TelemetryEvent(this);
        }
    }
}
