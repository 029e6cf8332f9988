package com.kiisha.ai.gateway.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.Channel;
import com.kiisha.ai.gateway.providers.ProviderId;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one gateway call. Pre-flight rejections have no provider or model.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AuditEntry {

    /**
     * A tool call the model made, as recorded for audit.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ToolCallRecord {
        private final String name;
        private final String arguments;

        public ToolCallRecord(String name, String arguments) {
            this.name = name;
            this.arguments = arguments;
        }

        public String getName() {
            return name;
        }

        public String getArguments() {
            return arguments;
        }
    }

    private final String id;
    private final Instant timestamp;
    private final String category;
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
    private final long latencyMs;
    private final boolean success;
    private final List<ToolCallRecord> toolCalls;
    private final String outputSummary;
    private final String errorCode;
    private final String errorMessage;

    private AuditEntry(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.category = builder.category;
        this.eventType = builder.eventType;
        this.task = builder.task;
        this.taskName = builder.taskName != null ? builder.taskName :
                (builder.task != null ? builder.task.name() : null);
        this.userId = builder.userId;
        this.orgId = builder.orgId;
        this.channel = builder.channel;
        this.correlationId = Objects.requireNonNull(builder.correlationId, "correlationId");
        this.provider = builder.provider;
        this.model = builder.model;
        this.promptHash = builder.promptHash;
        this.inputTokens = builder.inputTokens;
        this.outputTokens = builder.outputTokens;
        this.latencyMs = builder.latencyMs;
        this.success = builder.success;
        this.toolCalls = builder.toolCalls != null && !builder.toolCalls.isEmpty() ?
                Collections.unmodifiableList(builder.toolCalls) : null;
        this.outputSummary = builder.outputSummary;
        this.errorCode = builder.errorCode;
        this.errorMessage = builder.errorMessage;
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getCategory() {
        return category;
    }

    public String getEventType() {
        return eventType;
    }

    /**
     * Null when the caller named a task outside the closed set; see {@link #getTaskName()}
     */
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

    public long getLatencyMs() {
        return latencyMs;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<ToolCallRecord> getToolCalls() {
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
        private String id;
        private Instant timestamp;
        private String category;
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
        private long latencyMs;
        private boolean success;
        private List<ToolCallRecord> toolCalls;
        private String outputSummary;
        private String errorCode;
        private String errorMessage;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
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

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder toolCalls(List<ToolCallRecord> toolCalls) {
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

        public AuditEntry build() {
            return new AuditEntry(this);
        }
    }

    @Override
    public String toString() {
        return "AuditEntry{" +
                "id='" + id + '\'' +
                ", correlationId='" + correlationId + '\'' +
                ", timestamp=" + timestamp +
                ", category='" + category + '\'' +
                ", eventType='" + eventType + '\'' +
                ", task=" + taskName +
                ", userId='" + userId + '\'' +
                ", provider=" + provider +
                ", success=" + success +
                '}';
    }
}
