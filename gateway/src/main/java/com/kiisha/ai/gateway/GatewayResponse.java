package com.kiisha.ai.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kiisha.ai.gateway.providers.FinishReason;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.TokenUsage;
import com.kiisha.ai.gateway.providers.ToolCall;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a gateway call. Failures are reported here with an {@link GatewayErrorCode},
 * never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GatewayResponse {

    private final boolean success;
    private final String content;
    private final List<ToolCall> toolCalls;
    private final FinishReason finishReason;
    private final TokenUsage usage;
    private final String model;
    private final ProviderId provider;
    private final long latencyMs;
    private final String auditId;
    private final String correlationId;
    private final String error;
    private final GatewayErrorCode errorCode;

    private GatewayResponse(Builder builder) {
        this.success = builder.success;
        this.content = builder.content;
        this.toolCalls = builder.toolCalls != null ? List.copyOf(builder.toolCalls) : Collections.emptyList();
        this.finishReason = builder.finishReason;
        this.usage = builder.usage != null ? builder.usage : TokenUsage.empty();
        this.model = builder.model;
        this.provider = builder.provider;
        this.latencyMs = builder.latencyMs;
        this.auditId = builder.auditId;
        this.correlationId = builder.correlationId;
        this.error = builder.error;
        this.errorCode = builder.errorCode;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getContent() {
        return content;
    }

    public List<ToolCall> getToolCalls() {
        return toolCalls;
    }

    public FinishReason getFinishReason() {
        return finishReason;
    }

    public TokenUsage getUsage() {
        return usage;
    }

    public String getModel() {
        return model;
    }

    public ProviderId getProvider() {
        return provider;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    /**
     * Id of the audit entry written for this call
     */
    public String getAuditId() {
        return auditId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getError() {
        return error;
    }

    public GatewayErrorCode getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        if (success) {
            return "GatewayResponse{success, provider=" + provider + ", model=" + model +
                    ", finish=" + finishReason + ", " + usage + ", " + latencyMs + "ms}";
        }
        return "GatewayResponse{failed, errorCode=" + errorCode + ", error='" + error + "', " + latencyMs + "ms}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean success;
        private String content;
        private List<ToolCall> toolCalls;
        private FinishReason finishReason;
        private TokenUsage usage;
        private String model;
        private ProviderId provider;
        private long latencyMs;
        private String auditId;
        private String correlationId;
        private String error;
        private GatewayErrorCode errorCode;

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder toolCalls(List<ToolCall> toolCalls) {
            this.toolCalls = toolCalls;
            return this;
        }

        public Builder finishReason(FinishReason finishReason) {
            this.finishReason = finishReason;
            return this;
        }

        public Builder usage(TokenUsage usage) {
            this.usage = usage;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder provider(ProviderId provider) {
            this.provider = provider;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder auditId(String auditId) {
            this.auditId = auditId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder error(GatewayErrorCode errorCode, String error) {
            this.errorCode = errorCode;
            this.error = error;
            this.finishReason = FinishReason.ERROR;
            return this;
        }

        public GatewayResponse build() {
            return new GatewayResponse(this);
        }
    }
}
