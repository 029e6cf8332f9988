package com.kiisha.ai.gateway.providers;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical response every adapter returns, whatever the vendor shape.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CompletionResponse {

    private final String content;
    private final List<ToolCall> toolCalls;
    private final FinishReason finishReason;
    private final TokenUsage usage;
    private final String model;

    private CompletionResponse(Builder builder) {
        this.content = builder.content;
        this.toolCalls = builder.toolCalls != null ?
                Collections.unmodifiableList(new ArrayList<>(builder.toolCalls)) : Collections.emptyList();
        this.finishReason = builder.finishReason != null ? builder.finishReason : FinishReason.STOP;
        this.usage = builder.usage != null ? builder.usage : TokenUsage.empty();
        this.model = builder.model;
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

    /**
     * Model that actually served the request, as reported by the vendor
     */
    public String getModel() {
        return model;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    @Override
    public String toString() {
        return "CompletionResponse{" +
                "model='" + model + '\'' +
                ", content='" + (content != null && content.length() > 50 ?
                        content.substring(0, 50) + "..." : content) + '\'' +
                ", toolCalls=" + toolCalls.size() +
                ", finishReason=" + finishReason +
                ", tokens=" + usage.getTotalTokens() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String content;
        private List<ToolCall> toolCalls;
        private FinishReason finishReason;
        private TokenUsage usage;
        private String model;

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

        public CompletionResponse build() {
            return new CompletionResponse(this);
        }
    }
}
