package com.kiisha.ai.gateway.providers;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;

/**
 * A message in a provider conversation, in the gateway's provider-neutral shape.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AiMessage {

    /**
     * Role of the message sender
     */
    public enum MessageRole {
        SYSTEM,
        USER,
        ASSISTANT,
        TOOL
    }

    private final MessageRole role;
    private final String content;
    private final String name;
    private final String toolCallId;
    private final List<ToolCall> toolCalls;

    private AiMessage(Builder builder) {
        this.role = builder.role;
        this.content = builder.content;
        this.name = builder.name;
        this.toolCallId = builder.toolCallId;
        this.toolCalls = builder.toolCalls != null ?
                Collections.unmodifiableList(builder.toolCalls) : null;
    }

    public MessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    public String getName() {
        return name;
    }

    /**
     * ID of the tool call this message answers (TOOL messages only)
     */
    public String getToolCallId() {
        return toolCallId;
    }

    /**
     * Tool calls made by the assistant (ASSISTANT messages only)
     */
    public List<ToolCall> getToolCalls() {
        return toolCalls;
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    @JsonIgnore
    public boolean isSystem() {
        return role == MessageRole.SYSTEM;
    }

    /**
     * Copy of this message with different content, keeping every other field.
     */
    public AiMessage withContent(String newContent) {
        return builder()
                .role(role)
                .content(newContent)
                .name(name)
                .toolCallId(toolCallId)
                .toolCalls(toolCalls)
                .build();
    }

    public static AiMessage user(String content) {
        return builder().role(MessageRole.USER).content(content).build();
    }

    public static AiMessage assistant(String content) {
        return builder().role(MessageRole.ASSISTANT).content(content).build();
    }

    public static AiMessage system(String content) {
        return builder().role(MessageRole.SYSTEM).content(content).build();
    }

    public static AiMessage toolResult(String toolCallId, String content) {
        return builder().role(MessageRole.TOOL).toolCallId(toolCallId).content(content).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "AiMessage{" +
                "role=" + role +
                ", content='" + (content != null && content.length() > 50 ?
                        content.substring(0, 50) + "..." : content) + '\'' +
                ", toolCalls=" + (toolCalls != null ? toolCalls.size() : 0) +
                '}';
    }

    public static class Builder {
        private MessageRole role;
        private String content;
        private String name;
        private String toolCallId;
        private List<ToolCall> toolCalls;

        public Builder role(MessageRole role) {
            this.role = role;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder toolCallId(String toolCallId) {
            this.toolCallId = toolCallId;
            return this;
        }

        public Builder toolCalls(List<ToolCall> toolCalls) {
            this.toolCalls = toolCalls;
            return this;
        }

        public AiMessage build() {
            if (role == null) {
                throw new IllegalStateException("Message role is required");
            }
            return new AiMessage(this);
        }
    }
}
