package com.kiisha.ai.gateway.confirmation;

import com.kiisha.ai.common.model.Channel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A high-impact action waiting to be put in front of its user.
 */
public final class ConfirmationRequest {

    private final String userId;
    private final String orgId;
    private final Channel channel;
    private final String correlationId;
    private final String actionType;
    private final String actionDescription;
    private final Map<String, Object> payload;
    private final Integer expiresInMinutes;

    private ConfirmationRequest(Builder builder) {
        this.userId = Objects.requireNonNull(builder.userId, "userId");
        this.orgId = builder.orgId;
        this.channel = builder.channel != null ? builder.channel : Channel.WEB;
        this.correlationId = builder.correlationId;
        this.actionType = Objects.requireNonNull(builder.actionType, "actionType");
        this.actionDescription = builder.actionDescription != null ? builder.actionDescription : "";
        this.payload = builder.payload != null ?
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload)) : Collections.emptyMap();
        this.expiresInMinutes = builder.expiresInMinutes;
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

    public String getActionType() {
        return actionType;
    }

    public String getActionDescription() {
        return actionDescription;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * Expiry override; null means the gate's default
     */
    public Integer getExpiresInMinutes() {
        return expiresInMinutes;
    }

    public Builder toBuilder() {
        return new Builder()
                .userId(userId)
                .orgId(orgId)
                .channel(channel)
                .correlationId(correlationId)
                .actionType(actionType)
                .actionDescription(actionDescription)
                .payload(payload)
                .expiresInMinutes(expiresInMinutes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String userId;
        private String orgId;
        private Channel channel;
        private String correlationId;
        private String actionType;
        private String actionDescription;
        private Map<String, Object> payload;
        private Integer expiresInMinutes;

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

        public Builder actionType(String actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder actionDescription(String actionDescription) {
            this.actionDescription = actionDescription;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder expiresInMinutes(Integer expiresInMinutes) {
            this.expiresInMinutes = expiresInMinutes;
            return this;
        }

        public ConfirmationRequest build() {
            if (expiresInMinutes != null && expiresInMinutes <= 0) {
                throw new IllegalStateException("expiresInMinutes must be positive");
            }
            return new ConfirmationRequest(this);
        }
    }
}
