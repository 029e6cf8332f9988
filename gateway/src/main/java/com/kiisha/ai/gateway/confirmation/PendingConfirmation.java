package com.kiisha.ai.gateway.confirmation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kiisha.ai.common.model.Channel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stored confirmation record. Instances are immutable; a transition produces a new one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PendingConfirmation {

    private final String id;
    private final String userId;
    private final String orgId;
    private final Channel channel;
    private final String correlationId;
    private final String actionType;
    private final String actionDescription;
    private final Map<String, Object> payload;
    private final Instant expiresAt;
    private final ConfirmationStatus status;
    private final Instant createdAt;
    private final Instant resolvedAt;
    private final String resolvedBy;

    private PendingConfirmation(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.userId = Objects.requireNonNull(builder.userId, "userId");
        this.orgId = builder.orgId;
        this.channel = builder.channel != null ? builder.channel : Channel.WEB;
        this.correlationId = builder.correlationId;
        this.actionType = Objects.requireNonNull(builder.actionType, "actionType");
        this.actionDescription = builder.actionDescription;
        this.payload = builder.payload != null ?
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload)) : Collections.emptyMap();
        this.expiresAt = Objects.requireNonNull(builder.expiresAt, "expiresAt");
        this.status = builder.status != null ? builder.status : ConfirmationStatus.PENDING;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt");
        this.resolvedAt = builder.resolvedAt;
        this.resolvedBy = builder.resolvedBy;
    }

    public String getId() {
        return id;
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

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public ConfirmationStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public boolean isPending() {
        return status == ConfirmationStatus.PENDING;
    }

    /**
     * Strictly after {@code expiresAt}; the expiry instant itself is still valid.
     */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    PendingConfirmation resolve(ConfirmationStatus newStatus, Instant at, String by) {
        return toBuilder().status(newStatus).resolvedAt(at).resolvedBy(by).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .userId(userId)
                .orgId(orgId)
                .channel(channel)
                .correlationId(correlationId)
                .actionType(actionType)
                .actionDescription(actionDescription)
                .payload(payload)
                .expiresAt(expiresAt)
                .status(status)
                .createdAt(createdAt)
                .resolvedAt(resolvedAt)
                .resolvedBy(resolvedBy);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PendingConfirmation{id='" + id + "', userId='" + userId +
                "', actionType='" + actionType + "', status=" + status +
                ", expiresAt=" + expiresAt + '}';
    }

    public static class Builder {
        private String id;
        private String userId;
        private String orgId;
        private Channel channel;
        private String correlationId;
        private String actionType;
        private String actionDescription;
        private Map<String, Object> payload;
        private Instant expiresAt;
        private ConfirmationStatus status;
        private Instant createdAt;
        private Instant resolvedAt;
        private String resolvedBy;

        public Builder id(String id) {
            this.id = id;
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

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder status(ConfirmationStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public PendingConfirmation build() {
            return new PendingConfirmation(this);
        }
    }
}
