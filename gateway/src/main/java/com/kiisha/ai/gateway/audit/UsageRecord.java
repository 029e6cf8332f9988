package com.kiisha.ai.gateway.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.gateway.providers.ProviderId;

import java.time.Instant;

/**
 * Token usage and estimated cost of one executed call, bucketed by budget period.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class UsageRecord {

    private final String orgId;
    private final String userId;
    private final AiTask task;
    private final ProviderId provider;
    private final String model;
    private final int inputTokens;
    private final int outputTokens;
    private final double estimatedCost;
    private final long latencyMs;
    private final boolean success;
    private final String period;
    private final String correlationId;
    private final Instant createdAt;

    private UsageRecord(Builder builder) {
        this.orgId = builder.orgId;
        this.userId = builder.userId;
        this.task = builder.task;
        this.provider = builder.provider;
        this.model = builder.model;
        this.inputTokens = builder.inputTokens;
        this.outputTokens = builder.outputTokens;
        this.estimatedCost = builder.estimatedCost;
        this.latencyMs = builder.latencyMs;
        this.success = builder.success;
        this.period = builder.period;
        this.correlationId = builder.correlationId;
        this.createdAt = builder.createdAt;
    }

    public String getOrgId() {
        return orgId;
    }

    public String getUserId() {
        return userId;
    }

    public AiTask getTask() {
        return task;
    }

    public ProviderId getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public int getInputTokens() {
        return inputTokens;
    }

    public int getOutputTokens() {
        return outputTokens;
    }

    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }

    public double getEstimatedCost() {
        return estimatedCost;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Budget period, {@code YYYY-MM}
     */
    public String getPeriod() {
        return period;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "UsageRecord{orgId='" + orgId + "', task=" + task + ", provider=" + provider +
                ", model='" + model + "', tokens=" + getTotalTokens() +
                String.format(", cost=%.5f", estimatedCost) + ", period=" + period + '}';
    }

    public static class Builder {
        private String orgId;
        private String userId;
        private AiTask task;
        private ProviderId provider;
        private String model;
        private int inputTokens;
        private int outputTokens;
        private double estimatedCost;
        private long latencyMs;
        private boolean success;
        private String period;
        private String correlationId;
        private Instant createdAt;

        public Builder orgId(String orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder task(AiTask task) {
            this.task = task;
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

        public Builder inputTokens(int inputTokens) {
            this.inputTokens = inputTokens;
            return this;
        }

        public Builder outputTokens(int outputTokens) {
            this.outputTokens = outputTokens;
            return this;
        }

        public Builder estimatedCost(double estimatedCost) {
            this.estimatedCost = estimatedCost;
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

        public Builder period(String period) {
            this.period = period;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public UsageRecord build() {
            return new UsageRecord(this);
        }
    }
}
