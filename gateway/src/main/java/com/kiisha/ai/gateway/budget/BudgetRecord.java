package com.kiisha.ai.gateway.budget;

import java.time.Instant;
import java.util.Objects;

/**
 * Stored budget row for one organization and one period ({@code YYYY-MM}).
 * A record without an allocation only tracks consumption; it never limits calls.
 */
public final class BudgetRecord {

    private final String orgId;
    private final String period;
    private final Long allocatedTokens;
    private final long consumedTokens;
    private final int softLimitPercent;
    private final boolean overageAllowed;
    private final Instant createdAt;
    private final Instant updatedAt;

    private BudgetRecord(Builder builder) {
        this.orgId = Objects.requireNonNull(builder.orgId, "orgId");
        this.period = Objects.requireNonNull(builder.period, "period");
        this.allocatedTokens = builder.allocatedTokens;
        this.consumedTokens = builder.consumedTokens;
        this.softLimitPercent = builder.softLimitPercent;
        this.overageAllowed = builder.overageAllowed;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : builder.createdAt;
    }

    public String getOrgId() {
        return orgId;
    }

    public String getPeriod() {
        return period;
    }

    /**
     * Allocated tokens, or null for a tracking-only record
     */
    public Long getAllocatedTokens() {
        return allocatedTokens;
    }

    public boolean isAllocated() {
        return allocatedTokens != null;
    }

    public long getConsumedTokens() {
        return consumedTokens;
    }

    public int getSoftLimitPercent() {
        return softLimitPercent;
    }

    public boolean isOverageAllowed() {
        return overageAllowed;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .orgId(orgId)
                .period(period)
                .allocatedTokens(allocatedTokens)
                .consumedTokens(consumedTokens)
                .softLimitPercent(softLimitPercent)
                .overageAllowed(overageAllowed)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "BudgetRecord{orgId='" + orgId + "', period=" + period +
                ", allocated=" + (allocatedTokens != null ? allocatedTokens : "none") +
                ", consumed=" + consumedTokens +
                ", softLimitPercent=" + softLimitPercent +
                ", overageAllowed=" + overageAllowed + '}';
    }

    public static class Builder {
        private String orgId;
        private String period;
        private Long allocatedTokens;
        private long consumedTokens;
        private int softLimitPercent = 80;
        private boolean overageAllowed;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder orgId(String orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder period(String period) {
            this.period = period;
            return this;
        }

        public Builder allocatedTokens(Long allocatedTokens) {
            this.allocatedTokens = allocatedTokens;
            return this;
        }

        public Builder consumedTokens(long consumedTokens) {
            this.consumedTokens = consumedTokens;
            return this;
        }

        public Builder softLimitPercent(int softLimitPercent) {
            this.softLimitPercent = softLimitPercent;
            return this;
        }

        public Builder overageAllowed(boolean overageAllowed) {
            this.overageAllowed = overageAllowed;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public BudgetRecord build() {
            return new BudgetRecord(this);
        }
    }
}
