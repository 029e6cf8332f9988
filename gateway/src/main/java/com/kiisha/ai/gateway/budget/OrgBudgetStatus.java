package com.kiisha.ai.gateway.budget;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Budget position of one organization in one period, as seen by a pre-flight check.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OrgBudgetStatus {

    private final String orgId;
    private final String period;
    private final long allocatedTokens;
    private final long consumedTokens;
    private final long remainingTokens;
    private final double percentUsed;
    private final boolean softLimitReached;
    private final boolean hardLimitReached;
    private final boolean unlimited;

    private OrgBudgetStatus(String orgId, String period, long allocatedTokens, long consumedTokens,
                            long remainingTokens, double percentUsed, boolean softLimitReached,
                            boolean hardLimitReached, boolean unlimited) {
        this.orgId = orgId;
        this.period = period;
        this.allocatedTokens = allocatedTokens;
        this.consumedTokens = consumedTokens;
        this.remainingTokens = remainingTokens;
        this.percentUsed = percentUsed;
        this.softLimitReached = softLimitReached;
        this.hardLimitReached = hardLimitReached;
        this.unlimited = unlimited;
    }

    /**
     * Status for an organization with no allocation this period. Never limits.
     */
    public static OrgBudgetStatus unlimited(String orgId, String period, long consumedTokens) {
        return new OrgBudgetStatus(orgId, period, Long.MAX_VALUE, consumedTokens, Long.MAX_VALUE,
                0.0, false, false, true);
    }

    /**
     * Derives the status of a stored record. A tracking-only record is unlimited.
     */
    public static OrgBudgetStatus fromRecord(BudgetRecord record) {
        if (!record.isAllocated()) {
            return unlimited(record.getOrgId(), record.getPeriod(), record.getConsumedTokens());
        }
        long allocated = record.getAllocatedTokens();
        long consumed = record.getConsumedTokens();
        long remaining = allocated - consumed;
        double percentUsed = percentUsed(allocated, consumed);

        return new OrgBudgetStatus(
                record.getOrgId(),
                record.getPeriod(),
                allocated,
                consumed,
                Math.max(0, remaining),
                percentUsed,
                percentUsed >= record.getSoftLimitPercent(),
                remaining <= 0 && !record.isOverageAllowed(),
                false);
    }

    /**
     * Consumption as a percentage of the allocation. A zero allocation counts as fully used.
     */
    static double percentUsed(long allocated, long consumed) {
        if (allocated <= 0) {
            return 100.0;
        }
        return (consumed * 100.0) / allocated;
    }

    public String getOrgId() {
        return orgId;
    }

    public String getPeriod() {
        return period;
    }

    public long getAllocatedTokens() {
        return allocatedTokens;
    }

    public long getConsumedTokens() {
        return consumedTokens;
    }

    public long getRemainingTokens() {
        return remainingTokens;
    }

    public double getPercentUsed() {
        return percentUsed;
    }

    public boolean isSoftLimitReached() {
        return softLimitReached;
    }

    public boolean isHardLimitReached() {
        return hardLimitReached;
    }

    public boolean isUnlimited() {
        return unlimited;
    }

    @Override
    public String toString() {
        if (unlimited) {
            return "OrgBudgetStatus{orgId='" + orgId + "', period=" + period + ", unlimited, consumed=" +
                    consumedTokens + '}';
        }
        return "OrgBudgetStatus{orgId='" + orgId + "', period=" + period +
                ", consumed=" + consumedTokens + "/" + allocatedTokens +
                String.format(" (%.1f%%)", percentUsed) +
                ", soft=" + softLimitReached +
                ", hard=" + hardLimitReached + '}';
    }
}
