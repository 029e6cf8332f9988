package com.kiisha.ai.gateway.budget;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One period in an organization's budget history.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BudgetHistoryEntry {

    private final String period;
    private final Long allocatedTokens;
    private final long consumedTokens;
    private final double percentUsed;

    BudgetHistoryEntry(String period, Long allocatedTokens, long consumedTokens, double percentUsed) {
        this.period = period;
        this.allocatedTokens = allocatedTokens;
        this.consumedTokens = consumedTokens;
        this.percentUsed = percentUsed;
    }

    static BudgetHistoryEntry fromRecord(BudgetRecord record) {
        double percent = record.isAllocated()
                ? OrgBudgetStatus.percentUsed(record.getAllocatedTokens(), record.getConsumedTokens())
                : 0.0;
        return new BudgetHistoryEntry(record.getPeriod(), record.getAllocatedTokens(),
                record.getConsumedTokens(), percent);
    }

    public String getPeriod() {
        return period;
    }

    /**
     * Null when the period had no allocation
     */
    public Long getAllocatedTokens() {
        return allocatedTokens;
    }

    public long getConsumedTokens() {
        return consumedTokens;
    }

    public double getPercentUsed() {
        return percentUsed;
    }

    @Override
    public String toString() {
        return period + ": " + consumedTokens + "/" + (allocatedTokens != null ? allocatedTokens : "-");
    }
}
