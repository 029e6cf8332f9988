package com.kiisha.ai.gateway.telemetry;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.gateway.providers.ProviderId;

import java.util.Collections;
import java.util.Map;

/**
 * Aggregated usage of one organization over one period.
 */
public final class UsageMetrics {

    public static final class TaskUsage {
        private final long tokens;
        private final int calls;
        private final long avgLatencyMs;

        TaskUsage(long tokens, int calls, long avgLatencyMs) {
            this.tokens = tokens;
            this.calls = calls;
            this.avgLatencyMs = avgLatencyMs;
        }

        public long getTokens() {
            return tokens;
        }

        public int getCalls() {
            return calls;
        }

        public long getAvgLatencyMs() {
            return avgLatencyMs;
        }
    }

    public static final class ProviderUsage {
        private final long tokens;
        private final int calls;
        private final double cost;

        ProviderUsage(long tokens, int calls, double cost) {
            this.tokens = tokens;
            this.calls = calls;
            this.cost = cost;
        }

        public long getTokens() {
            return tokens;
        }

        public int getCalls() {
            return calls;
        }

        public double getCost() {
            return cost;
        }
    }

    private final String orgId;
    private final String period;
    private final long totalTokens;
    private final double totalCost;
    private final int callCount;
    private final long avgLatencyMs;
    private final double successRate;
    private final Map<AiTask, TaskUsage> byTask;
    private final Map<ProviderId, ProviderUsage> byProvider;

    UsageMetrics(String orgId, String period, long totalTokens, double totalCost, int callCount,
                 long avgLatencyMs, double successRate, Map<AiTask, TaskUsage> byTask,
                 Map<ProviderId, ProviderUsage> byProvider) {
        this.orgId = orgId;
        this.period = period;
        this.totalTokens = totalTokens;
        this.totalCost = totalCost;
        this.callCount = callCount;
        this.avgLatencyMs = avgLatencyMs;
        this.successRate = successRate;
        this.byTask = Collections.unmodifiableMap(byTask);
        this.byProvider = Collections.unmodifiableMap(byProvider);
    }

    public String getOrgId() {
        return orgId;
    }

    public String getPeriod() {
        return period;
    }

    public long getTotalTokens() {
        return totalTokens;
    }

    public double getTotalCost() {
        return totalCost;
    }

    public int getCallCount() {
        return callCount;
    }

    public long getAvgLatencyMs() {
        return avgLatencyMs;
    }

    /**
     * Fraction of calls that succeeded; 1.0 when there were no calls
     */
    public double getSuccessRate() {
        return successRate;
    }

    public Map<AiTask, TaskUsage> getByTask() {
        return byTask;
    }

    public Map<ProviderId, ProviderUsage> getByProvider() {
        return byProvider;
    }
}
