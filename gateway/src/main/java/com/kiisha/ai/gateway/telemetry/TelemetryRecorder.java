package com.kiisha.ai.gateway.telemetry;

import com.kiisha.ai.common.AiGatewayConstants;
import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.gateway.audit.AuditEntry;
import com.kiisha.ai.gateway.audit.AuditStore;
import com.kiisha.ai.gateway.audit.CorrelationContext;
import com.kiisha.ai.gateway.audit.UsageRecord;
import com.kiisha.ai.gateway.budget.BudgetLedger;
import com.kiisha.ai.gateway.providers.ProviderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit and usage logging for every gateway call, plus the real-time window.
 * Write failures are logged and never thrown: telemetry must not break the call it describes.
 */
public class TelemetryRecorder {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryRecorder.class);

    private final AuditStore store;
    private final CostTable costTable;
    private final RealtimeMetrics realtime;
    private final Clock clock;

    public TelemetryRecorder(AuditStore store) {
        this(store, CostTable.defaults(), Clock.systemUTC());
    }

    public TelemetryRecorder(AuditStore store, CostTable costTable, Clock clock) {
        this.store = store;
        this.costTable = costTable;
        this.clock = clock;
        this.realtime = new RealtimeMetrics(clock);
        logger.debug("TelemetryRecorder initialized");
    }

    /**
     * Writes the audit entry for a call under the event's pre-assigned audit id.
     *
     * @return true if the entry was stored
     */
    public boolean recordAudit(TelemetryEvent event) {
        AuditEntry entry = AuditEntry.builder()
                .id(event.getAuditId())
                .timestamp(clock.instant())
                .category(AiGatewayConstants.AUDIT_CATEGORY_CALL)
                .eventType(event.getEventType())
                .task(event.getTask())
                .taskName(event.getTaskName())
                .userId(event.getUserId())
                .orgId(event.getOrgId())
                .channel(event.getChannel())
                .correlationId(event.getCorrelationId())
                .provider(event.getProvider())
                .model(event.getModel())
                .promptHash(event.getPromptHash())
                .inputTokens(event.getInputTokens())
                .outputTokens(event.getOutputTokens())
                .latencyMs(event.getLatencyMs())
                .success(event.isSuccess())
                .toolCalls(event.getToolCalls().stream()
                        .map(call -> new AuditEntry.ToolCallRecord(call.getName(), call.getArguments()))
                        .toList())
                .outputSummary(truncate(event.getOutputSummary()))
                .errorCode(event.getErrorCode())
                .errorMessage(event.getErrorMessage())
                .build();

        return writeAuditEntry(entry);
    }

    /**
     * Writes an audit entry for an administrative change (routing or budget).
     */
    public boolean recordAdminAction(String eventType, String userId, String orgId, boolean success,
                                     String detail) {
        AuditEntry entry = AuditEntry.builder()
                .timestamp(clock.instant())
                .category(AiGatewayConstants.AUDIT_CATEGORY_ADMIN)
                .eventType(eventType)
                .userId(userId)
                .orgId(orgId)
                .correlationId(CorrelationContext.current().orElseGet(CorrelationContext::newCorrelationId))
                .success(success)
                .outputSummary(success ? truncate(detail) : null)
                .errorMessage(success ? null : detail)
                .build();

        return writeAuditEntry(entry);
    }

    private boolean writeAuditEntry(AuditEntry entry) {
        logger.info("[AUDIT] {} | {} | {} | corr={} | user={} | org={} | provider={} | success={} | tokens={}/{} | {}ms",
                entry.getCategory(),
                entry.getEventType() != null ? entry.getEventType() : "-",
                entry.getTaskName() != null ? entry.getTaskName() : "-",
                entry.getCorrelationId(),
                entry.getUserId() != null ? entry.getUserId() : "-",
                entry.getOrgId() != null ? entry.getOrgId() : "-",
                entry.getProvider() != null ? entry.getProvider() : "-",
                entry.isSuccess(),
                entry.getInputTokens(),
                entry.getOutputTokens(),
                entry.getLatencyMs());

        if (logger.isDebugEnabled() && entry.getErrorMessage() != null) {
            logger.debug("[AUDIT DETAILS] {} error={}: {}", entry.getId(), entry.getErrorCode(), entry.getErrorMessage());
        }

        try {
            store.appendAudit(entry);
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to store audit entry {} (corr={}): {}", entry.getId(), entry.getCorrelationId(),
                    e.getMessage());
            return false;
        }
    }

    /**
     * Writes the usage record for a call that reached a provider, with its estimated cost.
     */
    public boolean recordUsage(TelemetryEvent event) {
        Instant now = clock.instant();
        UsageRecord record = UsageRecord.builder()
                .orgId(event.getOrgId())
                .userId(event.getUserId())
                .task(event.getTask())
                .provider(event.getProvider())
                .model(event.getModel())
                .inputTokens(event.getInputTokens())
                .outputTokens(event.getOutputTokens())
                .estimatedCost(costTable.estimate(event.getModel(), event.getInputTokens(), event.getOutputTokens()))
                .latencyMs(event.getLatencyMs())
                .success(event.isSuccess())
                .period(BudgetLedger.periodOf(now))
                .correlationId(event.getCorrelationId())
                .createdAt(now)
                .build();

        try {
            store.appendUsage(record);
            logger.debug("Usage recorded: {}", record);
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to store usage record (corr={}): {}", event.getCorrelationId(), e.getMessage());
            return false;
        }
    }

    public void recordRealtime(long latencyMs, boolean success) {
        realtime.record(latencyMs, success);
    }

    public RealtimeMetrics.Snapshot getRealtimeMetrics() {
        return realtime.snapshot();
    }

    /**
     * Aggregates an organization's usage records for a period ({@code YYYY-MM}).
     */
    public UsageMetrics getOrgUsageMetrics(String orgId, String period) {
        List<UsageRecord> records;
        try {
            records = store.findUsage(orgId, period);
        } catch (RuntimeException e) {
            logger.warn("Failed to read usage for org {} in {}: {}", orgId, period, e.getMessage());
            records = List.of();
        }

        long totalTokens = 0;
        double totalCost = 0;
        long totalLatency = 0;
        int successes = 0;
        Map<AiTask, long[]> taskTotals = new EnumMap<>(AiTask.class);
        Map<ProviderId, double[]> providerTotals = new EnumMap<>(ProviderId.class);

        for (UsageRecord record : records) {
            totalTokens += record.getTotalTokens();
            totalCost += record.getEstimatedCost();
            totalLatency += record.getLatencyMs();
            if (record.isSuccess()) {
                successes++;
            }
            if (record.getTask() != null) {
                // tokens, calls, latency
                long[] t = taskTotals.computeIfAbsent(record.getTask(), k -> new long[3]);
                t[0] += record.getTotalTokens();
                t[1]++;
                t[2] += record.getLatencyMs();
            }
            if (record.getProvider() != null) {
                // tokens, calls, cost
                double[] p = providerTotals.computeIfAbsent(record.getProvider(), k -> new double[3]);
                p[0] += record.getTotalTokens();
                p[1]++;
                p[2] += record.getEstimatedCost();
            }
        }

        Map<AiTask, UsageMetrics.TaskUsage> byTask = new EnumMap<>(AiTask.class);
        taskTotals.forEach((task, t) ->
                byTask.put(task, new UsageMetrics.TaskUsage(t[0], (int) t[1], Math.round((double) t[2] / t[1]))));
        Map<ProviderId, UsageMetrics.ProviderUsage> byProvider = new EnumMap<>(ProviderId.class);
        providerTotals.forEach((provider, p) ->
                byProvider.put(provider, new UsageMetrics.ProviderUsage((long) p[0], (int) p[1], p[2])));

        int calls = records.size();
        return new UsageMetrics(orgId, period, totalTokens, totalCost, calls,
                calls > 0 ? Math.round((double) totalLatency / calls) : 0,
                calls > 0 ? (double) successes / calls : 1.0,
                byTask, byProvider);
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= AiGatewayConstants.OUTPUT_SUMMARY_MAX_LENGTH) {
            return text;
        }
        return text.substring(0, AiGatewayConstants.OUTPUT_SUMMARY_MAX_LENGTH);
    }
}
