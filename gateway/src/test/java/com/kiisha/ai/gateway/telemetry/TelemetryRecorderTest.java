package com.kiisha.ai.gateway.telemetry;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.Channel;
import com.kiisha.ai.gateway.MutableClock;
import com.kiisha.ai.gateway.audit.AuditEntry;
import com.kiisha.ai.gateway.audit.AuditStore;
import com.kiisha.ai.gateway.audit.InMemoryAuditStore;
import com.kiisha.ai.gateway.audit.UsageRecord;
import com.kiisha.ai.gateway.providers.AiMessage;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for TelemetryRecorder.
 */
class TelemetryRecorderTest {

    private MutableClock clock;
    private InMemoryAuditStore store;
    private TelemetryRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-02-20T08:30:00Z");
        store = new InMemoryAuditStore();
        recorder = new TelemetryRecorder(store, CostTable.defaults(), clock);
    }

    private TelemetryEvent.Builder event(String auditId) {
        return TelemetryEvent.builder()
                .auditId(auditId)
                .eventType("TASK_COMPLETED")
                .task(AiTask.DOC_SUMMARIZE)
                .taskName("DOC_SUMMARIZE")
                .userId("user-1")
                .orgId("org-1")
                .channel(Channel.API)
                .correlationId("corr-" + auditId)
                .provider(ProviderId.OPENAI)
                .model("gpt-4o")
                .promptHash("0123456789abcdef")
                .inputTokens(1000)
                .outputTokens(2000)
                .latencyMs(120)
                .success(true);
    }

    // ========== Audit Tests ==========

    @Test
    void testRecordAudit_usesPreassignedId() {
        ToolCall call = ToolCall.builder().id("c1").name("lookup").arguments("{\"q\":1}").build();
        assertTrue(recorder.recordAudit(event("a-1").toolCalls(List.of(call)).build()));

        AuditEntry entry = store.findAudit("a-1").orElseThrow();
        assertEquals("corr-a-1", entry.getCorrelationId());
        assertEquals(clock.instant(), entry.getTimestamp());
        assertEquals("AI_CALL", entry.getCategory());
        assertEquals("lookup", entry.getToolCalls().get(0).getName());
        assertEquals(ProviderId.OPENAI, entry.getProvider());
    }

    @Test
    void testRecordAudit_truncatesOutputSummary() {
        recorder.recordAudit(event("a-2").outputSummary("x".repeat(800)).build());
        assertEquals(500, store.findAudit("a-2").orElseThrow().getOutputSummary().length());
    }

    @Test
    void testRecordAudit_appendOnly() {
        assertTrue(recorder.recordAudit(event("a-3").build()));
        assertFalse(recorder.recordAudit(event("a-3").success(false).build()));
        assertTrue(store.findAudit("a-3").orElseThrow().isSuccess());
    }

    @Test
    void testRecordAudit_storeFailureIsSwallowed() {
        AuditStore failing = mock(AuditStore.class);
        doThrow(new IllegalStateException("disk full")).when(failing).appendAudit(any());
        doThrow(new IllegalStateException("disk full")).when(failing).appendUsage(any());
        TelemetryRecorder failingRecorder = new TelemetryRecorder(failing, CostTable.defaults(), clock);

        assertFalse(failingRecorder.recordAudit(event("a-4").build()));
        assertFalse(failingRecorder.recordUsage(event("a-4").build()));
    }

    // ========== Usage Tests ==========

    @Test
    void testRecordUsage_costAndPeriod() {
        recorder.recordUsage(event("u-1").build());

        UsageRecord record = store.getUsageLog().get(0);
        assertEquals("2025-02", record.getPeriod());
        assertEquals(3000, record.getTotalTokens());
        assertEquals(0.005 + 0.030, record.getEstimatedCost(), 1e-9);
    }

    @Test
    void testCostTable_forgeFreeUnknownConservative() {
        CostTable costs = CostTable.defaults();
        assertEquals(0.0, costs.estimate("forge-default", 5000, 5000), 1e-9);
        assertEquals(0.01 + 0.03, costs.estimate("mystery-model", 1000, 1000), 1e-9);
        assertEquals(0.01 + 0.03, costs.estimate(null, 1000, 1000), 1e-9);
    }

    @Test
    void testGetOrgUsageMetrics_aggregates() {
        recorder.recordUsage(event("m-1").build());
        recorder.recordUsage(event("m-2").task(AiTask.CHAT_RESPONSE).provider(ProviderId.FORGE)
                .model("forge-default").inputTokens(100).outputTokens(50).latencyMs(80).success(false).build());
        recorder.recordUsage(event("m-3").orgId("org-2").build());

        UsageMetrics metrics = recorder.getOrgUsageMetrics("org-1", "2025-02");

        assertEquals(2, metrics.getCallCount());
        assertEquals(3150, metrics.getTotalTokens());
        assertEquals(100, metrics.getAvgLatencyMs());
        assertEquals(0.5, metrics.getSuccessRate(), 1e-9);
        assertEquals(150, metrics.getByTask().get(AiTask.CHAT_RESPONSE).getTokens());
        assertEquals(0.0, metrics.getByProvider().get(ProviderId.FORGE).getCost(), 1e-9);
        assertEquals(1, metrics.getByProvider().get(ProviderId.OPENAI).getCalls());
    }

    @Test
    void testGetOrgUsageMetrics_emptyPeriod() {
        UsageMetrics metrics = recorder.getOrgUsageMetrics("org-1", "2024-01");
        assertEquals(0, metrics.getCallCount());
        assertEquals(1.0, metrics.getSuccessRate(), 1e-9);
        assertTrue(metrics.getByTask().isEmpty());
    }

    // ========== Prompt Hash Tests ==========

    @Test
    void testPromptHasher_sixteenHexChars() {
        String hash = PromptHasher.hash("hello");
        assertEquals("2cf24dba5fb0a30e", hash);
    }

    @Test
    void testPromptHasher_messagesDeterministic() {
        List<AiMessage> messages = List.of(
                AiMessage.system("s"),
                AiMessage.user("u"));
        assertEquals(PromptHasher.hash(messages), PromptHasher.hash(List.copyOf(messages)));
        assertNotEquals(PromptHasher.hash(messages),
                PromptHasher.hash(List.of(AiMessage.user("u"))));
    }
}
