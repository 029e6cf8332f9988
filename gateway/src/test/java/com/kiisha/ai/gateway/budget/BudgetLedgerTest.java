package com.kiisha.ai.gateway.budget;

import com.kiisha.ai.gateway.MutableClock;
import com.kiisha.ai.gateway.auth.AdminGrant;
import com.kiisha.ai.gateway.auth.StaticCapabilityCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BudgetLedger.
 */
class BudgetLedgerTest {

    private MutableClock clock;
    private InMemoryBudgetStore store;
    private BudgetLedger ledger;
    private AdminGrant grant;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2025-03-14T12:00:00Z");
        store = new InMemoryBudgetStore();
        ledger = new BudgetLedger(store, clock);
        grant = AdminGrant.issue("root", StaticCapabilityCheck.builder().superuser("root").build());
    }

    // ========== Period Tests ==========

    @Test
    void testCurrentPeriod_utcMonth() {
        assertEquals("2025-03", ledger.currentPeriod());
        clock.set(Instant.parse("2025-03-31T23:59:59Z"));
        assertEquals("2025-03", ledger.currentPeriod());
        clock.set(Instant.parse("2025-04-01T00:00:00Z"));
        assertEquals("2025-04", ledger.currentPeriod());
    }

    // ========== checkBudget Tests ==========

    @Nested
    @DisplayName("checkBudget")
    class CheckBudget {

        @Test
        void testCheckBudget_noRecordIsUnlimited() {
            OrgBudgetStatus status = ledger.checkBudget("org-1");
            assertTrue(status.isUnlimited());
            assertFalse(status.isHardLimitReached());
            assertFalse(status.isSoftLimitReached());
            assertEquals("2025-03", status.getPeriod());
        }

        @Test
        void testCheckBudget_derivedFields() {
            ledger.setBudget("org-1", 1000, grant);
            ledger.consumeBudget("org-1", 250);

            OrgBudgetStatus status = ledger.checkBudget("org-1");
            assertFalse(status.isUnlimited());
            assertEquals(1000, status.getAllocatedTokens());
            assertEquals(250, status.getConsumedTokens());
            assertEquals(750, status.getRemainingTokens());
            assertEquals(25.0, status.getPercentUsed(), 0.0001);
            assertFalse(status.isSoftLimitReached());
            assertFalse(status.isHardLimitReached());
        }

        @Test
        void testCheckBudget_softLimitAtThreshold() {
            ledger.setBudget("org-1", 1000, grant);
            ledger.consumeBudget("org-1", 800);

            OrgBudgetStatus status = ledger.checkBudget("org-1");
            assertTrue(status.isSoftLimitReached());
            assertFalse(status.isHardLimitReached());
        }

        @Test
        void testCheckBudget_hardLimitWhenExhausted() {
            ledger.setBudget("org-1", 1000, grant);
            ledger.consumeBudget("org-1", 1200);

            OrgBudgetStatus status = ledger.checkBudget("org-1");
            assertTrue(status.isHardLimitReached());
            assertEquals(0, status.getRemainingTokens());
            assertEquals(120.0, status.getPercentUsed(), 0.0001);
        }

        @Test
        void testCheckBudget_overageAllowedNeverHardLimits() {
            ledger.setBudget("org-1", 1000, 80, true, grant);
            ledger.consumeBudget("org-1", 5000);

            OrgBudgetStatus status = ledger.checkBudget("org-1");
            assertFalse(status.isHardLimitReached());
            assertTrue(status.isSoftLimitReached());
        }

        @Test
        void testCheckBudget_newPeriodStartsFresh() {
            ledger.setBudget("org-1", 1000, grant);
            ledger.consumeBudget("org-1", 1000);
            assertTrue(ledger.checkBudget("org-1").isHardLimitReached());

            clock.set(Instant.parse("2025-04-01T00:00:00Z"));
            assertTrue(ledger.checkBudget("org-1").isUnlimited());
        }

        @Test
        void testCheckBudget_storeFailureFailsOpen() {
            BudgetStore failing = mock(BudgetStore.class);
            when(failing.find(anyString(), anyString())).thenThrow(new IllegalStateException("db down"));
            BudgetLedger failingLedger = new BudgetLedger(failing, clock);

            OrgBudgetStatus status = failingLedger.checkBudget("org-1");
            assertTrue(status.isUnlimited());
            assertFalse(status.isHardLimitReached());
        }
    }

    // ========== consumeBudget Tests ==========

    @Nested
    @DisplayName("consumeBudget")
    class ConsumeBudget {

        @Test
        void testConsumeBudget_missingRecordCreatesTrackingRecord() {
            ledger.consumeBudget("org-1", 40);

            BudgetRecord record = store.find("org-1", "2025-03").orElseThrow();
            assertFalse(record.isAllocated());
            assertEquals(40, record.getConsumedTokens());
            assertTrue(ledger.checkBudget("org-1").isUnlimited());
            assertEquals(40, ledger.checkBudget("org-1").getConsumedTokens());
        }

        @Test
        void testConsumeBudget_monotonic() {
            long previous = 0;
            for (int i = 1; i <= 5; i++) {
                ledger.consumeBudget("org-1", i * 10L);
                long consumed = store.find("org-1", "2025-03").orElseThrow().getConsumedTokens();
                assertTrue(consumed >= previous);
                previous = consumed;
            }
            assertEquals(150, previous);
        }

        @Test
        void testConsumeBudget_ignoresNonPositive() {
            ledger.consumeBudget("org-1", 0);
            ledger.consumeBudget("org-1", -5);
            assertTrue(store.find("org-1", "2025-03").isEmpty());
        }

        @Test
        void testConsumeBudget_duplicateConsumptionIdIgnored() {
            ledger.consumeBudget("org-1", 100, "audit-1");
            ledger.consumeBudget("org-1", 100, "audit-1");
            ledger.consumeBudget("org-1", 100, "audit-2");

            assertEquals(200, store.find("org-1", "2025-03").orElseThrow().getConsumedTokens());
        }

        @Test
        void testConsumeBudget_storeFailureIsSwallowed() {
            BudgetStore failing = mock(BudgetStore.class);
            when(failing.find(anyString(), anyString())).thenReturn(Optional.empty());
            doThrow(new IllegalStateException("write failed")).when(failing).save(any());
            BudgetLedger failingLedger = new BudgetLedger(failing, clock);

            assertDoesNotThrow(() -> failingLedger.consumeBudget("org-1", 10, "audit-9"));
        }

        @Test
        void testConsumeBudget_failedWriteCanBeRetriedWithSameId() {
            BudgetStore flaky = mock(BudgetStore.class);
            when(flaky.find(anyString(), anyString())).thenThrow(new IllegalStateException("timeout"))
                    .thenReturn(Optional.empty());
            BudgetLedger flakyLedger = new BudgetLedger(flaky, clock);

            flakyLedger.consumeBudget("org-1", 10, "audit-3");
            flakyLedger.consumeBudget("org-1", 10, "audit-3");

            verify(flaky).save(any());
        }
    }

    // ========== setBudget Tests ==========

    @Test
    void testSetBudget_keepsConsumption() {
        ledger.consumeBudget("org-1", 300);
        ledger.setBudget("org-1", 1000, 90, false, grant);

        BudgetRecord record = store.find("org-1", "2025-03").orElseThrow();
        assertEquals(1000L, record.getAllocatedTokens());
        assertEquals(300, record.getConsumedTokens());
        assertEquals(90, record.getSoftLimitPercent());
    }

    @Test
    void testSetBudget_rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> ledger.setBudget("org-1", -1, grant));
        assertThrows(IllegalArgumentException.class, () -> ledger.setBudget("org-1", 10, 0, false, grant));
        assertThrows(NullPointerException.class, () -> ledger.setBudget("org-1", 10, null));
    }

    @Test
    void testSetBudget_storeFailurePropagates() {
        BudgetStore failing = mock(BudgetStore.class);
        when(failing.find(anyString(), anyString())).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("write failed")).when(failing).save(any());
        BudgetLedger failingLedger = new BudgetLedger(failing, clock);

        assertThrows(IllegalStateException.class, () -> failingLedger.setBudget("org-1", 10, grant));
    }

    // ========== History Tests ==========

    @Test
    void testGetBudgetHistory_mostRecentFirstAndLimited() {
        String[] months = {"2024-10", "2024-11", "2024-12", "2025-01", "2025-02", "2025-03", "2025-04", "2025-05"};
        for (String month : months) {
            clock.set(Instant.parse(month + "-15T00:00:00Z"));
            ledger.setBudget("org-1", 1000, grant);
            ledger.consumeBudget("org-1", 100);
        }
        ledger.setBudget("org-2", 50, grant);

        List<BudgetHistoryEntry> history = ledger.getBudgetHistory("org-1");
        assertEquals(6, history.size());
        assertEquals("2025-05", history.get(0).getPeriod());
        assertEquals("2024-12", history.get(5).getPeriod());
        assertEquals(10.0, history.get(0).getPercentUsed(), 0.0001);

        assertEquals(2, ledger.getBudgetHistory("org-1", 2).size());
    }

    @Test
    void testGetBudgetHistory_storeFailureReturnsEmpty() {
        BudgetStore failing = mock(BudgetStore.class);
        when(failing.findByOrg(anyString(), anyInt()))
                .thenThrow(new IllegalStateException("db down"));

        assertTrue(new BudgetLedger(failing, clock).getBudgetHistory("org-1").isEmpty());
        verify(failing, never()).save(any());
    }
}
