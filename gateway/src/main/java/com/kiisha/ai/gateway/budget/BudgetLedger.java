package com.kiisha.ai.gateway.budget;

import com.kiisha.ai.common.AiGatewayConstants;
import com.kiisha.ai.gateway.auth.AdminGrant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-organization token accounting over UTC calendar months.
 *
 * <p>Reads fail open: an organization without an allocation, or a store that cannot be
 * read, yields an unlimited status. Consumption is best effort; store failures are logged
 * and never reach the caller.</p>
 *
 * <p>Consumption is a read-modify-write against the store without locking, so two calls
 * for the same organization racing each other may lose one increment. Stores that need
 * exact totals must apply the increment atomically themselves.</p>
 */
public class BudgetLedger {

    private static final Logger logger = LoggerFactory.getLogger(BudgetLedger.class);

    static final int MAX_REMEMBERED_CONSUMPTIONS = 10_000;

    private final BudgetStore store;
    private final Clock clock;
    private final int defaultSoftLimitPercent;

    private final Map<String, Boolean> appliedConsumptions = Collections.synchronizedMap(
            new LinkedHashMap<>(256, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > MAX_REMEMBERED_CONSUMPTIONS;
                }
            });

    public BudgetLedger(BudgetStore store) {
        this(store, Clock.systemUTC());
    }

    public BudgetLedger(BudgetStore store, Clock clock) {
        this(store, clock, AiGatewayConstants.DEFAULT_SOFT_LIMIT_PERCENT);
    }

    /**
     * @param defaultSoftLimitPercent soft limit for tracking records created by consumption
     *                                and for {@link #setBudget(String, long, AdminGrant)}
     */
    public BudgetLedger(BudgetStore store, Clock clock, int defaultSoftLimitPercent) {
        if (defaultSoftLimitPercent < 1 || defaultSoftLimitPercent > 100) {
            throw new IllegalArgumentException("defaultSoftLimitPercent must be between 1 and 100: "
                    + defaultSoftLimitPercent);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.clock = clock;
        this.defaultSoftLimitPercent = defaultSoftLimitPercent;
        logger.debug("BudgetLedger initialized");
    }

    /**
     * Current period key, {@code YYYY-MM} in UTC.
     */
    public String currentPeriod() {
        return periodOf(clock.instant());
    }

    public static String periodOf(Instant instant) {
        return YearMonth.from(instant.atZone(ZoneOffset.UTC)).toString();
    }

    /**
     * Budget status for the current period. Never throws for storage failures.
     */
    public OrgBudgetStatus checkBudget(String orgId) {
        String period = currentPeriod();
        try {
            Optional<BudgetRecord> record = store.find(orgId, period);
            if (record.isEmpty()) {
                return OrgBudgetStatus.unlimited(orgId, period, 0);
            }
            OrgBudgetStatus status = OrgBudgetStatus.fromRecord(record.get());
            if (status.isSoftLimitReached()) {
                logger.debug("Soft budget limit reached for org {}: {}", orgId, status);
            }
            return status;
        } catch (RuntimeException e) {
            logger.warn("Budget check failed for org {} ({}), allowing call: {}", orgId, period, e.getMessage());
            return OrgBudgetStatus.unlimited(orgId, period, 0);
        }
    }

    public void consumeBudget(String orgId, long tokens) {
        consumeBudget(orgId, tokens, null);
    }

    /**
     * Adds consumed tokens to the current period. A repeated {@code consumptionId} is ignored,
     * so a retried write cannot double-count. Non-positive token counts are ignored.
     */
    public void consumeBudget(String orgId, long tokens, String consumptionId) {
        if (tokens <= 0) {
            logger.debug("Ignoring non-positive consumption {} for org {}", tokens, orgId);
            return;
        }
        if (consumptionId != null && appliedConsumptions.putIfAbsent(consumptionId, Boolean.TRUE) != null) {
            logger.debug("Consumption {} already applied for org {}", consumptionId, orgId);
            return;
        }

        String period = currentPeriod();
        Instant now = clock.instant();
        try {
            Optional<BudgetRecord> existing = store.find(orgId, period);
            BudgetRecord updated;
            if (existing.isPresent()) {
                updated = existing.get().toBuilder()
                        .consumedTokens(existing.get().getConsumedTokens() + tokens)
                        .updatedAt(now)
                        .build();
            } else {
                updated = BudgetRecord.builder()
                        .orgId(orgId)
                        .period(period)
                        .consumedTokens(tokens)
                        .softLimitPercent(defaultSoftLimitPercent)
                        .createdAt(now)
                        .build();
            }
            store.save(updated);
            logger.debug("Consumed {} tokens for org {} in {}: total {}", tokens, orgId, period,
                    updated.getConsumedTokens());
        } catch (RuntimeException e) {
            if (consumptionId != null) {
                appliedConsumptions.remove(consumptionId);
            }
            logger.warn("Failed to record {} tokens for org {} in {}: {}", tokens, orgId, period, e.getMessage());
        }
    }

    public void setBudget(String orgId, long allocatedTokens, AdminGrant grant) {
        setBudget(orgId, allocatedTokens, defaultSoftLimitPercent, false, grant);
    }

    /**
     * Sets the current period's allocation, keeping any consumption already recorded.
     * Storage failures propagate: an administrator must learn the change did not apply.
     */
    public void setBudget(String orgId, long allocatedTokens, int softLimitPercent, boolean overageAllowed,
                          AdminGrant grant) {
        Objects.requireNonNull(grant, "grant");
        Objects.requireNonNull(orgId, "orgId");
        if (allocatedTokens < 0) {
            throw new IllegalArgumentException("allocatedTokens must not be negative: " + allocatedTokens);
        }
        if (softLimitPercent < 1 || softLimitPercent > 100) {
            throw new IllegalArgumentException("softLimitPercent must be between 1 and 100: " + softLimitPercent);
        }

        String period = currentPeriod();
        Instant now = clock.instant();
        BudgetRecord base = store.find(orgId, period)
                .orElseGet(() -> BudgetRecord.builder().orgId(orgId).period(period).createdAt(now).build());

        store.save(base.toBuilder()
                .allocatedTokens(allocatedTokens)
                .softLimitPercent(softLimitPercent)
                .overageAllowed(overageAllowed)
                .updatedAt(now)
                .build());
        logger.info("Budget set for org {} in {} by {}: {} tokens, soft limit {}%, overage {}",
                orgId, period, grant.getUserId(), allocatedTokens, softLimitPercent,
                overageAllowed ? "allowed" : "blocked");
    }

    public List<BudgetHistoryEntry> getBudgetHistory(String orgId) {
        return getBudgetHistory(orgId, AiGatewayConstants.DEFAULT_BUDGET_HISTORY_PERIODS);
    }

    /**
     * Most recent periods first. Empty when the store cannot be read.
     */
    public List<BudgetHistoryEntry> getBudgetHistory(String orgId, int periods) {
        try {
            return store.findByOrg(orgId, periods).stream()
                    .map(BudgetHistoryEntry::fromRecord)
                    .toList();
        } catch (RuntimeException e) {
            logger.warn("Failed to read budget history for org {}: {}", orgId, e.getMessage());
            return List.of();
        }
    }
}
