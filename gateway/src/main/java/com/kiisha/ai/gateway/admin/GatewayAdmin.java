package com.kiisha.ai.gateway.admin;

import com.kiisha.ai.common.model.ValidationResult;
import com.kiisha.ai.gateway.auth.AdminGrant;
import com.kiisha.ai.gateway.auth.AuthorizationException;
import com.kiisha.ai.gateway.budget.BudgetHistoryEntry;
import com.kiisha.ai.gateway.budget.BudgetLedger;
import com.kiisha.ai.gateway.budget.OrgBudgetStatus;
import com.kiisha.ai.gateway.routing.GlobalRoutingConfig;
import com.kiisha.ai.gateway.routing.Router;
import com.kiisha.ai.gateway.telemetry.TelemetryRecorder;
import com.kiisha.ai.gateway.telemetry.UsageMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Administrative operations on routing and budgets. Every mutation needs an
 * {@link AdminGrant}, which only a superuser can obtain, and is written to the audit log.
 */
public class GatewayAdmin {

    private static final Logger logger = LoggerFactory.getLogger(GatewayAdmin.class);

    static final String EVENT_ROUTING_UPDATED = "ROUTING_CONFIG_UPDATED";
    static final String EVENT_BUDGET_UPDATED = "BUDGET_UPDATED";

    private final Router router;
    private final BudgetLedger budgetLedger;
    private final TelemetryRecorder telemetry;

    public GatewayAdmin(Router router, BudgetLedger budgetLedger, TelemetryRecorder telemetry) {
        this.router = router;
        this.budgetLedger = budgetLedger;
        this.telemetry = telemetry;
    }

    public GlobalRoutingConfig getRoutingConfig() {
        return router.getRoutingConfig();
    }

    /**
     * Validates and swaps in a new routing config.
     *
     * @throws AuthorizationException if no grant is presented
     * @throws IllegalArgumentException if the config does not validate
     */
    public void setRoutingConfig(GlobalRoutingConfig config, AdminGrant grant) throws AuthorizationException {
        requireGrant(grant, "setRoutingConfig");
        ValidationResult validation = config.validate();
        if (!validation.isValid()) {
            telemetry.recordAdminAction(EVENT_ROUTING_UPDATED, grant.getUserId(), null, false,
                    validation.getErrorSummary());
            throw new IllegalArgumentException("Invalid routing config: " + validation.getErrorSummary());
        }
        router.setRoutingConfig(config);
        telemetry.recordAdminAction(EVENT_ROUTING_UPDATED, grant.getUserId(), null, true, config.toString());
    }

    /**
     * Sets an organization's allocation for the current period.
     *
     * @throws AuthorizationException if no grant is presented
     */
    public void setBudget(String orgId, long allocatedTokens, int softLimitPercent, boolean overageAllowed,
                          AdminGrant grant) throws AuthorizationException {
        requireGrant(grant, "setBudget");
        budgetLedger.setBudget(orgId, allocatedTokens, softLimitPercent, overageAllowed, grant);
        telemetry.recordAdminAction(EVENT_BUDGET_UPDATED, grant.getUserId(), orgId, true,
                "allocated=" + allocatedTokens + " softLimit=" + softLimitPercent + "% overage=" + overageAllowed);
    }

    public OrgBudgetStatus getBudgetStatus(String orgId) {
        return budgetLedger.checkBudget(orgId);
    }

    public List<BudgetHistoryEntry> getBudgetHistory(String orgId, int periods) {
        return budgetLedger.getBudgetHistory(orgId, periods);
    }

    public UsageMetrics getUsageMetrics(String orgId) {
        return telemetry.getOrgUsageMetrics(orgId, budgetLedger.currentPeriod());
    }

    private static void requireGrant(AdminGrant grant, String operation) throws AuthorizationException {
        if (grant == null) {
            logger.warn("Refused {} without an admin grant", operation);
            throw new AuthorizationException("Operation " + operation + " requires superuser privileges",
                    null, AdminGrant.CAPABILITY);
        }
    }
}
