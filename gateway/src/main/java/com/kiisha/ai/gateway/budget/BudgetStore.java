package com.kiisha.ai.gateway.budget;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for budget records. Implementations signal storage failures with
 * unchecked exceptions; the ledger decides which of those a caller ever sees.
 */
public interface BudgetStore {

    Optional<BudgetRecord> find(String orgId, String period);

    /**
     * Inserts or replaces the record for its (orgId, period) key.
     */
    void save(BudgetRecord record);

    /**
     * Records for an organization, most recent period first.
     */
    List<BudgetRecord> findByOrg(String orgId, int limit);
}
