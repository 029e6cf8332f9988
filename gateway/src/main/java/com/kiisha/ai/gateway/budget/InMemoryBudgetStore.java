package com.kiisha.ai.gateway.budget;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBudgetStore implements BudgetStore {

    private final Map<String, BudgetRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<BudgetRecord> find(String orgId, String period) {
        return Optional.ofNullable(records.get(key(orgId, period)));
    }

    @Override
    public void save(BudgetRecord record) {
        records.put(key(record.getOrgId(), record.getPeriod()), record);
    }

    @Override
    public List<BudgetRecord> findByOrg(String orgId, int limit) {
        return records.values().stream()
                .filter(r -> r.getOrgId().equals(orgId))
                .sorted(Comparator.comparing(BudgetRecord::getPeriod).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    private static String key(String orgId, String period) {
        return orgId + "|" + period;
    }
}
