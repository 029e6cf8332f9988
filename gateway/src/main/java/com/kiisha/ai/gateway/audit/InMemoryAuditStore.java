package com.kiisha.ai.gateway.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryAuditStore implements AuditStore {

    private final Map<String, AuditEntry> auditById = new ConcurrentHashMap<>();
    private final List<AuditEntry> auditLog = new CopyOnWriteArrayList<>();
    private final List<UsageRecord> usageLog = new CopyOnWriteArrayList<>();

    @Override
    public void appendAudit(AuditEntry entry) {
        if (auditById.putIfAbsent(entry.getId(), entry) != null) {
            throw new IllegalStateException("Audit entry already written: " + entry.getId());
        }
        auditLog.add(entry);
    }

    @Override
    public void appendUsage(UsageRecord record) {
        usageLog.add(record);
    }

    @Override
    public Optional<AuditEntry> findAudit(String auditId) {
        return auditId == null ? Optional.empty() : Optional.ofNullable(auditById.get(auditId));
    }

    @Override
    public List<AuditEntry> findAuditByCorrelation(String correlationId) {
        return auditLog.stream()
                .filter(e -> e.getCorrelationId().equals(correlationId))
                .toList();
    }

    @Override
    public List<UsageRecord> findUsage(String orgId, String period) {
        return usageLog.stream()
                .filter(r -> orgId.equals(r.getOrgId()))
                .filter(r -> period == null || period.equals(r.getPeriod()))
                .toList();
    }

    public List<AuditEntry> getAuditLog() {
        return new ArrayList<>(auditLog);
    }

    public List<UsageRecord> getUsageLog() {
        return new ArrayList<>(usageLog);
    }
}
