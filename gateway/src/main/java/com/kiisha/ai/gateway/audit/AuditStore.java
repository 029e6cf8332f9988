package com.kiisha.ai.gateway.audit;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for audit entries and usage records. Nothing is ever updated or removed.
 */
public interface AuditStore {

    void appendAudit(AuditEntry entry);

    void appendUsage(UsageRecord record);

    Optional<AuditEntry> findAudit(String auditId);

    List<AuditEntry> findAuditByCorrelation(String correlationId);

    List<UsageRecord> findUsage(String orgId, String period);
}
