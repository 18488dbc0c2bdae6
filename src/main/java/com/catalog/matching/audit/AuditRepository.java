package com.catalog.matching.audit;

import java.util.List;

/**
 * Storage for audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByScope(String scope);

    int count();

    /**
     * The most recent entries, oldest first, up to the limit.
     */
    List<AuditEntry> findRecent(int limit);
}
