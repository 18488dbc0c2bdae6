package com.catalog.matching.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Records training writes. Audit failures are logged and never break the write being audited.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public void record(AuditEntry entry) {
        try {
            repository.save(entry);
            log.debug("Audit entry recorded: {} for {} by {}", entry.action(), entry.subjectId(), entry.actorId());
        } catch (RuntimeException e) {
            log.warn("audit.write_failed action={} subjectId={} error={}", entry.action(), entry.subjectId(), e.toString());
        }
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getEntriesForScope(String scope) {
        return repository.findByScope(scope);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}
