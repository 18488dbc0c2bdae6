package com.catalog.matching.audit;

/**
 * Auditable write operations on training data.
 */
public enum AuditAction {
    APPROVAL_RECORDED,
    APPROVAL_FAILED,
    ALIAS_UPSERTED,
    TRAINING_WEIGHT_UPDATED,
    TRAINING_IMPORTED
}
