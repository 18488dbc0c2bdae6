package com.catalog.matching.training;

/**
 * Outcome of recording an approval. A failed write is reported here instead of thrown.
 *
 * @param exampleId     id of the stored training example, null when not persisted
 * @param persisted     whether the training example was written
 * @param created       true for a new example, false when an existing one was updated
 * @param aliasUpserted whether an alias was written alongside the example
 * @param message       failure reason, null on success
 */
public record ApprovalAck(
        String exampleId,
        boolean persisted,
        boolean created,
        boolean aliasUpserted,
        String message
) {
    public static ApprovalAck stored(String exampleId, boolean created, boolean aliasUpserted) {
        return new ApprovalAck(exampleId, true, created, aliasUpserted, null);
    }

    public static ApprovalAck failed(String message) {
        return new ApprovalAck(null, false, false, false, message);
    }
}
