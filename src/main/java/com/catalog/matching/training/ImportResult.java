package com.catalog.matching.training;

import java.util.List;

/**
 * Result of a training-data import.
 *
 * @param totalRows number of data rows read (header excluded, blank lines ignored)
 * @param created   rows that produced a new training example
 * @param updated   rows that re-approved an existing example
 * @param skipped   rows whose product could not be resolved
 * @param errors    rows that were rejected or failed to persist
 */
public record ImportResult(
        long totalRows,
        long created,
        long updated,
        long skipped,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long importedCount() {
        return created + updated;
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param lineNumber line in the input (1-based, header is line 1)
     * @param lineItem   line item text of the row
     * @param message    why the row was not imported
     */
    public record ImportError(long lineNumber, String lineItem, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRows +
                ", created=" + created +
                ", updated=" + updated +
                ", skipped=" + skipped +
                ", errors=" + errors.size() + '}';
    }
}
