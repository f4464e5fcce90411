package app.fieldbridge.importer.service.batch;

import java.util.List;

/**
 * Outcome reported by a {@link RecordPersister}. {@code RowError.rowIndex} is the 0-based
 * position inside the submitted batch.
 */
public record PersistResult(int importedCount, List<RowError> errors) {

    public PersistResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static PersistResult imported(int count) {
        return new PersistResult(count, List.of());
    }

    public record RowError(Integer rowIndex, String message) {
    }
}
