package app.fieldbridge.importer.service.batch;

/**
 * A reported import failure. {@code batchIndex} is null for rows rejected before batching,
 * {@code rowNumber} is null for batch-wide failures.
 */
public record ImportError(Integer batchIndex, Integer rowNumber, String message) {

    public static ImportError forBatch(int batchIndex, String message) {
        return new ImportError(batchIndex, null, message);
    }

    public static ImportError forRow(Integer batchIndex, Integer rowNumber, String message) {
        return new ImportError(batchIndex, rowNumber, message);
    }
}
