package app.fieldbridge.importer.service.batch;

/**
 * Receives one progress event per completed batch, in batch order, on the thread driving the import.
 */
@FunctionalInterface
public interface ImportProgressListener {

    ImportProgressListener NOOP = progress -> {
    };

    void onProgress(ImportProgress progress);

    default void onBatch(BatchResult result) {
    }
}
