package app.fieldbridge.importer.service.batch;

/**
 * Raised when an import stops on an unexpected error. Carries the counts accumulated
 * from the batches that completed before the failure.
 */
public class ImportAbortedException extends RuntimeException {

    private final ImportSummary partialSummary;

    public ImportAbortedException(String message, ImportSummary partialSummary, Throwable cause) {
        super(message, cause);
        this.partialSummary = partialSummary;
    }

    public ImportSummary getPartialSummary() {
        return partialSummary;
    }
}
