package app.fieldbridge.importer.service.batch;

import java.util.List;

public record BatchResult(
        int batchIndex,
        int attempted,
        int succeeded,
        int failed,
        List<ImportError> errors,
        boolean transportFailure
) {
    public BatchResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static BatchResult transportFailure(int batchIndex, int attempted, String message) {
        return new BatchResult(
                batchIndex,
                attempted,
                0,
                attempted,
                List.of(ImportError.forBatch(batchIndex, message)),
                true
        );
    }
}
