package app.fieldbridge.importer.service.batch;

import java.util.ArrayList;
import java.util.List;

/**
 * Terminal counts of one import run.
 *
 * <p>{@code total = imported + failed + dropped + notAttempted}. {@code errors} keeps the first
 * {@code maxReportedErrors} failures in the order they happened; {@code errorCount} is the uncapped number.
 */
public record ImportSummary(
        int total,
        int imported,
        int failed,
        int dropped,
        int notAttempted,
        boolean cancelled,
        List<ImportError> errors,
        int errorCount
) {
    public ImportSummary {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ImportSummary empty() {
        return new ImportSummary(0, 0, 0, 0, 0, false, List.of(), 0);
    }

    public static Builder builder(int maxReportedErrors) {
        return new Builder(maxReportedErrors);
    }

    public static final class Builder {

        private final int maxReportedErrors;
        private final List<ImportError> errors = new ArrayList<>();
        private int total;
        private int imported;
        private int failed;
        private int dropped;
        private int notAttempted;
        private boolean cancelled;
        private int errorCount;

        private Builder(int maxReportedErrors) {
            this.maxReportedErrors = Math.max(maxReportedErrors, 0);
        }

        public Builder total(int total) {
            this.total = total;
            return this;
        }

        public Builder dropped(int dropped) {
            this.dropped = dropped;
            return this;
        }

        public Builder notAttempted(int notAttempted) {
            this.notAttempted = notAttempted;
            return this;
        }

        public Builder cancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder addRejected(int rowNumber, String message) {
            failed++;
            addError(ImportError.forRow(null, rowNumber, message));
            return this;
        }

        public Builder addBatch(BatchResult batch) {
            imported += batch.succeeded();
            failed += batch.failed();
            batch.errors().forEach(this::addError);
            return this;
        }

        /**
         * Adds the outcome counts of an executed run. {@code total} and {@code dropped} are left to the caller.
         */
        public Builder include(ImportSummary summary) {
            imported += summary.imported();
            failed += summary.failed();
            notAttempted += summary.notAttempted();
            cancelled = cancelled || summary.cancelled();
            for (ImportError error : summary.errors()) {
                if (errors.size() < maxReportedErrors) {
                    errors.add(error);
                }
            }
            errorCount += summary.errorCount();
            return this;
        }

        public ImportSummary build() {
            return new ImportSummary(total, imported, failed, dropped, notAttempted, cancelled, errors, errorCount);
        }

        private void addError(ImportError error) {
            errorCount++;
            if (errors.size() < maxReportedErrors) {
                errors.add(error);
            }
        }
    }
}
