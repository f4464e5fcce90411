package app.fieldbridge.importer.service.batch;

import app.fieldbridge.importer.service.transform.ImportRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one import batch per {@link #next()} call. Closing the cursor before the last batch cancels the rest.
 */
public class BatchCursor implements Iterator<BatchResult>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchCursor.class);

    private final List<ImportRecord> records;
    private final int batchSize;
    private final int batchCount;
    private final Duration timeout;
    private final RecordPersister persister;
    private final ImportProgressListener listener;
    private final CancellationFlag cancellation;
    private final ExecutorService executor;
    private final ImportSummary.Builder summary;

    private int processed;
    private int nextBatchIndex = 1;

    BatchCursor(List<ImportRecord> records,
                int batchSize,
                Duration timeout,
                int maxReportedErrors,
                RecordPersister persister,
                ImportProgressListener listener,
                CancellationFlag cancellation,
                ExecutorService executor) {
        this.records = List.copyOf(records);
        this.batchSize = batchSize;
        this.batchCount = (this.records.size() + batchSize - 1) / batchSize;
        this.timeout = timeout;
        this.persister = persister;
        this.listener = listener == null ? ImportProgressListener.NOOP : listener;
        this.cancellation = cancellation == null ? new CancellationFlag() : cancellation;
        this.executor = executor;
        this.summary = ImportSummary.builder(maxReportedErrors);
    }

    @Override
    public boolean hasNext() {
        return processed < records.size() && !cancellation.isCancelled();
    }

    @Override
    public BatchResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        int batchIndex = nextBatchIndex++;
        int from = processed;
        int to = Math.min(from + batchSize, records.size());
        List<ImportRecord> batch = records.subList(from, to);

        BatchResult result = runBatch(batchIndex, batch);
        processed = to;
        summary.addBatch(result);

        try {
            listener.onBatch(result);
            listener.onProgress(ImportProgress.after(batchIndex, batchCount, processed, records.size()));
        } catch (RuntimeException ex) {
            throw new ImportAbortedException("Progress listener failed after batch " + batchIndex, summary(), ex);
        }
        return result;
    }

    public int batchCount() {
        return batchCount;
    }

    public int processed() {
        return processed;
    }

    /**
     * Counts accumulated so far. Records of batches not yet run are reported as not attempted.
     */
    public ImportSummary summary() {
        int total = records.size();
        return summary
                .total(total)
                .notAttempted(total - processed)
                .cancelled(cancellation.isCancelled() && processed < total)
                .build();
    }

    @Override
    public void close() {
        if (processed < records.size()) {
            cancellation.cancel();
        }
    }

    private BatchResult runBatch(int batchIndex, List<ImportRecord> batch) {
        PersistCall call = new PersistCall(persister, batch);
        Future<PersistResult> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException ex) {
            throw new ImportAbortedException("Persist pool rejected batch " + batchIndex, summary(), ex);
        }
        try {
            PersistResult persisted = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return toResult(batchIndex, batch, persisted);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Import batch timed out: batch={}, size={}, timeoutMs={}", batchIndex, batch.size(), timeout.toMillis());
            awaitSettled(call, batchIndex);
            return BatchResult.transportFailure(batchIndex, batch.size(), "Batch timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RecordPersistenceException) {
                String message = describe(cause);
                log.warn("Import batch failed: batch={}, size={}, error={}", batchIndex, batch.size(), message);
                return BatchResult.transportFailure(batchIndex, batch.size(), message);
            }
            throw new ImportAbortedException("Batch " + batchIndex + " failed unexpectedly", summary(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ImportAbortedException("Import interrupted during batch " + batchIndex, summary(), ex);
        }
    }

    // A timed-out persist call may ignore the interrupt; the next batch waits until it has returned.
    private void awaitSettled(PersistCall call, int batchIndex) {
        try {
            if (!call.awaitSettled(timeout.toMillis())) {
                log.warn("Waiting for timed-out batch to return: batch={}", batchIndex);
                call.awaitSettled();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ImportAbortedException("Import interrupted while batch " + batchIndex + " was timing out", summary(), ex);
        }
    }

    private BatchResult toResult(int batchIndex, List<ImportRecord> batch, PersistResult persisted) {
        int attempted = batch.size();
        int reported = persisted == null ? 0 : persisted.importedCount();
        int succeeded = Math.max(0, Math.min(reported, attempted));
        int failed = attempted - succeeded;

        List<ImportError> errors = new ArrayList<>();
        if (persisted != null) {
            for (PersistResult.RowError rowError : persisted.errors()) {
                errors.add(ImportError.forRow(batchIndex, rowNumberOf(batch, rowError.rowIndex()), rowError.message()));
            }
        }
        if (failed > 0 && errors.isEmpty()) {
            errors.add(ImportError.forBatch(batchIndex, failed + " of " + attempted + " records were not imported"));
        }
        if (failed > 0) {
            log.warn("Import batch partially failed: batch={}, attempted={}, succeeded={}", batchIndex, attempted, succeeded);
        }
        return new BatchResult(batchIndex, attempted, succeeded, failed, errors, false);
    }

    private Integer rowNumberOf(List<ImportRecord> batch, Integer rowIndex) {
        if (rowIndex == null || rowIndex < 0 || rowIndex >= batch.size()) {
            return null;
        }
        return batch.get(rowIndex).rowNumber();
    }

    private String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }

    /**
     * Persist task that can be abandoned before it starts. Once started, {@link #awaitSettled()}
     * blocks until the persister has returned.
     */
    private static final class PersistCall implements Callable<PersistResult> {

        private final RecordPersister persister;
        private final List<ImportRecord> batch;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final CountDownLatch settled = new CountDownLatch(1);

        private PersistCall(RecordPersister persister, List<ImportRecord> batch) {
            this.persister = persister;
            this.batch = batch;
        }

        @Override
        public PersistResult call() {
            if (!claimed.compareAndSet(false, true)) {
                return null;
            }
            try {
                return persister.persist(batch);
            } finally {
                settled.countDown();
            }
        }

        boolean awaitSettled(long timeoutMillis) throws InterruptedException {
            if (claimed.compareAndSet(false, true)) {
                return true;
            }
            return settled.await(timeoutMillis, TimeUnit.MILLISECONDS);
        }

        void awaitSettled() throws InterruptedException {
            if (claimed.compareAndSet(false, true)) {
                return;
            }
            settled.await();
        }
    }
}
