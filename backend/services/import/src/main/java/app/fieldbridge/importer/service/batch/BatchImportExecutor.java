package app.fieldbridge.importer.service.batch;

import app.fieldbridge.importer.config.ImportProps;
import app.fieldbridge.importer.service.transform.ImportRecord;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splits records into contiguous batches and hands them to a {@link RecordPersister} one at a time.
 *
 * <p>Each persist call runs on a worker thread so it can be bounded by the configured timeout.
 * A timed-out batch or a {@link RecordPersistenceException} fails that batch only and the run
 * continues with the next one once the timed-out call has returned. Any other error, including a
 * full persist queue, aborts the run with {@link ImportAbortedException}.
 */
@Component
public class BatchImportExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchImportExecutor.class);

    private final ExecutorService executor;

    public BatchImportExecutor(ImportProps props) {
        int threads = props.worker().threads();
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(props.worker().queueCapacity()),
                runnable -> {
                    Thread thread = new Thread(runnable, "import-persist-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    public ImportSummary execute(List<ImportRecord> records,
                                 ImportProps.Batch batch,
                                 RecordPersister persister,
                                 ImportProgressListener listener,
                                 CancellationFlag cancellation) {
        try (BatchCursor cursor = open(records, batch, persister, listener, cancellation)) {
            while (cursor.hasNext()) {
                cursor.next();
            }
            ImportSummary summary = cursor.summary();
            log.info("Import batches finished: records={}, batches={}, imported={}, failed={}, notAttempted={}, cancelled={}",
                    summary.total(),
                    cursor.batchCount(),
                    summary.imported(),
                    summary.failed(),
                    summary.notAttempted(),
                    summary.cancelled());
            return summary;
        }
    }

    public BatchCursor open(List<ImportRecord> records,
                            ImportProps.Batch batch,
                            RecordPersister persister,
                            ImportProgressListener listener,
                            CancellationFlag cancellation) {
        return new BatchCursor(
                records == null ? List.of() : records,
                batch.size(),
                batch.persistTimeout(),
                batch.maxReportedErrors(),
                persister,
                listener,
                cancellation,
                executor
        );
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
