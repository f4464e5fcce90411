package app.fieldbridge.importer.service;

import app.fieldbridge.importer.config.ImportProps;
import app.fieldbridge.importer.domain.ImportSessionEntity;
import app.fieldbridge.importer.domain.ImportSessionStatus;
import app.fieldbridge.importer.repository.ImportSessionRepository;
import app.fieldbridge.importer.service.batch.CancellationFlag;
import app.fieldbridge.importer.service.batch.ImportAbortedException;
import app.fieldbridge.importer.service.batch.ImportProgress;
import app.fieldbridge.importer.service.batch.ImportSummary;
import app.fieldbridge.importer.service.parser.TabularData;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes import runs in the background, one task per session, and writes their progress
 * and outcome back to the session row.
 *
 * <p>A session is claimed for this instance with a conditional update before its run is queued,
 * and the lock is refreshed after every batch. Runs whose lock has expired on another instance
 * are marked failed by {@link #recoverStaleRuns()}.
 */
@Service
public class ImportRunWorker {

    private static final Logger log = LoggerFactory.getLogger(ImportRunWorker.class);

    static final String LOST_RUN_MESSAGE = "Import run was interrupted before it finished";

    private final JdbcTemplate jdbcTemplate;
    private final ImportSessionRepository sessionRepository;
    private final ImportPipeline pipeline;
    private final ObjectMapper objectMapper;
    private final String workerId;
    private final Duration lockTtl;
    private final ExecutorService executor;
    private final Map<UUID, CancellationFlag> running = new ConcurrentHashMap<>();

    public ImportRunWorker(JdbcTemplate jdbcTemplate,
                           ImportSessionRepository sessionRepository,
                           ImportPipeline pipeline,
                           ObjectMapper objectMapper,
                           ImportProps props) {
        this.jdbcTemplate = jdbcTemplate;
        this.sessionRepository = sessionRepository;
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
        this.workerId = props.worker().id() + ":" + UUID.randomUUID().toString().substring(0, 8);
        this.lockTtl = props.worker().lockTtl();
        int threads = props.worker().threads();
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(props.worker().queueCapacity()),
                runnable -> {
                    Thread thread = new Thread(runnable, "import-run-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Moves a session from {@code preview} to {@code importing} and locks it for this instance.
     *
     * @return false when the session was not in {@code preview}, e.g. another request claimed it first
     */
    public boolean claim(UUID sessionId) {
        int updated = jdbcTemplate.update(
                """
                update app_import.import_sessions
                set status = 'importing',
                    locked_by = ?,
                    locked_at = now(),
                    processed_records = 0,
                    progress_percent = 0,
                    summary = null,
                    error_message = null,
                    started_at = now(),
                    completed_at = null,
                    updated_at = now()
                where session_id = ?
                  and status = 'preview'
                """,
                workerId,
                sessionId
        );
        return updated == 1;
    }

    /**
     * Queues a run for a session claimed by {@link #claim(UUID)}. A rejected run releases the claim.
     *
     * @throws RejectedExecutionException when the run queue is full
     */
    public void submit(UUID sessionId, TabularData data, Map<String, String> finalMapping, ImportProps config) {
        CancellationFlag cancellation = new CancellationFlag();
        running.put(sessionId, cancellation);
        try {
            executor.execute(() -> run(sessionId, data, finalMapping, config, cancellation));
        } catch (RejectedExecutionException ex) {
            running.remove(sessionId);
            release(sessionId);
            throw ex;
        }
    }

    public void release(UUID sessionId) {
        jdbcTemplate.update(
                """
                update app_import.import_sessions
                set status = 'preview',
                    locked_by = null,
                    locked_at = null,
                    started_at = null,
                    updated_at = now()
                where session_id = ?
                  and status = 'importing'
                  and locked_by = ?
                """,
                sessionId,
                workerId
        );
    }

    public boolean cancel(UUID sessionId) {
        CancellationFlag cancellation = running.get(sessionId);
        if (cancellation == null) {
            return false;
        }
        cancellation.cancel();
        log.info("Import run cancellation requested: sessionId={}", sessionId);
        return true;
    }

    public boolean isRunning(UUID sessionId) {
        return running.containsKey(sessionId);
    }

    /**
     * Fails {@code importing} sessions whose lock belongs to another instance and has not been
     * refreshed within the lock TTL. Runs at startup and then periodically.
     */
    @Scheduled(fixedDelayString = "${app.import.worker.sweep-interval-ms:60000}")
    public int recoverStaleRuns() {
        int recovered = jdbcTemplate.update(
                """
                update app_import.import_sessions
                set status = 'failed',
                    error_message = ?,
                    locked_by = null,
                    locked_at = null,
                    completed_at = now(),
                    updated_at = now()
                where status = 'importing'
                  and (locked_at is null or locked_at < now() - (? * interval '1 second'))
                  and (locked_by is null or locked_by <> ?)
                """,
                LOST_RUN_MESSAGE,
                lockTtl.getSeconds(),
                workerId
        );
        if (recovered > 0) {
            log.warn("Stale import runs marked failed: count={}, lockTtlSeconds={}", recovered, lockTtl.getSeconds());
        }
        return recovered;
    }

    void run(UUID sessionId,
             TabularData data,
             Map<String, String> finalMapping,
             ImportProps config,
             CancellationFlag cancellation) {
        try {
            ImportSummary summary = pipeline.importResolved(
                    data,
                    finalMapping,
                    config,
                    progress -> markProgress(sessionId, progress),
                    cancellation
            );
            markCompleted(sessionId, summary);
            log.info(
                    "Import run completed: sessionId={}, total={}, imported={}, failed={}, dropped={}, notAttempted={}, cancelled={}",
                    sessionId,
                    summary.total(),
                    summary.imported(),
                    summary.failed(),
                    summary.dropped(),
                    summary.notAttempted(),
                    summary.cancelled()
            );
        } catch (ImportAbortedException ex) {
            String error = summarizeError(ex);
            log.error("Import run aborted: sessionId={}, error={}", sessionId, error, ex);
            markFailed(sessionId, ex.getPartialSummary(), error);
        } catch (Exception ex) {
            String error = summarizeError(ex);
            log.error("Import run failed: sessionId={}, error={}", sessionId, error, ex);
            markFailed(sessionId, null, error);
        } finally {
            running.remove(sessionId);
        }
    }

    void markProgress(UUID sessionId, ImportProgress progress) {
        ownedSession(sessionId).ifPresent(session -> {
            Instant now = Instant.now();
            session.setRecordCount(progress.total());
            session.setProcessedRecords(progress.processed());
            session.setProgressPercent(progress.percent());
            session.setLockedAt(now);
            session.setUpdatedAt(now);
            sessionRepository.save(session);
        });
    }

    void markCompleted(UUID sessionId, ImportSummary summary) {
        ownedSession(sessionId).ifPresent(session -> {
            session.setStatus(ImportSessionStatus.results);
            session.setSummary(objectMapper.valueToTree(summary));
            finish(session);
        });
    }

    void markFailed(UUID sessionId, ImportSummary partialSummary, String error) {
        ownedSession(sessionId).ifPresent(session -> {
            session.setStatus(ImportSessionStatus.failed);
            session.setSummary(partialSummary == null ? null : objectMapper.valueToTree(partialSummary));
            session.setErrorMessage(error);
            finish(session);
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private Optional<ImportSessionEntity> ownedSession(UUID sessionId) {
        Optional<ImportSessionEntity> session = sessionRepository.findById(sessionId)
                .filter(candidate -> candidate.getStatus() == ImportSessionStatus.importing)
                .filter(candidate -> workerId.equals(candidate.getLockedBy()));
        if (session.isEmpty()) {
            log.warn("Import session no longer owned by this worker: sessionId={}, workerId={}", sessionId, workerId);
        }
        return session;
    }

    private void finish(ImportSessionEntity session) {
        Instant now = Instant.now();
        session.setLockedBy(null);
        session.setLockedAt(null);
        session.setCompletedAt(now);
        session.setUpdatedAt(now);
        sessionRepository.save(session);
    }

    private String summarizeError(Throwable throwable) {
        if (throwable == null) {
            return "Unknown error";
        }
        Throwable root = throwable;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        String fallback = throwable.getMessage();
        if (fallback != null && !fallback.isBlank()) {
            return fallback;
        }
        return throwable.getClass().getSimpleName();
    }
}
