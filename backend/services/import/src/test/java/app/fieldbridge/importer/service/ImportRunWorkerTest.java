package app.fieldbridge.importer.service;

import app.fieldbridge.importer.config.ImportProps;
import app.fieldbridge.importer.domain.ImportSessionEntity;
import app.fieldbridge.importer.domain.ImportSessionStatus;
import app.fieldbridge.importer.repository.ImportSessionRepository;
import app.fieldbridge.importer.service.batch.CancellationFlag;
import app.fieldbridge.importer.service.batch.ImportAbortedException;
import app.fieldbridge.importer.service.batch.ImportProgress;
import app.fieldbridge.importer.service.batch.ImportProgressListener;
import app.fieldbridge.importer.service.batch.ImportSummary;
import app.fieldbridge.importer.service.parser.TabularData;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImportRunWorkerTest {

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final ImportSessionRepository repository = mock(ImportSessionRepository.class);
    private final ImportPipeline pipeline = mock(ImportPipeline.class);
    private final ImportRunWorker worker = new ImportRunWorker(
            jdbcTemplate, repository, pipeline, new ObjectMapper(), ImportProps.defaults()
    );
    private final UUID sessionId = UUID.randomUUID();
    private final TabularData data = new TabularData(List.of("Email"), List.of(Map.of("Email", "ada@example.com")));
    private final ImportSessionEntity session = new ImportSessionEntity();

    @BeforeEach
    void setUp() {
        session.setSessionId(sessionId);
        session.setStatus(ImportSessionStatus.importing);
        session.setLockedBy(worker.workerId());
        when(repository.findById(sessionId)).thenReturn(Optional.of(session));
        when(repository.save(any(ImportSessionEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        worker.shutdown();
    }

    @Test
    void run_storesProgressAndSummary() {
        ImportSummary summary = new ImportSummary(1, 1, 0, 0, 0, false, List.of(), 0);
        when(pipeline.importResolved(eq(data), anyMap(), any(ImportProps.class), any(ImportProgressListener.class), any(CancellationFlag.class)))
                .thenAnswer(invocation -> {
                    ImportProgressListener listener = invocation.getArgument(3);
                    listener.onProgress(new ImportProgress(1, 1, 1, 1, 100));
                    return summary;
                });

        worker.run(sessionId, data, Map.of("Email", "email"), ImportProps.defaults(), new CancellationFlag());

        assertThat(session.getStatus()).isEqualTo(ImportSessionStatus.results);
        assertThat(session.getProgressPercent()).isEqualTo(100);
        assertThat(session.getProcessedRecords()).isEqualTo(1);
        assertThat(session.getSummary().get("imported").asInt()).isEqualTo(1);
        assertThat(session.getCompletedAt()).isNotNull();
        assertThat(session.getLockedBy()).isNull();
        assertThat(session.getLockedAt()).isNull();
        assertThat(worker.isRunning(sessionId)).isFalse();
    }

    @Test
    void run_abortKeepsPartialSummary() {
        ImportSummary partial = new ImportSummary(10, 4, 0, 0, 6, false, List.of(), 0);
        when(pipeline.importResolved(eq(data), anyMap(), any(ImportProps.class), any(ImportProgressListener.class), any(CancellationFlag.class)))
                .thenThrow(new ImportAbortedException("Import aborted", partial, new IllegalStateException("sink crashed")));

        worker.run(sessionId, data, Map.of("Email", "email"), ImportProps.defaults(), new CancellationFlag());

        assertThat(session.getStatus()).isEqualTo(ImportSessionStatus.failed);
        assertThat(session.getErrorMessage()).isEqualTo("sink crashed");
        assertThat(session.getSummary().get("notAttempted").asInt()).isEqualTo(6);
    }

    @Test
    void run_unexpectedFailureMarksSessionFailed() {
        when(pipeline.importResolved(eq(data), anyMap(), any(ImportProps.class), any(ImportProgressListener.class), any(CancellationFlag.class)))
                .thenThrow(new IllegalStateException("boom"));

        worker.run(sessionId, data, Map.of("Email", "email"), ImportProps.defaults(), new CancellationFlag());

        assertThat(session.getStatus()).isEqualTo(ImportSessionStatus.failed);
        assertThat(session.getErrorMessage()).isEqualTo("boom");
        assertThat(session.getSummary()).isNull();
    }

    @Test
    void cancel_unknownSessionIsNotRunning() {
        assertThat(worker.cancel(UUID.randomUUID())).isFalse();
    }

    @Test
    void run_progressRefreshesLock() {
        when(pipeline.importResolved(eq(data), anyMap(), any(ImportProps.class), any(ImportProgressListener.class), any(CancellationFlag.class)))
                .thenAnswer(invocation -> {
                    ImportProgressListener listener = invocation.getArgument(3);
                    listener.onProgress(new ImportProgress(1, 2, 1, 2, 50));
                    assertThat(session.getLockedAt()).isNotNull();
                    assertThat(session.getLockedBy()).isEqualTo(worker.workerId());
                    return new ImportSummary(2, 2, 0, 0, 0, false, List.of(), 0);
                });

        worker.run(sessionId, data, Map.of("Email", "email"), ImportProps.defaults(), new CancellationFlag());

        assertThat(session.getStatus()).isEqualTo(ImportSessionStatus.results);
    }

    @Test
    void run_sessionRecoveredElsewhereIsNotOverwritten() {
        session.setStatus(ImportSessionStatus.failed);
        session.setLockedBy(null);
        session.setErrorMessage(ImportRunWorker.LOST_RUN_MESSAGE);
        when(pipeline.importResolved(eq(data), anyMap(), any(ImportProps.class), any(ImportProgressListener.class), any(CancellationFlag.class)))
                .thenReturn(new ImportSummary(1, 1, 0, 0, 0, false, List.of(), 0));

        worker.run(sessionId, data, Map.of("Email", "email"), ImportProps.defaults(), new CancellationFlag());

        assertThat(session.getStatus()).isEqualTo(ImportSessionStatus.failed);
        assertThat(session.getErrorMessage()).isEqualTo(ImportRunWorker.LOST_RUN_MESSAGE);
        verify(repository, never()).save(any(ImportSessionEntity.class));
    }

    @Test
    void claim_onlySucceedsWhenRowWasUpdated() {
        UUID other = UUID.randomUUID();
        when(jdbcTemplate.update(contains("status = 'preview'"), eq(worker.workerId()), eq(sessionId))).thenReturn(1);
        when(jdbcTemplate.update(contains("status = 'preview'"), eq(worker.workerId()), eq(other))).thenReturn(0);

        assertThat(worker.claim(sessionId)).isTrue();
        assertThat(worker.claim(other)).isFalse();
    }

    @Test
    void recoverStaleRuns_failsExpiredRunsOfOtherWorkers() {
        when(jdbcTemplate.update(contains("set status = 'failed'"), eq(ImportRunWorker.LOST_RUN_MESSAGE), eq(300L), eq(worker.workerId())))
                .thenReturn(2);

        assertThat(worker.recoverStaleRuns()).isEqualTo(2);
        verify(jdbcTemplate).update(
                contains("locked_at < now() - (? * interval '1 second')"),
                eq(ImportRunWorker.LOST_RUN_MESSAGE),
                eq(300L),
                eq(worker.workerId())
        );
    }

    @Test
    void workerId_isUniquePerInstance() {
        ImportRunWorker another = new ImportRunWorker(jdbcTemplate, repository, pipeline, new ObjectMapper(), ImportProps.defaults());
        try {
            assertThat(worker.workerId()).startsWith("import-worker:");
            assertThat(another.workerId()).isNotEqualTo(worker.workerId());
        } finally {
            another.shutdown();
        }
    }

    @Test
    void submit_fullQueueReleasesClaim() throws Exception {
        ImportRunWorker single = new ImportRunWorker(
                jdbcTemplate, repository, pipeline, new ObjectMapper(),
                ImportProps.defaults().withWorker(ImportProps.Worker.of(1, 1))
        );
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        when(pipeline.importResolved(any(TabularData.class), anyMap(), any(ImportProps.class), any(ImportProgressListener.class), any(CancellationFlag.class)))
                .thenAnswer(invocation -> {
                    started.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return new ImportSummary(1, 1, 0, 0, 0, false, List.of(), 0);
                });
        UUID third = UUID.randomUUID();
        try {
            single.submit(UUID.randomUUID(), data, Map.of("Email", "email"), ImportProps.defaults());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            single.submit(UUID.randomUUID(), data, Map.of("Email", "email"), ImportProps.defaults());

            assertThatThrownBy(() -> single.submit(third, data, Map.of("Email", "email"), ImportProps.defaults()))
                    .isInstanceOf(RejectedExecutionException.class);
            assertThat(single.isRunning(third)).isFalse();
            verify(jdbcTemplate).update(contains("set status = 'preview'"), eq(third), eq(single.workerId()));
        } finally {
            release.countDown();
            single.shutdown();
        }
    }
}
