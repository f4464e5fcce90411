package app.fieldbridge.importer.service;

import app.fieldbridge.importer.config.ImportProps;
import app.fieldbridge.importer.controller.dto.ColumnMappingRequest;
import app.fieldbridge.importer.controller.dto.CreateFieldRequest;
import app.fieldbridge.importer.controller.dto.ImportSessionResponse;
import app.fieldbridge.importer.controller.dto.PreviewResponse;
import app.fieldbridge.importer.controller.dto.UpdateMappingsRequest;
import app.fieldbridge.importer.domain.ImportSessionEntity;
import app.fieldbridge.importer.domain.ImportSessionStatus;
import app.fieldbridge.importer.repository.ImportSessionRepository;
import app.fieldbridge.importer.service.batch.ImportSummary;
import app.fieldbridge.importer.service.catalog.CanonicalFieldCatalog;
import app.fieldbridge.importer.service.catalog.CatalogUnavailableException;
import app.fieldbridge.importer.service.catalog.DuplicateFieldKeyException;
import app.fieldbridge.importer.service.matching.ColumnDecision;
import app.fieldbridge.importer.service.matching.ColumnOverride;
import app.fieldbridge.importer.service.matching.MappingResolution;
import app.fieldbridge.importer.service.matching.MappingResolver;
import app.fieldbridge.importer.service.matching.MappingState;
import app.fieldbridge.importer.service.parser.MalformedSourceException;
import app.fieldbridge.importer.service.parser.TabularData;
import app.fieldbridge.importer.service.parser.TabularParser;
import app.fieldbridge.importer.service.transform.ImportRecord;
import app.fieldbridge.importer.service.transform.TransformResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

@Service
public class ImportSessionService {

    private static final Logger log = LoggerFactory.getLogger(ImportSessionService.class);

    private static final int MAX_SOURCE_NAME = 255;

    private final ImportSessionRepository sessionRepository;
    private final TabularParser parser;
    private final CanonicalFieldCatalog catalog;
    private final MappingResolver resolver;
    private final ImportPipeline pipeline;
    private final ImportRunWorker runWorker;
    private final ImportProps props;
    private final ObjectMapper objectMapper;

    public ImportSessionService(ImportSessionRepository sessionRepository,
                                TabularParser parser,
                                CanonicalFieldCatalog catalog,
                                MappingResolver resolver,
                                ImportPipeline pipeline,
                                ImportRunWorker runWorker,
                                ImportProps props,
                                ObjectMapper objectMapper) {
        this.sessionRepository = sessionRepository;
        this.parser = parser;
        this.catalog = catalog;
        this.resolver = resolver;
        this.pipeline = pipeline;
        this.runWorker = runWorker;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public ImportSessionResponse createSession(String sourceName, String sourceText) {
        ImportSessionEntity session = new ImportSessionEntity();
        session.setSessionId(UUID.randomUUID());
        Instant now = Instant.now();
        session.setCreatedAt(now);
        loadSource(session, sourceName, sourceText);

        ImportSessionEntity saved = sessionRepository.save(session);
        log.info("Import session created: sessionId={}, sourceName={}, rows={}",
                saved.getSessionId(), saved.getSourceName(), saved.getTotalRows());
        return toResponse(saved);
    }

    @Transactional
    public ImportSessionResponse uploadSession(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing file");
        }
        String text;
        try {
            text = new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Failed to read upload", ex);
        }
        return createSession(file.getOriginalFilename(), text);
    }

    @Transactional(readOnly = true)
    public ImportSessionResponse getSession(UUID sessionId) {
        return toResponse(requireSession(sessionId));
    }

    @Transactional
    public ImportSessionResponse replaceSource(UUID sessionId, String sourceName, String sourceText) {
        ImportSessionEntity session = requireSession(sessionId);
        requireStatus(session, EnumSet.of(ImportSessionStatus.upload));
        loadSource(session, sourceName, sourceText);
        return toResponse(sessionRepository.save(session));
    }

    @Transactional
    public ImportSessionResponse updateMappings(UUID sessionId, UpdateMappingsRequest request) {
        ImportSessionEntity session = requireSession(sessionId);
        requireStatus(session, EnumSet.of(ImportSessionStatus.mapping, ImportSessionStatus.preview));
        MappingResolution resolution = readResolution(session);

        for (ColumnMappingRequest change : request.mappings()) {
            try {
                ColumnOverride override = change.skip()
                        ? ColumnOverride.skipColumn()
                        : ColumnOverride.field(change.fieldKey());
                resolver.setMapping(resolution, change.column(), override);
            } catch (IllegalArgumentException ex) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
            }
        }

        writeResolution(session, resolution);
        session.setStatus(ImportSessionStatus.mapping);
        session.setUpdatedAt(Instant.now());
        return toResponse(sessionRepository.save(session));
    }

    @Transactional
    public ImportSessionResponse createField(UUID sessionId, CreateFieldRequest request) {
        ImportSessionEntity session = requireSession(sessionId);
        requireStatus(session, EnumSet.of(ImportSessionStatus.mapping));
        MappingResolution resolution = readResolution(session);

        try {
            resolver.createFieldFor(
                    resolution,
                    request.column(),
                    request.fieldKey(),
                    request.type(),
                    request.category(),
                    catalog
            );
        } catch (DuplicateFieldKeyException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        } catch (CatalogUnavailableException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }

        writeResolution(session, resolution);
        session.setUpdatedAt(Instant.now());
        return toResponse(sessionRepository.save(session));
    }

    @Transactional
    public PreviewResponse preview(UUID sessionId, Integer sampleSize) {
        ImportSessionEntity session = requireSession(sessionId);
        requireStatus(session, EnumSet.of(ImportSessionStatus.mapping, ImportSessionStatus.preview));
        MappingResolution resolution = readResolution(session);
        TabularData data = parseStored(session);

        Map<String, String> mapping = resolution.finalMapping();
        TransformResult transformed = pipeline.transform(data, mapping, props);
        int limit = sampleSize == null || sampleSize <= 0 ? props.preview().sampleSize() : sampleSize;
        List<Map<String, String>> sample = transformed.records().stream()
                .limit(limit)
                .map(ImportRecord::values)
                .toList();

        session.setStatus(ImportSessionStatus.preview);
        session.setRecordCount(transformed.records().size());
        session.setUpdatedAt(Instant.now());
        sessionRepository.save(session);

        return new PreviewResponse(
                session.getSessionId(),
                session.getStatus(),
                mapping,
                sample,
                data.rowCount(),
                transformed.records().size(),
                transformed.dropped(),
                transformed.failed(),
                transformed.rejections().stream().limit(props.batch().maxReportedErrors()).toList(),
                resolution.unmatched().stream().map(ColumnDecision::column).toList(),
                resolution.warnings()
        );
    }

    /**
     * Not transactional: the claim is a single conditional update, so of two concurrent requests
     * only one moves the session to {@code importing}, and it is committed before the worker
     * writes progress to the same row.
     */
    public ImportSessionResponse startImport(UUID sessionId) {
        requireStatus(requireSession(sessionId), EnumSet.of(ImportSessionStatus.preview));
        if (!runWorker.claim(sessionId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Import for this session has already started");
        }

        ImportSessionEntity claimed;
        MappingResolution resolution;
        TabularData data;
        try {
            claimed = requireSession(sessionId);
            resolution = readResolution(claimed);
            data = parseStored(claimed);
        } catch (RuntimeException ex) {
            runWorker.release(sessionId);
            throw ex;
        }

        try {
            runWorker.submit(sessionId, data, resolution.finalMapping(), props);
        } catch (RejectedExecutionException ex) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Import queue is full", ex);
        }
        log.info("Import run queued: sessionId={}, rows={}, mappedColumns={}, workerId={}",
                sessionId, data.rowCount(), resolution.finalMapping().size(), runWorker.workerId());
        return toResponse(claimed);
    }

    @Transactional
    public ImportSessionResponse cancel(UUID sessionId) {
        ImportSessionEntity session = requireSession(sessionId);
        switch (session.getStatus()) {
            case mapping, preview -> {
                session.setStatus(ImportSessionStatus.upload);
                session.setMappingState(null);
                session.setRecordCount(null);
                session.setUpdatedAt(Instant.now());
                return toResponse(sessionRepository.save(session));
            }
            case importing -> {
                if (!runWorker.cancel(sessionId)) {
                    throw new ResponseStatusException(HttpStatus.CONFLICT, "Import run is no longer active");
                }
                return toResponse(session);
            }
            default -> throw new ResponseStatusException(
                    HttpStatus.CONFLICT,
                    "Cannot cancel session in status " + session.getStatus()
            );
        }
    }

    private void loadSource(ImportSessionEntity session, String sourceName, String sourceText) {
        TabularData data;
        try {
            data = parser.parse(sourceText);
        } catch (MalformedSourceException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        MappingResolution resolution;
        try {
            resolution = resolver.resolve(parser.columns(data), catalog.list(), props.matching());
        } catch (CatalogUnavailableException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex);
        }

        session.setSourceName(normalizeSourceName(sourceName));
        session.setSourceText(sourceText);
        session.setTotalRows(data.rowCount());
        session.setRecordCount(null);
        session.setProcessedRecords(null);
        session.setProgressPercent(null);
        session.setSummary(null);
        session.setErrorMessage(null);
        writeResolution(session, resolution);
        session.setStatus(ImportSessionStatus.mapping);
        session.setUpdatedAt(Instant.now());
    }

    private ImportSessionEntity requireSession(UUID sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Import session not found"));
    }

    private void requireStatus(ImportSessionEntity session, Set<ImportSessionStatus> allowed) {
        if (!allowed.contains(session.getStatus())) {
            throw new ResponseStatusException(
                    HttpStatus.CONFLICT,
                    "Session is " + session.getStatus() + ", expected one of " + allowed
            );
        }
    }

    private TabularData parseStored(ImportSessionEntity session) {
        try {
            return parser.parse(session.getSourceText());
        } catch (MalformedSourceException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Stored source is no longer readable", ex);
        }
    }

    private MappingResolution readResolution(ImportSessionEntity session) {
        JsonNode node = session.getMappingState();
        if (node == null || node.isNull()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Session has no column mapping");
        }
        try {
            return MappingResolution.fromState(objectMapper.treeToValue(node, MappingState.class));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to read mapping state of session " + session.getSessionId(), ex);
        }
    }

    private void writeResolution(ImportSessionEntity session, MappingResolution resolution) {
        session.setMappingState(objectMapper.valueToTree(resolution.toState()));
    }

    private String normalizeSourceName(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_SOURCE_NAME ? trimmed.substring(0, MAX_SOURCE_NAME) : trimmed;
    }

    private ImportSummary readSummary(ImportSessionEntity session) {
        JsonNode node = session.getSummary();
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, ImportSummary.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to read summary of session " + session.getSessionId(), ex);
        }
    }

    private ImportSessionResponse toResponse(ImportSessionEntity session) {
        JsonNode state = session.getMappingState();
        MappingResolution resolution = state == null || state.isNull() ? null : readResolution(session);
        return new ImportSessionResponse(
                session.getSessionId(),
                session.getStatus(),
                session.getSourceName(),
                session.getTotalRows(),
                resolution == null ? List.of() : resolution.decisions(),
                resolution == null ? List.of() : resolution.excluded(),
                resolution == null ? List.of() : resolution.catalog(),
                resolution == null ? 0 : resolution.autoMapped().size(),
                resolution == null ? 0 : resolution.highConfidenceCount(),
                resolution == null ? List.of() : resolution.unmatched().stream().map(ColumnDecision::column).toList(),
                resolution == null ? List.of() : resolution.warnings(),
                session.getRecordCount(),
                session.getProcessedRecords(),
                session.getProgressPercent(),
                readSummary(session),
                session.getErrorMessage(),
                session.getCreatedAt(),
                session.getUpdatedAt(),
                session.getStartedAt(),
                session.getCompletedAt()
        );
    }
}
