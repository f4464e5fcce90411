package app.fieldbridge.importer.controller.dto;

import app.fieldbridge.importer.domain.ImportSessionStatus;
import app.fieldbridge.importer.service.batch.ImportSummary;
import app.fieldbridge.importer.service.catalog.CanonicalField;
import app.fieldbridge.importer.service.matching.ColumnDecision;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ImportSessionResponse(
        UUID sessionId,
        ImportSessionStatus status,
        String sourceName,
        Integer totalRows,
        List<ColumnDecision> columns,
        List<String> excludedColumns,
        List<CanonicalField> fields,
        long autoMappedCount,
        long highConfidenceCount,
        List<String> unmatchedColumns,
        List<String> warnings,
        Integer recordCount,
        Integer processedRecords,
        Integer progressPercent,
        ImportSummary summary,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt
) {
}
