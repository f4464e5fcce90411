package app.fieldbridge.importer.controller.dto;

import app.fieldbridge.importer.domain.ImportSessionStatus;
import app.fieldbridge.importer.service.transform.RowRejection;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record PreviewResponse(
        UUID sessionId,
        ImportSessionStatus status,
        Map<String, String> mapping,
        List<Map<String, String>> sample,
        int totalRows,
        int recordCount,
        int dropped,
        int failed,
        List<RowRejection> rejections,
        List<String> unmatchedColumns,
        List<String> warnings
) {
}
