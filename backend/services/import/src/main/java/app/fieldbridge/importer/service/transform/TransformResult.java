package app.fieldbridge.importer.service.transform;

import java.util.List;

public record TransformResult(
        List<ImportRecord> records,
        int dropped,
        List<RowRejection> rejections
) {
    public TransformResult {
        records = records == null ? List.of() : List.copyOf(records);
        rejections = rejections == null ? List.of() : List.copyOf(rejections);
    }

    public int failed() {
        return rejections.size();
    }
}
