package app.fieldbridge.importer.service.catalog;

import java.util.List;

public record NewFieldRequest(
        String fieldKey,
        String label,
        FieldType type,
        String category,
        List<String> aliases
) {
}
