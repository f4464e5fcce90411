package app.fieldbridge.importer.service.catalog;

import java.util.Set;

public record CanonicalField(
        String fieldKey,
        String label,
        FieldType type,
        String category,
        Set<String> aliases,
        int usageCount
) {
    public CanonicalField {
        if (fieldKey == null || fieldKey.isBlank()) {
            throw new IllegalArgumentException("fieldKey is required");
        }
        label = label == null || label.isBlank() ? fieldKey : label;
        type = type == null ? FieldType.text : type;
        aliases = aliases == null ? Set.of() : Set.copyOf(aliases);
    }

    public static CanonicalField of(String fieldKey, FieldType type) {
        return new CanonicalField(fieldKey, fieldKey, type, null, Set.of(), 0);
    }
}
