package app.fieldbridge.importer.service.matching;

/**
 * Operator choice for one column: a catalog field key, or skip.
 */
public record ColumnOverride(
        String fieldKey,
        boolean skip
) {
    public ColumnOverride {
        if (!skip && (fieldKey == null || fieldKey.isBlank())) {
            throw new IllegalArgumentException("fieldKey is required unless the column is skipped");
        }
        fieldKey = skip ? null : fieldKey.trim();
    }

    public static ColumnOverride field(String fieldKey) {
        return new ColumnOverride(fieldKey, false);
    }

    public static ColumnOverride skipColumn() {
        return new ColumnOverride(null, true);
    }
}
