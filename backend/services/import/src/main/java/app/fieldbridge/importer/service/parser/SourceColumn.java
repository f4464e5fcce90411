package app.fieldbridge.importer.service.parser;

public record SourceColumn(
        String name,
        String sampleValue
) {
    public static SourceColumn of(String name) {
        return new SourceColumn(name, null);
    }
}
