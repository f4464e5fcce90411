package app.fieldbridge.importer.domain;

public enum ImportSessionStatus {
    upload,
    mapping,
    preview,
    importing,
    results,
    failed
}
