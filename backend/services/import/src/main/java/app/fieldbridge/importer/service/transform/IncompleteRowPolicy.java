package app.fieldbridge.importer.service.transform;

public enum IncompleteRowPolicy {
    drop,
    fail
}
