package app.fieldbridge.importer.service.matching;

public enum DecisionOrigin {
    auto,
    suggested,
    manual,
    created
}
