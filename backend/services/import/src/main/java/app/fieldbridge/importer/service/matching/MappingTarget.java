package app.fieldbridge.importer.service.matching;

public enum MappingTarget {
    field,
    skip,
    unset
}
