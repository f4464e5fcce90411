package app.fieldbridge.importer.service.matching;

import app.fieldbridge.importer.service.catalog.CanonicalField;

import java.util.List;

/**
 * Serializable form of a {@link MappingResolution}, stored with the import session.
 */
public record MappingState(
        List<CanonicalField> catalog,
        List<ColumnDecision> decisions,
        List<String> excluded
) {
}
