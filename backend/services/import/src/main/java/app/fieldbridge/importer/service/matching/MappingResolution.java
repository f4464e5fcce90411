package app.fieldbridge.importer.service.matching;

import app.fieldbridge.importer.service.catalog.CanonicalField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Column decisions for one import session together with the catalog snapshot they were made against.
 * Decisions keep source header order.
 */
public class MappingResolution {

    private final List<CanonicalField> catalog;
    private final Map<String, ColumnDecision> decisions;
    private final List<String> excluded;

    public MappingResolution(List<CanonicalField> catalog,
                             List<ColumnDecision> decisions,
                             List<String> excluded) {
        this.catalog = new ArrayList<>(catalog == null ? List.of() : catalog);
        this.decisions = new LinkedHashMap<>();
        if (decisions != null) {
            for (ColumnDecision decision : decisions) {
                this.decisions.put(decision.column(), decision);
            }
        }
        this.excluded = List.copyOf(excluded == null ? List.of() : excluded);
    }

    public static MappingResolution fromState(MappingState state) {
        return new MappingResolution(state.catalog(), state.decisions(), state.excluded());
    }

    public MappingState toState() {
        return new MappingState(catalog(), decisions(), excluded);
    }

    public List<CanonicalField> catalog() {
        return Collections.unmodifiableList(catalog);
    }

    public List<ColumnDecision> decisions() {
        return List.copyOf(decisions.values());
    }

    public Optional<ColumnDecision> decision(String column) {
        return Optional.ofNullable(decisions.get(column));
    }

    public List<String> excluded() {
        return excluded;
    }

    public boolean isExcluded(String column) {
        return excluded.contains(column);
    }

    public List<ColumnDecision> autoMapped() {
        return decisions.values().stream()
                .filter(decision -> decision.origin() == DecisionOrigin.auto)
                .toList();
    }

    public List<ColumnDecision> unmatched() {
        return decisions.values().stream()
                .filter(decision -> !decision.isResolved())
                .toList();
    }

    public long highConfidenceCount() {
        return decisions.values().stream().filter(ColumnDecision::highConfidence).count();
    }

    public Optional<CanonicalField> field(String fieldKey) {
        return catalog.stream()
                .filter(field -> field.fieldKey().equals(fieldKey))
                .findFirst();
    }

    /**
     * Source column to field key for every mapped column, in header order.
     */
    public Map<String, String> finalMapping() {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (ColumnDecision decision : decisions.values()) {
            if (decision.isMapped()) {
                mapping.put(decision.column(), decision.fieldKey());
            }
        }
        return mapping;
    }

    /**
     * Field keys targeted by more than one column, with the competing columns.
     */
    public Map<String, List<String>> sharedTargets() {
        Map<String, List<String>> byField = new LinkedHashMap<>();
        for (ColumnDecision decision : decisions.values()) {
            if (decision.isMapped()) {
                byField.computeIfAbsent(decision.fieldKey(), key -> new ArrayList<>()).add(decision.column());
            }
        }
        byField.values().removeIf(columns -> columns.size() < 2);
        return byField;
    }

    public List<String> warnings() {
        List<String> warnings = new ArrayList<>();
        sharedTargets().forEach((fieldKey, columns) -> warnings.add(
                "Columns " + columns + " all map to '" + fieldKey + "'; the last one wins"
        ));
        return warnings;
    }

    void apply(ColumnDecision decision) {
        decisions.put(decision.column(), decision);
    }

    void addField(CanonicalField field) {
        catalog.removeIf(existing -> existing.fieldKey().equals(field.fieldKey()));
        catalog.add(field);
    }
}
