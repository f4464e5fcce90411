package app.fieldbridge.importer.service.matching;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record ColumnDecision(
        String column,
        MappingTarget target,
        String fieldKey,
        DecisionOrigin origin,
        double confidence,
        boolean highConfidence,
        List<MatchCandidate> suggestions
) {
    public ColumnDecision {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static ColumnDecision auto(String column, String fieldKey, double confidence, boolean highConfidence) {
        return new ColumnDecision(column, MappingTarget.field, fieldKey, DecisionOrigin.auto, confidence, highConfidence, List.of());
    }

    public static ColumnDecision unmatched(String column, double bestScore, List<MatchCandidate> suggestions) {
        return new ColumnDecision(column, MappingTarget.unset, null, DecisionOrigin.suggested, bestScore, false, suggestions);
    }

    public static ColumnDecision manual(String column, ColumnOverride override, List<MatchCandidate> suggestions) {
        if (override.skip()) {
            return new ColumnDecision(column, MappingTarget.skip, null, DecisionOrigin.manual, 0.0, false, suggestions);
        }
        return new ColumnDecision(column, MappingTarget.field, override.fieldKey(), DecisionOrigin.manual, 1.0, false, suggestions);
    }

    public static ColumnDecision created(String column, String fieldKey) {
        return new ColumnDecision(column, MappingTarget.field, fieldKey, DecisionOrigin.created, 1.0, false, List.of());
    }

    @JsonIgnore
    public boolean isMapped() {
        return target == MappingTarget.field && fieldKey != null;
    }

    @JsonIgnore
    public boolean isResolved() {
        return target != MappingTarget.unset;
    }
}
