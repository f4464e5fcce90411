package app.fieldbridge.importer.service.matching;

public record MatchCandidate(
        String column,
        String fieldKey,
        double confidence
) {
}
