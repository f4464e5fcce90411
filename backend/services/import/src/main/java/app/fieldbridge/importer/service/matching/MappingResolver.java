package app.fieldbridge.importer.service.matching;

import app.fieldbridge.importer.config.ImportProps;
import app.fieldbridge.importer.service.catalog.CanonicalField;
import app.fieldbridge.importer.service.catalog.CanonicalFieldCatalog;
import app.fieldbridge.importer.service.catalog.FieldType;
import app.fieldbridge.importer.service.catalog.NewFieldRequest;
import app.fieldbridge.importer.service.parser.SourceColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Component
public class MappingResolver {

    private static final Logger log = LoggerFactory.getLogger(MappingResolver.class);

    static final String DEFAULT_CATEGORY = "custom";

    private final SimilarityScorer scorer;

    public MappingResolver(SimilarityScorer scorer) {
        this.scorer = scorer;
    }

    public MappingResolution resolve(List<SourceColumn> columns,
                                     List<CanonicalField> catalog,
                                     ImportProps.Matching matching) {
        List<CanonicalField> snapshot = catalog == null ? List.of() : List.copyOf(catalog);
        List<ColumnDecision> decisions = new ArrayList<>();
        List<String> excluded = new ArrayList<>();

        for (SourceColumn column : columns) {
            String name = column.name();
            if (isMetadataColumn(name, matching.metadataExclusions())) {
                excluded.add(name);
                continue;
            }
            decisions.add(decide(name, snapshot, matching));
        }

        MappingResolution resolution = new MappingResolution(snapshot, decisions, excluded);
        log.info("Columns resolved: columns={}, autoMapped={}, unmatched={}, excluded={}, catalogSize={}",
                columns.size(),
                resolution.autoMapped().size(),
                resolution.unmatched().size(),
                excluded.size(),
                snapshot.size());
        return resolution;
    }

    public ColumnDecision setMapping(MappingResolution resolution, String column, ColumnOverride override) {
        ColumnDecision current = requireMappable(resolution, column);
        if (!override.skip() && resolution.field(override.fieldKey()).isEmpty()) {
            throw new IllegalArgumentException("Unknown field key: " + override.fieldKey());
        }
        ColumnDecision decision = ColumnDecision.manual(column, override, current.suggestions());
        resolution.apply(decision);
        return decision;
    }

    /**
     * Creates a catalog field for an unresolved column and maps the column to it.
     * A duplicate key leaves the column's decision unchanged and propagates to the caller.
     */
    public CanonicalField createFieldFor(MappingResolution resolution,
                                         String column,
                                         String proposedKey,
                                         FieldType type,
                                         String category,
                                         CanonicalFieldCatalog catalog) {
        requireMappable(resolution, column);
        String fieldKey = proposedKey == null || proposedKey.isBlank() ? slugify(column) : proposedKey.trim();
        if (fieldKey.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a field key from column '" + column + "'");
        }
        CanonicalField created = catalog.create(new NewFieldRequest(
                fieldKey,
                column,
                type == null ? FieldType.text : type,
                category == null || category.isBlank() ? DEFAULT_CATEGORY : category,
                List.of(column)
        ));
        resolution.addField(created);
        resolution.apply(ColumnDecision.created(column, created.fieldKey()));
        log.info("Field created for column: column={}, fieldKey={}", column, created.fieldKey());
        return created;
    }

    /**
     * A column is metadata when its normalized name contains a normalized exclusion term,
     * so {@code id} also excludes {@code userid}, {@code uuid} and {@code Guid}.
     */
    public boolean isMetadataColumn(String column, List<String> exclusions) {
        String normalized = SimilarityScorer.normalize(column);
        for (String exclusion : exclusions) {
            String term = SimilarityScorer.normalize(exclusion);
            if (!term.isEmpty() && normalized.contains(term)) {
                return true;
            }
        }
        return false;
    }

    static String slugify(String column) {
        if (column == null) {
            return "";
        }
        return column.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", "_")
                .replaceAll("[^a-z0-9_]", "");
    }

    private ColumnDecision decide(String column, List<CanonicalField> catalog, ImportProps.Matching matching) {
        List<MatchCandidate> scored = new ArrayList<>(catalog.size());
        MatchCandidate best = null;
        for (CanonicalField field : catalog) {
            MatchCandidate candidate = new MatchCandidate(column, field.fieldKey(), fieldScore(column, field));
            scored.add(candidate);
            if (best == null || candidate.confidence() > best.confidence()) {
                best = candidate;
            }
        }

        if (best != null && best.confidence() >= matching.autoThreshold()) {
            return ColumnDecision.auto(
                    column,
                    best.fieldKey(),
                    best.confidence(),
                    best.confidence() >= matching.highConfidenceThreshold()
            );
        }

        List<MatchCandidate> suggestions = scored.stream()
                .filter(candidate -> candidate.confidence() >= matching.suggestMin())
                .filter(candidate -> candidate.confidence() < matching.autoThreshold())
                .sorted(Comparator.comparingDouble(MatchCandidate::confidence).reversed())
                .limit(matching.maxSuggestions())
                .toList();
        return ColumnDecision.unmatched(column, best == null ? 0.0 : best.confidence(), suggestions);
    }

    private double fieldScore(String column, CanonicalField field) {
        double score = scorer.score(column, field.fieldKey());
        for (String alias : field.aliases()) {
            if (score >= 1.0) {
                break;
            }
            score = Math.max(score, scorer.score(column, alias));
        }
        return score;
    }

    private ColumnDecision requireMappable(MappingResolution resolution, String column) {
        if (resolution.isExcluded(column)) {
            throw new IllegalArgumentException("Column '" + column + "' is excluded from mapping");
        }
        return resolution.decision(column)
                .orElseThrow(() -> new IllegalArgumentException("Unknown column: " + column));
    }
}
