package app.fieldbridge.importer.config;

import app.fieldbridge.importer.service.transform.FieldAliasTable;
import app.fieldbridge.importer.service.transform.IdentityMatch;
import app.fieldbridge.importer.service.transform.IncompleteRowPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app.import")
public record ImportProps(
        @DefaultValue Matching matching,
        @DefaultValue Transform transform,
        @DefaultValue Batch batch,
        @DefaultValue Worker worker,
        @DefaultValue Preview preview
) {

    public static final List<String> DEFAULT_METADATA_EXCLUSIONS = List.of(
            "id", "_id", "created_at", "updated_at", "createdAt", "updatedAt",
            "created", "modified", "timestamp", "internal_ref", "row_id"
    );
    public static final List<String> DEFAULT_IDENTITY_FIELDS = List.of("email", "first_name", "last_name");

    public static ImportProps defaults() {
        return new ImportProps(Matching.defaults(), Transform.defaults(), Batch.defaults(), Worker.defaults(), Preview.defaults());
    }

    public ImportProps withWorker(Worker worker) {
        return new ImportProps(matching, transform, batch, worker, preview);
    }

    public ImportProps withBatch(Batch batch) {
        return new ImportProps(matching, transform, batch, worker, preview);
    }

    public ImportProps withTransform(Transform transform) {
        return new ImportProps(matching, transform, batch, worker, preview);
    }

    /**
     * Column scoring thresholds. A column is auto-mapped at or above {@code autoThreshold};
     * below it, candidates scoring in {@code [suggestMin, autoThreshold)} are offered as hints.
     */
    public record Matching(
            @DefaultValue("0.7") double autoThreshold,
            @DefaultValue("0.9") double highConfidenceThreshold,
            @DefaultValue("0.4") double suggestMin,
            @DefaultValue("3") int maxSuggestions,
            List<String> metadataExclusions
    ) {
        public Matching {
            if (autoThreshold < 0 || autoThreshold > 1) {
                throw new IllegalArgumentException("auto-threshold must be within [0, 1]");
            }
            if (suggestMin < 0 || suggestMin > autoThreshold) {
                throw new IllegalArgumentException("suggest-min must be within [0, auto-threshold]");
            }
            maxSuggestions = Math.max(maxSuggestions, 0);
            metadataExclusions = metadataExclusions == null ? DEFAULT_METADATA_EXCLUSIONS : List.copyOf(metadataExclusions);
        }

        public static Matching defaults() {
            return new Matching(0.7, 0.9, 0.4, 3, null);
        }

        public Matching withAutoThreshold(double value) {
            return new Matching(value, highConfidenceThreshold, Math.min(suggestMin, value), maxSuggestions, metadataExclusions);
        }
    }

    public record Transform(
            List<String> requiredIdentityFields,
            @DefaultValue("any") IdentityMatch identityMatch,
            @DefaultValue("drop") IncompleteRowPolicy incompleteRowPolicy,
            Map<String, String> fieldAliases
    ) {
        public Transform {
            requiredIdentityFields = requiredIdentityFields == null ? DEFAULT_IDENTITY_FIELDS : List.copyOf(requiredIdentityFields);
            identityMatch = identityMatch == null ? IdentityMatch.any : identityMatch;
            incompleteRowPolicy = incompleteRowPolicy == null ? IncompleteRowPolicy.drop : incompleteRowPolicy;
            fieldAliases = fieldAliases == null ? FieldAliasTable.DEFAULT_ALIASES : Map.copyOf(fieldAliases);
        }

        public static Transform defaults() {
            return new Transform(null, null, null, null);
        }

        public FieldAliasTable aliasTable() {
            return new FieldAliasTable(fieldAliases);
        }
    }

    public record Batch(
            @DefaultValue("1000") int size,
            @DefaultValue("60s") Duration persistTimeout,
            @DefaultValue("50") int maxReportedErrors
    ) {
        public Batch {
            if (size <= 0) {
                throw new IllegalArgumentException("batch size must be positive");
            }
            persistTimeout = persistTimeout == null || persistTimeout.isNegative() || persistTimeout.isZero()
                    ? Duration.ofSeconds(60)
                    : persistTimeout;
            maxReportedErrors = Math.max(maxReportedErrors, 0);
        }

        public static Batch defaults() {
            return new Batch(1000, Duration.ofSeconds(60), 50);
        }

        public static Batch ofSize(int size) {
            return new Batch(size, Duration.ofSeconds(60), 50);
        }
    }

    /**
     * Background runs. {@code id} names this instance in session locks; a run whose lock is older
     * than {@code lockTtl} and not held by this instance is treated as lost.
     */
    public record Worker(
            @DefaultValue("2") int threads,
            @DefaultValue("16") int queueCapacity,
            String id,
            @DefaultValue("300s") Duration lockTtl,
            @DefaultValue("60000") long sweepIntervalMs
    ) {
        public Worker {
            threads = Math.max(threads, 1);
            queueCapacity = Math.max(queueCapacity, threads);
            id = id == null || id.isBlank() ? "import-worker" : id.trim();
            lockTtl = lockTtl == null || lockTtl.isNegative() || lockTtl.isZero() ? Duration.ofSeconds(300) : lockTtl;
            sweepIntervalMs = sweepIntervalMs <= 0 ? 60000 : sweepIntervalMs;
        }

        public static Worker defaults() {
            return new Worker(2, 16, null, Duration.ofSeconds(300), 60000);
        }

        public static Worker of(int threads, int queueCapacity) {
            return new Worker(threads, queueCapacity, null, Duration.ofSeconds(300), 60000);
        }
    }

    public record Preview(
            @DefaultValue("5") int sampleSize
    ) {
        public Preview {
            sampleSize = sampleSize <= 0 ? 5 : sampleSize;
        }

        public static Preview defaults() {
            return new Preview(5);
        }
    }
}
