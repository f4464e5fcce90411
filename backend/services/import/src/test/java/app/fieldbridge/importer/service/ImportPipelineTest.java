package app.fieldbridge.importer.service;

import app.fieldbridge.importer.config.ImportProps;
import app.fieldbridge.importer.service.batch.BatchImportExecutor;
import app.fieldbridge.importer.service.batch.CancellationFlag;
import app.fieldbridge.importer.service.batch.ImportAbortedException;
import app.fieldbridge.importer.service.batch.ImportProgress;
import app.fieldbridge.importer.service.batch.ImportProgressListener;
import app.fieldbridge.importer.service.batch.ImportSummary;
import app.fieldbridge.importer.service.batch.PersistResult;
import app.fieldbridge.importer.service.batch.RecordPersister;
import app.fieldbridge.importer.service.catalog.CanonicalField;
import app.fieldbridge.importer.service.catalog.CanonicalFieldCatalog;
import app.fieldbridge.importer.service.catalog.FieldType;
import app.fieldbridge.importer.service.catalog.NewFieldRequest;
import app.fieldbridge.importer.service.matching.ColumnOverride;
import app.fieldbridge.importer.service.matching.MappingResolution;
import app.fieldbridge.importer.service.matching.MappingResolver;
import app.fieldbridge.importer.service.matching.SimilarityScorer;
import app.fieldbridge.importer.service.parser.TabularData;
import app.fieldbridge.importer.service.parser.TabularParser;
import app.fieldbridge.importer.service.transform.ImportRecord;
import app.fieldbridge.importer.service.transform.IncompleteRowPolicy;
import app.fieldbridge.importer.service.transform.RecordTransformer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImportPipelineTest {

    private static final String SOURCE = """
            Email,First Name,Last Name,Notes
            ada@example.com,Ada,Lovelace,prefers email
            alan@example.com,Alan,Turing,
            ,,,
            grace@example.com,Grace,Hopper,met at conference
            """;

    private final TabularParser parser = new TabularParser();
    private final CanonicalFieldCatalog catalog = mock(CanonicalFieldCatalog.class);
    private final MappingResolver resolver = new MappingResolver(new SimilarityScorer());
    private final BatchImportExecutor executor = new BatchImportExecutor(ImportProps.defaults());
    private final List<List<ImportRecord>> persisted = new CopyOnWriteArrayList<>();
    private final RecordPersister persister = batch -> {
        persisted.add(batch);
        return PersistResult.imported(batch.size());
    };
    private final ImportPipeline pipeline = new ImportPipeline(
            parser, catalog, resolver, new RecordTransformer(), executor, persister
    );

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void importResolved_createdFieldCarriesValuesIntoEveryRecord() {
        when(catalog.list()).thenReturn(baseCatalog());
        when(catalog.create(any(NewFieldRequest.class)))
                .thenReturn(new CanonicalField("notes", "Notes", FieldType.text, "custom", Set.of("Notes"), 0));
        TabularData data = parser.parse(SOURCE);
        MappingResolution resolution = resolver.resolve(parser.columns(data), catalog.list(), ImportProps.Matching.defaults());

        assertThat(resolution.unmatched()).extracting(decision -> decision.column()).containsExactly("Notes");
        resolver.createFieldFor(resolution, "Notes", null, FieldType.text, null, catalog);

        ImportSummary summary = pipeline.importResolved(
                data, resolution.finalMapping(), ImportProps.defaults(), ImportProgressListener.NOOP, new CancellationFlag()
        );

        List<ImportRecord> records = persisted.get(0);
        assertThat(records).hasSize(3);
        assertThat(records).allSatisfy(record -> assertThat(record.values()).containsKey("notes"));
        assertThat(records.get(0).values())
                .containsEntry("email", "ada@example.com")
                .containsEntry("first_name", "Ada")
                .containsEntry("last_name", "Lovelace")
                .containsEntry("notes", "prefers email");
        assertThat(records).extracting(ImportRecord::rowNumber).containsExactly(1, 2, 4);
        assertThat(summary.total()).isEqualTo(4);
        assertThat(summary.imported()).isEqualTo(3);
        assertThat(summary.dropped()).isEqualTo(1);
        assertThat(summary.failed()).isZero();
    }

    @Test
    void start_appliesOverridesBeforeImporting() {
        when(catalog.list()).thenReturn(baseCatalog());

        ImportSummary summary = pipeline.start(
                SOURCE,
                Map.of("Notes", ColumnOverride.skipColumn(), "Last Name", ColumnOverride.field("first_name")),
                ImportProps.defaults(),
                ImportProgressListener.NOOP,
                new CancellationFlag()
        );

        ImportRecord first = persisted.get(0).get(0);
        assertThat(first.values()).doesNotContainKeys("notes", "last_name");
        assertThat(first.value("first_name")).isEqualTo("Lovelace");
        assertThat(summary.imported()).isEqualTo(3);
        verify(catalog, times(1)).list();
    }

    @Test
    void start_reportsProgressThroughListener() {
        when(catalog.list()).thenReturn(baseCatalog());
        List<ImportProgress> progress = new ArrayList<>();
        ImportProps config = ImportProps.defaults().withBatch(ImportProps.Batch.ofSize(2));

        pipeline.start(SOURCE, null, config, progress::add, new CancellationFlag());

        assertThat(progress).extracting(ImportProgress::percent).containsExactly(66, 100);
        assertThat(persisted).hasSize(2);
    }

    @Test
    void importResolved_failPolicyCountsRejectedRowsAsFailed() {
        TabularData data = parser.parse("""
                Email,Phone
                ada@example.com,555-0100
                ,555-0101
                """);
        ImportProps config = ImportProps.defaults().withTransform(new ImportProps.Transform(
                List.of("email"), null, IncompleteRowPolicy.fail, null
        ));

        ImportSummary summary = pipeline.importResolved(
                data, Map.of("Email", "email", "Phone", "phone"), config, ImportProgressListener.NOOP, new CancellationFlag()
        );

        assertThat(summary.total()).isEqualTo(2);
        assertThat(summary.imported()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.errors()).hasSize(1);
        assertThat(summary.errors().get(0).rowNumber()).isEqualTo(2);
    }

    @Test
    void importResolved_emptyMappingImportsNothing() {
        TabularData data = parser.parse(SOURCE);

        ImportSummary summary = pipeline.importResolved(
                data, Map.of(), ImportProps.defaults(), ImportProgressListener.NOOP, new CancellationFlag()
        );

        assertThat(persisted).isEmpty();
        assertThat(summary.imported()).isZero();
        assertThat(summary.dropped()).isEqualTo(4);
    }

    @Test
    void importResolved_abortCarriesMergedPartialSummary() {
        RecordPersister broken = batch -> {
            throw new IllegalStateException("bug");
        };
        ImportPipeline failing = new ImportPipeline(parser, catalog, resolver, new RecordTransformer(), executor, broken);
        TabularData data = parser.parse(SOURCE);

        assertThatThrownBy(() -> failing.importResolved(
                data,
                Map.of("Email", "email", "First Name", "first_name"),
                ImportProps.defaults(),
                ImportProgressListener.NOOP,
                new CancellationFlag()
        ))
                .isInstanceOf(ImportAbortedException.class)
                .satisfies(ex -> {
                    ImportSummary partial = ((ImportAbortedException) ex).getPartialSummary();
                    assertThat(partial.total()).isEqualTo(4);
                    assertThat(partial.dropped()).isEqualTo(1);
                    assertThat(partial.notAttempted()).isEqualTo(3);
                });
    }

    private List<CanonicalField> baseCatalog() {
        return List.of(
                CanonicalField.of("email", FieldType.email),
                CanonicalField.of("first_name", FieldType.text),
                CanonicalField.of("last_name", FieldType.text)
        );
    }
}
