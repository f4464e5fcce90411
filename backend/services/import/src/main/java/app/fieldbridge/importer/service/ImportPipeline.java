package app.fieldbridge.importer.service;

import app.fieldbridge.importer.config.ImportProps;
import app.fieldbridge.importer.service.batch.BatchImportExecutor;
import app.fieldbridge.importer.service.batch.CancellationFlag;
import app.fieldbridge.importer.service.batch.ImportAbortedException;
import app.fieldbridge.importer.service.batch.ImportProgressListener;
import app.fieldbridge.importer.service.batch.ImportSummary;
import app.fieldbridge.importer.service.batch.RecordPersister;
import app.fieldbridge.importer.service.catalog.CanonicalFieldCatalog;
import app.fieldbridge.importer.service.matching.ColumnOverride;
import app.fieldbridge.importer.service.matching.MappingResolution;
import app.fieldbridge.importer.service.matching.MappingResolver;
import app.fieldbridge.importer.service.parser.TabularData;
import app.fieldbridge.importer.service.parser.TabularParser;
import app.fieldbridge.importer.service.transform.RecordTransformer;
import app.fieldbridge.importer.service.transform.RowRejection;
import app.fieldbridge.importer.service.transform.TransformResult;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Runs a whole import: parse, resolve columns against one catalog read, apply overrides,
 * transform rows and persist them in batches.
 */
@Service
public class ImportPipeline {

    private final TabularParser parser;
    private final CanonicalFieldCatalog catalog;
    private final MappingResolver resolver;
    private final RecordTransformer transformer;
    private final BatchImportExecutor executor;
    private final RecordPersister persister;

    public ImportPipeline(TabularParser parser,
                          CanonicalFieldCatalog catalog,
                          MappingResolver resolver,
                          RecordTransformer transformer,
                          BatchImportExecutor executor,
                          RecordPersister persister) {
        this.parser = parser;
        this.catalog = catalog;
        this.resolver = resolver;
        this.transformer = transformer;
        this.executor = executor;
        this.persister = persister;
    }

    public ImportSummary start(String sourceText,
                               Map<String, ColumnOverride> overrides,
                               ImportProps config,
                               ImportProgressListener listener,
                               CancellationFlag cancellation) {
        TabularData data = parser.parse(sourceText);
        MappingResolution resolution = resolver.resolve(parser.columns(data), catalog.list(), config.matching());
        if (overrides != null) {
            overrides.forEach((column, override) -> resolver.setMapping(resolution, column, override));
        }
        return importResolved(data, resolution.finalMapping(), config, listener, cancellation);
    }

    public ImportSummary importResolved(TabularData data,
                                        Map<String, String> finalMapping,
                                        ImportProps config,
                                        ImportProgressListener listener,
                                        CancellationFlag cancellation) {
        TransformResult transformed = transform(data, finalMapping, config);
        try {
            ImportSummary executed = executor.execute(transformed.records(), config.batch(), persister, listener, cancellation);
            return merge(data, transformed, executed, config);
        } catch (ImportAbortedException ex) {
            throw new ImportAbortedException(
                    ex.getMessage(),
                    merge(data, transformed, ex.getPartialSummary(), config),
                    ex.getCause()
            );
        }
    }

    public TransformResult transform(TabularData data, Map<String, String> finalMapping, ImportProps config) {
        return transformer.transform(data.rows(), finalMapping, config.transform().aliasTable(), config.transform());
    }

    private ImportSummary merge(TabularData data, TransformResult transformed, ImportSummary executed, ImportProps config) {
        ImportSummary.Builder builder = ImportSummary.builder(config.batch().maxReportedErrors())
                .total(data.rowCount())
                .dropped(transformed.dropped());
        for (RowRejection rejection : transformed.rejections()) {
            builder.addRejected(rejection.rowNumber(), rejection.message());
        }
        if (executed != null) {
            builder.include(executed);
        }
        return builder.build();
    }
}
