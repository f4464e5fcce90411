package app.fieldbridge.importer.service.batch;

import app.fieldbridge.importer.service.transform.ImportRecord;

import java.util.List;

/**
 * Stores one batch of records.
 *
 * <p>Implementations report per-row rejections in the returned {@link PersistResult}
 * and throw {@link RecordPersistenceException} when the whole batch could not be delivered.
 */
@FunctionalInterface
public interface RecordPersister {

    PersistResult persist(List<ImportRecord> batch);
}
