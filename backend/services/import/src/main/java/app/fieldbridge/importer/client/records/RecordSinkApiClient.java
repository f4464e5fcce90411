package app.fieldbridge.importer.client.records;

import app.fieldbridge.importer.service.batch.PersistResult;
import app.fieldbridge.importer.service.batch.RecordPersistenceException;
import app.fieldbridge.importer.service.batch.RecordPersister;
import app.fieldbridge.importer.service.transform.ImportRecord;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Delivers batches to the user store's bulk import endpoint.
 */
@Component
public class RecordSinkApiClient implements RecordPersister {

    private final RestClient restClient;

    public RecordSinkApiClient(@Qualifier("recordsRestClient") RestClient recordsRestClient) {
        this.restClient = recordsRestClient;
    }

    @Override
    public PersistResult persist(List<ImportRecord> batch) {
        List<Map<String, String>> users = new ArrayList<>(batch.size());
        for (ImportRecord record : batch) {
            users.add(record.values());
        }

        BulkImportResponse response;
        try {
            response = restClient.post()
                    .uri("/users/bulk-import")
                    .body(new BulkImportRequest(users))
                    .retrieve()
                    .body(BulkImportResponse.class);
        } catch (RestClientException ex) {
            throw new RecordPersistenceException("Bulk import request failed: " + ex.getMessage(), ex);
        }
        if (response == null) {
            throw new RecordPersistenceException("Bulk import returned an empty response");
        }

        List<PersistResult.RowError> errors = new ArrayList<>();
        if (response.errors() != null) {
            for (BulkImportResponse.Error error : response.errors()) {
                if (error == null) {
                    continue;
                }
                String message = error.error() == null || error.error().isBlank() ? "Record rejected" : error.error();
                errors.add(new PersistResult.RowError(error.rowIndex(), message));
            }
        }
        return new PersistResult(response.imported() == null ? 0 : response.imported(), errors);
    }
}
