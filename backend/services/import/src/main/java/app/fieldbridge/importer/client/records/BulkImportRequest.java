package app.fieldbridge.importer.client.records;

import java.util.List;
import java.util.Map;

public record BulkImportRequest(List<Map<String, String>> users) {
}
