package app.fieldbridge.importer.service.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One transformed source row. {@code rowNumber} is the 1-based data row in the source file.
 */
public record ImportRecord(int rowNumber, Map<String, String> values) {

    public ImportRecord {
        values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String value(String fieldKey) {
        return values.get(fieldKey);
    }
}
