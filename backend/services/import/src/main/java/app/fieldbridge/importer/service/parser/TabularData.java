package app.fieldbridge.importer.service.parser;

import java.util.List;
import java.util.Map;

public record TabularData(
        List<String> headers,
        List<Map<String, String>> rows
) {
    public int rowCount() {
        return rows.size();
    }
}
