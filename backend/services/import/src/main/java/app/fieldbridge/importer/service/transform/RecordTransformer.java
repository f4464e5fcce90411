package app.fieldbridge.importer.service.transform;

import app.fieldbridge.importer.config.ImportProps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class RecordTransformer {

    private static final Logger log = LoggerFactory.getLogger(RecordTransformer.class);

    public TransformResult transform(List<Map<String, String>> rows,
                                     Map<String, String> finalMapping,
                                     FieldAliasTable aliasTable,
                                     ImportProps.Transform policy) {
        List<ImportRecord> records = new ArrayList<>();
        List<RowRejection> rejections = new ArrayList<>();
        int dropped = 0;

        if (rows == null || rows.isEmpty()) {
            return new TransformResult(List.of(), 0, List.of());
        }
        if (finalMapping == null || finalMapping.isEmpty()) {
            return new TransformResult(List.of(), rows.size(), List.of());
        }
        FieldAliasTable aliases = aliasTable == null ? FieldAliasTable.empty() : aliasTable;

        int rowNumber = 0;
        for (Map<String, String> row : rows) {
            rowNumber++;
            Map<String, String> values = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : finalMapping.entrySet()) {
                String target = aliases.resolve(entry.getValue());
                String value = row.get(entry.getKey());
                values.put(target, value == null ? "" : value.trim());
            }

            if (values.values().stream().allMatch(String::isBlank)) {
                dropped++;
                continue;
            }
            if (!hasIdentity(values, policy)) {
                if (policy.incompleteRowPolicy() == IncompleteRowPolicy.fail) {
                    rejections.add(new RowRejection(rowNumber, "Missing required identity fields " + policy.requiredIdentityFields()));
                } else {
                    dropped++;
                }
                continue;
            }
            records.add(new ImportRecord(rowNumber, values));
        }

        if (dropped > 0 || !rejections.isEmpty()) {
            log.info("Rows filtered during transform: rows={}, records={}, dropped={}, rejected={}",
                    rowNumber, records.size(), dropped, rejections.size());
        }
        return new TransformResult(records, dropped, rejections);
    }

    boolean hasIdentity(Map<String, String> values, ImportProps.Transform policy) {
        List<String> required = policy.requiredIdentityFields();
        if (required.isEmpty()) {
            return true;
        }
        if (policy.identityMatch() == IdentityMatch.all) {
            return required.stream().allMatch(key -> isPresent(values.get(key)));
        }
        return required.stream().anyMatch(key -> isPresent(values.get(key)));
    }

    private boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
