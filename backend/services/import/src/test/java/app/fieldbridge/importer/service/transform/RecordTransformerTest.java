package app.fieldbridge.importer.service.transform;

import app.fieldbridge.importer.config.ImportProps;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordTransformerTest {

    private final RecordTransformer transformer = new RecordTransformer();
    private final ImportProps.Transform defaults = ImportProps.Transform.defaults();

    @Test
    void transform_writesMappedValuesUnderResolvedKeys() {
        List<Map<String, String>> rows = List.of(
                row("E-mail", " ada@example.com ", "Given", "Ada", "Zip", "N1 9GU", "Ignored", "x")
        );
        Map<String, String> mapping = mapping("E-mail", "emailAddress", "Given", "firstName", "Zip", "postal_code");

        TransformResult result = transformer.transform(rows, mapping, FieldAliasTable.defaults(), defaults);

        assertThat(result.records()).hasSize(1);
        ImportRecord record = result.records().get(0);
        assertThat(record.rowNumber()).isEqualTo(1);
        assertThat(record.values()).containsExactly(
                Map.entry("email", "ada@example.com"),
                Map.entry("first_name", "Ada"),
                Map.entry("zipCode", "N1 9GU")
        );
    }

    @Test
    void transform_allColumnsSkippedYieldsNoRecords() {
        List<Map<String, String>> rows = List.of(row("Email", "ada@example.com"), row("Email", "alan@example.com"));

        TransformResult result = transformer.transform(rows, Map.of(), FieldAliasTable.defaults(), defaults);

        assertThat(result.records()).isEmpty();
        assertThat(result.rejections()).isEmpty();
    }

    @Test
    void transform_dropsRowsWithoutAnyIdentityField() {
        List<Map<String, String>> rows = List.of(
                row("Email", "ada@example.com", "Notes", "a"),
                row("Email", "", "Notes", "only notes"),
                row("Email", "   ", "Notes", "")
        );

        TransformResult result = transformer.transform(rows, mapping("Email", "email", "Notes", "notes"), FieldAliasTable.defaults(), defaults);

        assertThat(result.records()).extracting(ImportRecord::rowNumber).containsExactly(1);
        assertThat(result.dropped()).isEqualTo(2);
        assertThat(result.failed()).isZero();
    }

    @Test
    void transform_allIdentityPolicyRequiresEveryField() {
        ImportProps.Transform policy = new ImportProps.Transform(null, IdentityMatch.all, IncompleteRowPolicy.drop, null);
        List<Map<String, String>> rows = List.of(
                row("Email", "ada@example.com", "First", "Ada", "Last", "Lovelace"),
                row("Email", "alan@example.com", "First", "Alan", "Last", "")
        );

        TransformResult result = transformer.transform(
                rows,
                mapping("Email", "email", "First", "first_name", "Last", "last_name"),
                FieldAliasTable.defaults(),
                policy
        );

        assertThat(result.records()).extracting(ImportRecord::rowNumber).containsExactly(1);
        assertThat(result.dropped()).isEqualTo(1);
    }

    @Test
    void transform_failPolicyReportsIncompleteRowsAsRejections() {
        ImportProps.Transform policy = new ImportProps.Transform(null, IdentityMatch.any, IncompleteRowPolicy.fail, null);
        List<Map<String, String>> rows = List.of(
                row("Email", "ada@example.com", "Notes", "x"),
                row("Email", "", "Notes", "y"),
                row("Email", "", "Notes", "")
        );

        TransformResult result = transformer.transform(rows, mapping("Email", "email", "Notes", "notes"), FieldAliasTable.defaults(), policy);

        assertThat(result.records()).hasSize(1);
        assertThat(result.rejections()).extracting(RowRejection::rowNumber).containsExactly(2);
        assertThat(result.dropped()).isEqualTo(1);
    }

    @Test
    void transform_laterColumnWinsWhenTwoColumnsShareAField() {
        List<Map<String, String>> rows = List.of(row("Email", "old@example.com", "E-mail", "new@example.com"));

        TransformResult result = transformer.transform(rows, mapping("Email", "email", "E-mail", "email"), FieldAliasTable.empty(), defaults);

        assertThat(result.records().get(0).value("email")).isEqualTo("new@example.com");
    }

    @Test
    void transform_emptyIdentityListKeepsEveryNonBlankRow() {
        ImportProps.Transform policy = new ImportProps.Transform(List.of(), IdentityMatch.any, IncompleteRowPolicy.drop, null);

        TransformResult result = transformer.transform(
                List.of(row("Notes", "hello"), row("Notes", "")),
                mapping("Notes", "notes"),
                FieldAliasTable.defaults(),
                policy
        );

        assertThat(result.records()).extracting(record -> record.value("notes")).containsExactly("hello");
        assertThat(result.dropped()).isEqualTo(1);
    }

    private Map<String, String> row(String... pairs) {
        return mapping(pairs);
    }

    private Map<String, String> mapping(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }
}
