package app.fieldbridge.importer.client.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CatalogFieldRequest(
        @JsonProperty("field_key") String fieldKey,
        @JsonProperty("canonical_name") String canonicalName,
        @JsonProperty("field_type") String fieldType,
        @JsonProperty("category") String category,
        @JsonProperty("common_aliases") List<String> commonAliases,
        @JsonProperty("created_by") String createdBy
) {
}
