package app.fieldbridge.importer.client.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Field library entry as served by the catalog. Older entries carry {@code field_type} and
 * {@code canonical_name}, newer ones {@code type} and {@code label}; aliases arrive either as a
 * JSON array or as a JSON-encoded string.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogFieldResponse(
        @JsonProperty("field_key") String fieldKey,
        @JsonProperty("label") String label,
        @JsonProperty("canonical_name") String canonicalName,
        @JsonProperty("type") String type,
        @JsonProperty("field_type") String fieldType,
        @JsonProperty("category") String category,
        @JsonProperty("aliases") JsonNode aliases,
        @JsonProperty("common_aliases") JsonNode commonAliases,
        @JsonProperty("usage_count") Integer usageCount
) {
}
