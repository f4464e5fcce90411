package app.fieldbridge.importer.client.records;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkImportResponse(
        Integer imported,
        List<Error> errors
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Error(
            @JsonProperty("row_index") @JsonAlias("index") Integer rowIndex,
            @JsonProperty("error") @JsonAlias("message") String error
    ) {
    }
}
