package app.fieldbridge.importer.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record UpdateMappingsRequest(
        @NotEmpty List<@Valid ColumnMappingRequest> mappings
) {
}
