package app.fieldbridge.importer.controller.dto;

import app.fieldbridge.importer.service.catalog.FieldType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateFieldRequest(
        @NotBlank String column,
        @Size(max = 100) String fieldKey,
        FieldType type,
        String category
) {
}
