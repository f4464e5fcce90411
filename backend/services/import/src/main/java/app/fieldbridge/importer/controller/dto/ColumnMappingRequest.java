package app.fieldbridge.importer.controller.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Maps {@code column} to {@code fieldKey}, or excludes it from the import when {@code skip} is set.
 */
public record ColumnMappingRequest(
        @NotBlank String column,
        String fieldKey,
        boolean skip
) {
}
