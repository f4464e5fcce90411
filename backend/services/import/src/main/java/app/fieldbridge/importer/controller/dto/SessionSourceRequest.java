package app.fieldbridge.importer.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record SessionSourceRequest(
        String sourceName,
        @NotBlank String sourceText
) {
}
