package app.fieldbridge.importer.controller.dto;

import jakarta.validation.constraints.Positive;

public record PreviewRequest(
        @Positive Integer sampleSize
) {
}
