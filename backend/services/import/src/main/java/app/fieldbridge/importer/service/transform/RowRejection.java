package app.fieldbridge.importer.service.transform;

public record RowRejection(int rowNumber, String message) {
}
