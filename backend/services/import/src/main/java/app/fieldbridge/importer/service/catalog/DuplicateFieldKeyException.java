package app.fieldbridge.importer.service.catalog;

public class DuplicateFieldKeyException extends RuntimeException {

    private final String fieldKey;

    public DuplicateFieldKeyException(String fieldKey) {
        super("Field key already exists: " + fieldKey);
        this.fieldKey = fieldKey;
    }

    public String getFieldKey() {
        return fieldKey;
    }
}
