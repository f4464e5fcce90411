package app.fieldbridge.importer.service.batch;

public class RecordPersistenceException extends RuntimeException {

    public RecordPersistenceException(String message) {
        super(message);
    }

    public RecordPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
