package app.fieldbridge.importer.service.parser;

public class MalformedSourceException extends RuntimeException {

    public MalformedSourceException(String message) {
        super(message);
    }

    public MalformedSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
