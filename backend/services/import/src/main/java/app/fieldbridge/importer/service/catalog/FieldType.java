package app.fieldbridge.importer.service.catalog;

import java.util.Locale;

public enum FieldType {
    text,
    email,
    tel,
    number,
    date,
    textarea,
    select,
    radio,
    checkbox;

    public static FieldType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return text;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "email" -> email;
            case "tel", "phone" -> tel;
            case "number", "integer", "decimal" -> number;
            case "date", "datetime" -> date;
            case "textarea" -> textarea;
            case "select", "dropdown" -> select;
            case "radio" -> radio;
            case "checkbox", "boolean" -> checkbox;
            default -> text;
        };
    }
}
