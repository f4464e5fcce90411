package app.fieldbridge.importer.service.transform;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rewrites legacy or camel-cased field keys to the keys the record sink expects.
 * Keys without an entry pass through unchanged.
 */
public class FieldAliasTable {

    public static final Map<String, String> DEFAULT_ALIASES = defaultAliases();

    private final Map<String, String> aliases;

    public FieldAliasTable(Map<String, String> aliases) {
        this.aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
    }

    public static FieldAliasTable defaults() {
        return new FieldAliasTable(DEFAULT_ALIASES);
    }

    public static FieldAliasTable empty() {
        return new FieldAliasTable(Map.of());
    }

    public String resolve(String fieldKey) {
        if (fieldKey == null) {
            return null;
        }
        return aliases.getOrDefault(fieldKey, fieldKey);
    }

    private static Map<String, String> defaultAliases() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("emailAddress", "email");
        map.put("email_address", "email");
        map.put("firstName", "first_name");
        map.put("lastName", "last_name");
        map.put("phoneNumber", "phone");
        map.put("phone_number", "phone");
        map.put("streetAddress", "address");
        map.put("street_address", "address");
        map.put("zip_code", "zipCode");
        map.put("postalCode", "zipCode");
        map.put("postal_code", "zipCode");
        return Map.copyOf(map);
    }
}
