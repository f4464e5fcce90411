package app.fieldbridge.importer.service.transform;

/**
 * How many of the required identity fields a record must carry.
 */
public enum IdentityMatch {
    any,
    all
}
