package app.fieldbridge.importer.service.catalog;

import java.util.List;

/**
 * Shared library of canonical field definitions.
 */
public interface CanonicalFieldCatalog {

    /**
     * Reads every known field. Each call returns a fresh, finite list.
     */
    List<CanonicalField> list();

    /**
     * Creates a field definition.
     *
     * @throws DuplicateFieldKeyException if {@code request.fieldKey()} already exists
     */
    CanonicalField create(NewFieldRequest request);
}
