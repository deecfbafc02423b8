package dev.pekelund.shop.collection;

import dev.pekelund.shop.store.StoredDocument;
import java.util.Map;

/**
 * Validation and document mapping for one kind of collection item.
 *
 * @param <T> the item read back from the store
 * @param <D> the draft a caller supplies when adding an item
 */
public interface CollectionSchema<T extends CollectionItem, D> {

    CollectionKind kind();

    /**
     * Name of the field holding the owner id.
     */
    default String ownerField() {
        return "ownerId";
    }

    /**
     * Validates a draft and returns its storable fields, without id, owner, default flag or timestamps.
     *
     * @throws ItemValidationException when a required field is missing or a value is invalid
     */
    Map<String, Object> toFields(D draft);

    /**
     * Validates a partial update and returns the normalized fields to write. The default flag and the
     * timestamps are handled by the registry and never reach this method.
     *
     * @throws ItemValidationException for unknown or immutable fields and invalid values
     */
    Map<String, Object> validatePatch(Map<String, Object> patch);

    /**
     * Validates a partial update against the item as currently stored. Rules that combine patched and
     * stored values belong here.
     */
    default Map<String, Object> validatePatch(StoredDocument current, Map<String, Object> patch) {
        return validatePatch(patch);
    }

    /**
     * @throws ItemValidationException when the document cannot be read as an item
     */
    T fromDocument(StoredDocument document);
}
