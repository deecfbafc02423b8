package dev.pekelund.shop.collection;

import java.util.Set;

/**
 * Field names shared by every collection document.
 */
public final class CollectionFields {

    public static final String IS_DEFAULT = "isDefault";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    /**
     * Fields only the registry writes. Patches touching them are rejected.
     */
    public static final Set<String> MANAGED = Set.of("id", CREATED_AT, UPDATED_AT);

    private CollectionFields() {
    }
}
