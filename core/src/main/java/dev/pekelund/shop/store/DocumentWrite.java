package dev.pekelund.shop.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One write inside an atomic batch.
 */
public record DocumentWrite(Operation operation, String documentId, Map<String, Object> fields) {

    public enum Operation {
        /** Creates the document; fails the whole batch if it already exists. */
        CREATE,
        /** Merges the fields into an existing document; fails the whole batch if it is missing. */
        UPDATE,
        /** Removes the document; a missing document is not an error. */
        DELETE
    }

    public DocumentWrite {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(documentId, "documentId");
        fields = fields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
            : Map.of();
    }

    public static DocumentWrite create(String documentId, Map<String, Object> fields) {
        return new DocumentWrite(Operation.CREATE, documentId, fields);
    }

    public static DocumentWrite update(String documentId, Map<String, Object> fields) {
        return new DocumentWrite(Operation.UPDATE, documentId, fields);
    }

    public static DocumentWrite delete(String documentId) {
        return new DocumentWrite(Operation.DELETE, documentId, Map.of());
    }
}
