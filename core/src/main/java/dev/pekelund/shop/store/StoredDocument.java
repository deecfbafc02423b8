package dev.pekelund.shop.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable copy of one document as read from a {@link DocumentStore}. Timestamps are always exposed as
 * {@link Instant}s regardless of the store's native representation.
 */
public record StoredDocument(String id, Map<String, Object> fields) {

    public StoredDocument {
        Objects.requireNonNull(id, "id");
        fields = fields != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(fields))
            : Map.of();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.get(field) != null;
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value != null ? value.toString() : null;
    }

    public boolean getBoolean(String field) {
        return Boolean.TRUE.equals(fields.get(field));
    }

    public Double getDouble(String field) {
        Object value = fields.get(field);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }

    public Instant getInstant(String field) {
        Object value = fields.get(field);
        return value instanceof Instant instant ? instant : null;
    }
}
