package dev.pekelund.shop.batch;

import dev.pekelund.shop.store.DocumentWrite;
import dev.pekelund.shop.store.DocumentWrite.Operation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Ordered set of writes for one collection, committed together by {@link TransactionalBatchWriter}.
 *
 * <p>The builder keeps at most one write per document: repeated updates merge (later fields win), an
 * update after a create folds into the created document, and a delete replaces anything scheduled before
 * it. Writing to a document after scheduling its deletion is a programming error.
 */
public final class WriteBatchPlan {

    private static final WriteBatchPlan EMPTY = new WriteBatchPlan(List.of());

    private final List<DocumentWrite> writes;

    private WriteBatchPlan(List<DocumentWrite> writes) {
        this.writes = Collections.unmodifiableList(writes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<DocumentWrite> writes() {
        return writes;
    }

    public int size() {
        return writes.size();
    }

    public boolean isEmpty() {
        return writes.isEmpty();
    }

    @Override
    public String toString() {
        return "WriteBatchPlan" + writes;
    }

    public static final class Builder {

        private final Map<String, Pending> pending = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder create(String documentId, Map<String, Object> fields) {
            String id = requireId(documentId);
            Pending existing = pending.get(id);
            if (existing != null) {
                throw new IllegalStateException("Document " + id + " is already part of this batch");
            }
            pending.put(id, new Pending(Operation.CREATE, fields));
            return this;
        }

        public Builder update(String documentId, Map<String, Object> fields) {
            String id = requireId(documentId);
            Pending existing = pending.get(id);
            if (existing == null) {
                pending.put(id, new Pending(Operation.UPDATE, fields));
                return this;
            }
            if (existing.operation == Operation.DELETE) {
                throw new IllegalStateException("Document " + id + " is already scheduled for deletion");
            }
            existing.fields.putAll(fields);
            return this;
        }

        public Builder delete(String documentId) {
            String id = requireId(documentId);
            pending.remove(id);
            pending.put(id, new Pending(Operation.DELETE, Map.of()));
            return this;
        }

        public WriteBatchPlan build() {
            if (pending.isEmpty()) {
                return EMPTY;
            }
            List<DocumentWrite> writes = new ArrayList<>(pending.size());
            pending.forEach((id, write) -> writes.add(new DocumentWrite(write.operation, id, write.fields)));
            return new WriteBatchPlan(writes);
        }

        private static String requireId(String documentId) {
            Assert.isTrue(StringUtils.hasText(documentId), "documentId must not be empty");
            return documentId;
        }
    }

    private static final class Pending {

        private final Operation operation;
        private final Map<String, Object> fields;

        private Pending(Operation operation, Map<String, Object> fields) {
            this.operation = Objects.requireNonNull(operation, "operation");
            this.fields = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
        }
    }
}
