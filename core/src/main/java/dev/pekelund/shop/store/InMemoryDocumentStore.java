package dev.pekelund.shop.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Process-local {@link DocumentStore} used when Firestore is disabled and in tests.
 *
 * <p>Batches are applied under a single lock against a copy of the collection, so a failing write leaves
 * the collection untouched. Snapshots are delivered on the writing thread after the lock is released and
 * carry a per-collection version; a registration drops any snapshot older than the last one it delivered.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);
    private static final int DOCUMENT_ID_LENGTH = 20;

    private final Object lock = new Object();
    private final Map<CollectionPath, Map<String, Map<String, Object>>> collections = new HashMap<>();
    private final Map<CollectionPath, Long> versions = new HashMap<>();
    private final ConcurrentMap<CollectionPath, List<Registration>> registrations = new ConcurrentHashMap<>();

    @Override
    public String newDocumentId(CollectionPath path) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, DOCUMENT_ID_LENGTH);
    }

    @Override
    public String add(CollectionPath path, Map<String, Object> fields) {
        String documentId = newDocumentId(path);
        batchUpdate(path, List.of(DocumentWrite.create(documentId, fields)));
        return documentId;
    }

    @Override
    public List<StoredDocument> getAll(CollectionPath path) {
        synchronized (lock) {
            return toDocuments(collections.getOrDefault(path, Map.of()));
        }
    }

    @Override
    public Optional<StoredDocument> getOne(CollectionPath path, String documentId) {
        if (!StringUtils.hasText(documentId)) {
            return Optional.empty();
        }
        synchronized (lock) {
            Map<String, Object> fields = collections.getOrDefault(path, Map.of()).get(documentId);
            return fields != null ? Optional.of(new StoredDocument(documentId, fields)) : Optional.empty();
        }
    }

    @Override
    public void batchUpdate(CollectionPath path, List<DocumentWrite> writes) {
        if (writes == null || writes.isEmpty()) {
            return;
        }

        Snapshot snapshot;
        synchronized (lock) {
            Map<String, Map<String, Object>> next = new LinkedHashMap<>(collections.getOrDefault(path, Map.of()));
            for (DocumentWrite write : writes) {
                apply(path, next, write);
            }
            collections.put(path, next);
            long version = versions.merge(path, 1L, Long::sum);
            snapshot = new Snapshot(version, toDocuments(next));
        }
        log.debug("Applied {} writes to {} (version {})", writes.size(), path, snapshot.version());
        publish(path, snapshot);
    }

    @Override
    public void delete(CollectionPath path, String documentId) {
        batchUpdate(path, List.of(DocumentWrite.delete(documentId)));
    }

    @Override
    public StoreRegistration subscribe(CollectionPath path, SnapshotListener listener) {
        Registration registration = new Registration(path, listener);
        registrations.computeIfAbsent(path, key -> new CopyOnWriteArrayList<>()).add(registration);

        Snapshot current;
        synchronized (lock) {
            current = new Snapshot(
                versions.getOrDefault(path, 0L),
                toDocuments(collections.getOrDefault(path, Map.of())));
        }
        registration.deliver(current);
        return registration;
    }

    int listenerCount(CollectionPath path) {
        List<Registration> active = registrations.get(path);
        return active != null ? active.size() : 0;
    }

    private void apply(CollectionPath path, Map<String, Map<String, Object>> documents, DocumentWrite write) {
        String documentId = write.documentId();
        switch (write.operation()) {
            case CREATE -> {
                if (documents.containsKey(documentId)) {
                    throw new DocumentStoreException("Document already exists: " + path + "/" + documentId);
                }
                documents.put(documentId, new LinkedHashMap<>(write.fields()));
            }
            case UPDATE -> {
                Map<String, Object> existing = documents.get(documentId);
                if (existing == null) {
                    throw new DocumentStoreException("No document to update: " + path + "/" + documentId);
                }
                Map<String, Object> merged = new LinkedHashMap<>(existing);
                merged.putAll(write.fields());
                documents.put(documentId, merged);
            }
            case DELETE -> documents.remove(documentId);
            default -> throw new IllegalStateException("Unsupported write " + write.operation());
        }
    }

    private void publish(CollectionPath path, Snapshot snapshot) {
        List<Registration> listeners = registrations.get(path);
        if (listeners == null || listeners.isEmpty()) {
            return;
        }
        for (Registration registration : listeners) {
            registration.deliver(snapshot);
        }
    }

    private static List<StoredDocument> toDocuments(Map<String, Map<String, Object>> documents) {
        List<StoredDocument> result = new ArrayList<>(documents.size());
        documents.forEach((id, fields) -> result.add(new StoredDocument(id, fields)));
        return Collections.unmodifiableList(result);
    }

    private record Snapshot(long version, List<StoredDocument> documents) {
    }

    private final class Registration implements StoreRegistration {

        private final CollectionPath path;
        private final SnapshotListener listener;
        private volatile boolean active = true;
        private long lastDeliveredVersion = -1L;

        private Registration(CollectionPath path, SnapshotListener listener) {
            this.path = path;
            this.listener = listener;
        }

        private synchronized void deliver(Snapshot snapshot) {
            if (!active || snapshot.version() <= lastDeliveredVersion) {
                return;
            }
            lastDeliveredVersion = snapshot.version();
            try {
                listener.onSnapshot(snapshot.documents());
            } catch (RuntimeException ex) {
                log.warn("Snapshot listener on {} threw; the write itself has been applied", path, ex);
            }
        }

        @Override
        public void remove() {
            if (!active) {
                return;
            }
            active = false;
            List<Registration> listeners = registrations.get(path);
            if (listeners != null) {
                listeners.remove(this);
            }
        }
    }
}
