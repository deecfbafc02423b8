package dev.pekelund.shop.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal document-store client the collections are written against. Calls block until the store has
 * answered and report failures as {@link DocumentStoreException}.
 */
public interface DocumentStore {

    /**
     * Allocates a fresh, unused document id without writing anything.
     */
    String newDocumentId(CollectionPath path);

    String add(CollectionPath path, Map<String, Object> fields);

    List<StoredDocument> getAll(CollectionPath path);

    Optional<StoredDocument> getOne(CollectionPath path, String documentId);

    /**
     * Applies every write or none of them.
     */
    void batchUpdate(CollectionPath path, List<DocumentWrite> writes);

    void delete(CollectionPath path, String documentId);

    /**
     * Opens a push listener on the collection. The current content is delivered first, then a new
     * snapshot after every change until the registration is removed or the listener fails.
     */
    StoreRegistration subscribe(CollectionPath path, SnapshotListener listener);
}
