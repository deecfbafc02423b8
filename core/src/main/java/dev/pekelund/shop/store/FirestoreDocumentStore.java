package dev.pekelund.shop.store;

import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.ListenerRegistration;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.WriteBatch;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * {@link DocumentStore} backed by Google Cloud Firestore. Collections live under
 * {@code {usersCollection}/{ownerId}/{collection}}; batches map onto a Firestore {@link WriteBatch}.
 */
public class FirestoreDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(FirestoreDocumentStore.class);

    private final Firestore firestore;
    private final String usersCollection;

    public FirestoreDocumentStore(Firestore firestore, FirestoreProperties properties) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.usersCollection = StringUtils.hasText(properties.getUsersCollection())
            ? properties.getUsersCollection()
            : FirestoreProperties.DEFAULT_USERS_COLLECTION;
    }

    @Override
    public String newDocumentId(CollectionPath path) {
        return collection(path).document().getId();
    }

    @Override
    public String add(CollectionPath path, Map<String, Object> fields) {
        DocumentReference reference = await(collection(path).add(toFirestore(fields)), "add document to " + path);
        return reference.getId();
    }

    @Override
    public List<StoredDocument> getAll(CollectionPath path) {
        QuerySnapshot snapshot = await(collection(path).get(), "load " + path);
        return snapshot != null ? toDocuments(snapshot.getDocuments()) : List.of();
    }

    @Override
    public Optional<StoredDocument> getOne(CollectionPath path, String documentId) {
        if (!StringUtils.hasText(documentId)) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = await(collection(path).document(documentId).get(),
            "load " + path + "/" + documentId);
        if (snapshot == null || !snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.of(toDocument(snapshot));
    }

    @Override
    public void batchUpdate(CollectionPath path, List<DocumentWrite> writes) {
        if (writes == null || writes.isEmpty()) {
            return;
        }

        CollectionReference collection = collection(path);
        WriteBatch batch = firestore.batch();
        for (DocumentWrite write : writes) {
            DocumentReference reference = collection.document(write.documentId());
            switch (write.operation()) {
                case CREATE -> batch.create(reference, toFirestore(write.fields()));
                case UPDATE -> batch.update(reference, toFirestore(write.fields()));
                case DELETE -> batch.delete(reference);
                default -> throw new IllegalStateException("Unsupported write " + write.operation());
            }
        }
        await(batch.commit(), "commit " + writes.size() + " writes to " + path);
    }

    @Override
    public void delete(CollectionPath path, String documentId) {
        await(collection(path).document(documentId).delete(), "delete " + path + "/" + documentId);
    }

    @Override
    public StoreRegistration subscribe(CollectionPath path, SnapshotListener listener) {
        ListenerRegistration registration = collection(path).addSnapshotListener((snapshot, error) -> {
            if (error != null) {
                log.warn("Snapshot listener on {} failed: {}", path, error.getMessage());
                listener.onError(error);
                return;
            }
            if (snapshot != null) {
                listener.onSnapshot(toDocuments(snapshot.getDocuments()));
            }
        });
        return registration::remove;
    }

    private CollectionReference collection(CollectionPath path) {
        return firestore.collection(usersCollection)
            .document(path.ownerId())
            .collection(path.collection());
    }

    private <T> T await(ApiFuture<T> future, String action) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException("Interrupted while trying to " + action, ex);
        } catch (ExecutionException ex) {
            log.error("Failed to {} in Firestore", action, ex);
            throw new DocumentStoreException("Failed to " + action, ex);
        }
    }

    private List<StoredDocument> toDocuments(List<QueryDocumentSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return List.of();
        }
        List<StoredDocument> documents = new ArrayList<>(snapshots.size());
        for (QueryDocumentSnapshot snapshot : snapshots) {
            documents.add(toDocument(snapshot));
        }
        return Collections.unmodifiableList(documents);
    }

    private StoredDocument toDocument(DocumentSnapshot snapshot) {
        Map<String, Object> data = snapshot.getData();
        Map<String, Object> fields = new LinkedHashMap<>();
        if (data != null) {
            data.forEach((key, value) -> fields.put(key, fromFirestore(value)));
        }
        return new StoredDocument(snapshot.getId(), fields);
    }

    static Map<String, Object> toFirestore(Map<String, Object> fields) {
        Map<String, Object> data = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (value instanceof Instant instant) {
                data.put(key, Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano()));
            } else {
                data.put(key, value);
            }
        });
        return data;
    }

    static Object fromFirestore(Object value) {
        if (value instanceof Timestamp timestamp) {
            return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
        }
        return value;
    }
}
