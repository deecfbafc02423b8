package dev.pekelund.shop.registry;

import dev.pekelund.shop.auth.AuthenticationContextResolver;
import dev.pekelund.shop.batch.TransactionalBatchWriter;
import dev.pekelund.shop.batch.WriteBatchPlan;
import dev.pekelund.shop.collection.CollectionFields;
import dev.pekelund.shop.collection.CollectionItem;
import dev.pekelund.shop.collection.CollectionKind;
import dev.pekelund.shop.collection.CollectionSchema;
import dev.pekelund.shop.collection.CollectionSnapshots;
import dev.pekelund.shop.collection.ItemNotFoundException;
import dev.pekelund.shop.collection.ItemValidationException;
import dev.pekelund.shop.store.CollectionPath;
import dev.pekelund.shop.store.DocumentStore;
import dev.pekelund.shop.store.StoredDocument;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Keeps at most one item of an owner's collection flagged as default.
 *
 * <p>Every mutation reads the current collection, plans all writes of the operation (including demotions
 * and promotions) and commits them as one batch. The read and the commit are separate round trips, so a
 * writer in another process can slip in between and leave zero or two defaults until the next write; the
 * next snapshot shows the settled state.
 *
 * @param <T> item type
 * @param <D> draft type accepted by {@link #add}
 */
public class DefaultItemRegistry<T extends CollectionItem, D> {

    private static final Logger log = LoggerFactory.getLogger(DefaultItemRegistry.class);

    private final DocumentStore documentStore;
    private final TransactionalBatchWriter batchWriter;
    private final AuthenticationContextResolver authenticationContext;
    private final CollectionSchema<T, D> schema;
    private final DeletionGuardPolicy deletionGuard;
    private final Clock clock;

    public DefaultItemRegistry(
        DocumentStore documentStore,
        TransactionalBatchWriter batchWriter,
        AuthenticationContextResolver authenticationContext,
        CollectionSchema<T, D> schema,
        DeletionGuardPolicy deletionGuard,
        Clock clock
    ) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.batchWriter = Objects.requireNonNull(batchWriter, "batchWriter");
        this.authenticationContext = Objects.requireNonNull(authenticationContext, "authenticationContext");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.deletionGuard = Objects.requireNonNull(deletionGuard, "deletionGuard");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CollectionKind kind() {
        return schema.kind();
    }

    public DeletionGuardPolicy deletionGuard() {
        return deletionGuard;
    }

    /**
     * Creates an item. When {@code makeDefault} is set, every current default is demoted in the same batch.
     *
     * @return the id of the new item
     */
    public String add(D draft, boolean makeDefault) {
        String ownerId = authenticationContext.requireOwnerId();
        if (draft == null) {
            throw new ItemValidationException("A " + kind().label() + " is required");
        }
        Map<String, Object> fields = new LinkedHashMap<>(schema.toFields(draft));
        CollectionPath path = kind().path(ownerId);
        Instant now = clock.instant();

        WriteBatchPlan.Builder plan = WriteBatchPlan.builder();
        if (makeDefault) {
            demoteDefaults(plan, documentStore.getAll(path), null, now);
        }

        String id = documentStore.newDocumentId(path);
        fields.put(schema.ownerField(), ownerId);
        fields.put(CollectionFields.IS_DEFAULT, makeDefault);
        fields.put(CollectionFields.CREATED_AT, now);
        fields.put(CollectionFields.UPDATED_AT, now);
        plan.create(id, fields);

        batchWriter.commit(path, plan.build());
        log.info("Added {} {} for owner {} (default={})", kind().label(), id, ownerId, makeDefault);
        return id;
    }

    /**
     * Applies a partial update. A patch setting {@code isDefault} to {@code true} also demotes every other
     * default in the same batch.
     */
    public void update(String id, Map<String, Object> patch) {
        String ownerId = authenticationContext.requireOwnerId();
        String itemId = requireId(id);
        Map<String, Object> requested = patch != null ? new LinkedHashMap<>(patch) : new LinkedHashMap<>();
        for (String managed : CollectionFields.MANAGED) {
            if (requested.containsKey(managed)) {
                throw new ItemValidationException(managed, "Field '" + managed + "' cannot be changed");
            }
        }
        if (requested.containsKey(schema.ownerField())) {
            throw new ItemValidationException(schema.ownerField(), "The owner of a " + kind().label()
                + " cannot be changed");
        }
        Boolean makeDefault = extractDefaultFlag(requested);

        CollectionPath path = kind().path(ownerId);
        List<StoredDocument> documents = null;
        StoredDocument current;
        if (Boolean.TRUE.equals(makeDefault)) {
            documents = documentStore.getAll(path);
            current = requirePresent(documents, itemId);
        } else {
            current = documentStore.getOne(path, itemId)
                .orElseThrow(() -> new ItemNotFoundException(kind(), itemId));
        }
        Map<String, Object> changes = new LinkedHashMap<>(schema.validatePatch(current, requested));

        Instant now = clock.instant();
        WriteBatchPlan.Builder plan = WriteBatchPlan.builder();
        if (documents != null) {
            demoteDefaults(plan, documents, itemId, now);
        }

        if (makeDefault != null) {
            changes.put(CollectionFields.IS_DEFAULT, makeDefault);
        }
        changes.put(CollectionFields.UPDATED_AT, now);
        plan.update(itemId, changes);

        batchWriter.commit(path, plan.build());
        log.info("Updated {} {} for owner {} (fields {})", kind().label(), itemId, ownerId, changes.keySet());
    }

    /**
     * Makes {@code id} the default and demotes the previous default in the same batch.
     */
    public void setDefault(String id) {
        String ownerId = authenticationContext.requireOwnerId();
        String itemId = requireId(id);
        CollectionPath path = kind().path(ownerId);
        List<StoredDocument> documents = documentStore.getAll(path);
        requirePresent(documents, itemId);

        Instant now = clock.instant();
        WriteBatchPlan.Builder plan = WriteBatchPlan.builder();
        demoteDefaults(plan, documents, itemId, now);
        plan.update(itemId, Map.of(CollectionFields.IS_DEFAULT, true, CollectionFields.UPDATED_AT, now));

        batchWriter.commit(path, plan.build());
        log.info("Set default {} to {} for owner {}", kind().label(), itemId, ownerId);
    }

    /**
     * Deletes an item, subject to the collection's {@link DeletionGuardPolicy}.
     */
    public void delete(String id) {
        String ownerId = authenticationContext.requireOwnerId();
        String itemId = requireId(id);
        CollectionPath path = kind().path(ownerId);
        List<StoredDocument> documents = documentStore.getAll(path);
        StoredDocument target = requirePresent(documents, itemId);

        List<StoredDocument> others = new ArrayList<>(documents.size());
        for (StoredDocument document : documents) {
            if (!document.id().equals(itemId)) {
                others.add(document);
            }
        }
        Optional<StoredDocument> replacement = deletionGuard.selectReplacement(kind(), target, others);

        WriteBatchPlan.Builder plan = WriteBatchPlan.builder();
        replacement.ifPresent(promoted -> plan.update(promoted.id(), Map.of(
            CollectionFields.IS_DEFAULT, true,
            CollectionFields.UPDATED_AT, clock.instant())));
        plan.delete(itemId);

        batchWriter.commit(path, plan.build());
        if (replacement.isPresent()) {
            log.info("Deleted {} {} for owner {} and promoted {} to default", kind().label(), itemId, ownerId,
                replacement.get().id());
        } else {
            log.info("Deleted {} {} for owner {}", kind().label(), itemId, ownerId);
        }
    }

    /**
     * @return the owner's items in snapshot order
     */
    public List<T> list() {
        String ownerId = authenticationContext.requireOwnerId();
        return CollectionSnapshots.decode(schema, documentStore.getAll(kind().path(ownerId)));
    }

    public Optional<T> findById(String id) {
        String ownerId = authenticationContext.requireOwnerId();
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return documentStore.getOne(kind().path(ownerId), id.trim()).map(schema::fromDocument);
    }

    /**
     * @return the default item; the most recently created one should a race have left two
     */
    public Optional<T> findDefault() {
        return list().stream()
            .filter(CollectionItem::isDefault)
            .max(Comparator.comparing(item -> item.createdAt() != null ? item.createdAt() : Instant.EPOCH));
    }

    private void demoteDefaults(WriteBatchPlan.Builder plan, List<StoredDocument> documents, String keepId,
                                Instant now) {
        for (StoredDocument document : documents) {
            if (document.id().equals(keepId) || !document.getBoolean(CollectionFields.IS_DEFAULT)) {
                continue;
            }
            plan.update(document.id(), Map.of(CollectionFields.IS_DEFAULT, false, CollectionFields.UPDATED_AT, now));
        }
    }

    private StoredDocument requirePresent(List<StoredDocument> documents, String itemId) {
        return documents.stream()
            .filter(document -> document.id().equals(itemId))
            .findFirst()
            .orElseThrow(() -> new ItemNotFoundException(kind(), itemId));
    }

    private Boolean extractDefaultFlag(Map<String, Object> requested) {
        if (!requested.containsKey(CollectionFields.IS_DEFAULT)) {
            return null;
        }
        Object value = requested.remove(CollectionFields.IS_DEFAULT);
        if (value instanceof Boolean flag) {
            return flag;
        }
        throw new ItemValidationException(CollectionFields.IS_DEFAULT, "Field 'isDefault' must be true or false");
    }

    private String requireId(String id) {
        if (!StringUtils.hasText(id)) {
            throw new ItemValidationException("id", "A " + kind().label() + " id is required");
        }
        return id.trim();
    }
}
