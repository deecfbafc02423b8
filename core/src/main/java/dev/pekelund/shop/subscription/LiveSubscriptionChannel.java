package dev.pekelund.shop.subscription;

import dev.pekelund.shop.collection.CollectionItem;
import dev.pekelund.shop.collection.CollectionKind;
import dev.pekelund.shop.collection.CollectionSchema;
import dev.pekelund.shop.collection.CollectionSnapshots;
import dev.pekelund.shop.store.DocumentStore;
import dev.pekelund.shop.store.SnapshotListener;
import dev.pekelund.shop.store.StoreRegistration;
import dev.pekelund.shop.store.StoredDocument;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Streams full, ordered snapshots of one owner's collection to any number of independent observers.
 *
 * <p>Every callback replaces the observer's previous view. An error ends the subscription; observers
 * that want to keep listening subscribe again.
 *
 * @param <T> item type
 */
public class LiveSubscriptionChannel<T extends CollectionItem> {

    private static final Logger log = LoggerFactory.getLogger(LiveSubscriptionChannel.class);

    private final DocumentStore documentStore;
    private final CollectionSchema<T, ?> schema;

    public LiveSubscriptionChannel(DocumentStore documentStore, CollectionSchema<T, ?> schema) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public CollectionKind kind() {
        return schema.kind();
    }

    public Subscription subscribe(String ownerId, Consumer<List<T>> onSnapshot, Consumer<Throwable> onError) {
        if (!StringUtils.hasText(ownerId)) {
            throw new IllegalArgumentException("An owner id is required to subscribe");
        }
        Objects.requireNonNull(onSnapshot, "onSnapshot");
        Objects.requireNonNull(onError, "onError");

        ChannelSubscription subscription = new ChannelSubscription(ownerId, onSnapshot, onError);
        subscription.attach(documentStore.subscribe(kind().path(ownerId), subscription));
        log.debug("Opened {} subscription for owner {}", kind().label(), ownerId);
        return subscription;
    }

    private final class ChannelSubscription implements Subscription, SnapshotListener {

        private final String ownerId;
        private final Consumer<List<T>> onSnapshot;
        private final Consumer<Throwable> onError;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private volatile StoreRegistration registration;

        private ChannelSubscription(String ownerId, Consumer<List<T>> onSnapshot, Consumer<Throwable> onError) {
            this.ownerId = ownerId;
            this.onSnapshot = onSnapshot;
            this.onError = onError;
        }

        private void attach(StoreRegistration storeRegistration) {
            this.registration = storeRegistration;
            // The store may have reported an error, or the caller unsubscribed, before the handle existed.
            if (!active.get()) {
                storeRegistration.remove();
            }
        }

        @Override
        public void onSnapshot(List<StoredDocument> documents) {
            if (!active.get()) {
                return;
            }
            List<T> items = CollectionSnapshots.decode(schema, documents);
            log.debug("Delivering {} {} item(s) to owner {}", items.size(), kind().label(), ownerId);
            onSnapshot.accept(items);
        }

        @Override
        public void onError(Throwable error) {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            log.warn("{} subscription for owner {} failed: {}", kind().label(), ownerId, error.getMessage());
            release();
            onError.accept(error);
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                release();
                log.debug("Closed {} subscription for owner {}", kind().label(), ownerId);
            }
        }

        private void release() {
            StoreRegistration current = registration;
            if (current != null) {
                current.remove();
            }
        }
    }
}
