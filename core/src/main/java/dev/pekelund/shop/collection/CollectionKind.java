package dev.pekelund.shop.collection;

import dev.pekelund.shop.store.CollectionPath;
import java.time.Instant;
import java.util.Comparator;

/**
 * The collections that carry a default item, with their storage name and snapshot order.
 */
public enum CollectionKind {

    ADDRESSES("addresses", "address",
        Comparator.comparing(CollectionKind::createdAtOrEpoch).reversed()),

    PAYMENT_METHODS("paymentMethods", "payment method",
        Comparator.comparing(CollectionItem::isDefault).reversed()
            .thenComparing(Comparator.comparing(CollectionKind::createdAtOrEpoch).reversed()));

    private final String collectionName;
    private final String label;
    private final Comparator<CollectionItem> order;

    CollectionKind(String collectionName, String label, Comparator<CollectionItem> order) {
        this.collectionName = collectionName;
        this.label = label;
        this.order = order.thenComparing(CollectionItem::id);
    }

    public String collectionName() {
        return collectionName;
    }

    public String label() {
        return label;
    }

    public CollectionPath path(String ownerId) {
        return new CollectionPath(ownerId, collectionName);
    }

    /**
     * Order in which snapshots and listings present the items.
     */
    public Comparator<CollectionItem> order() {
        return order;
    }

    private static Instant createdAtOrEpoch(CollectionItem item) {
        return item.createdAt() != null ? item.createdAt() : Instant.EPOCH;
    }
}
