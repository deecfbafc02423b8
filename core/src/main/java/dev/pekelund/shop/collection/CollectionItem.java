package dev.pekelund.shop.collection;

import java.time.Instant;

/**
 * Common shape of every item held in a per-owner collection with a single default.
 */
public interface CollectionItem {

    String id();

    String ownerId();

    boolean isDefault();

    Instant createdAt();

    Instant updatedAt();
}
