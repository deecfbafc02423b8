package dev.pekelund.shop.store;

import org.springframework.util.Assert;

/**
 * Addresses one owner's sub-collection, laid out as {@code users/{ownerId}/{collection}}.
 */
public record CollectionPath(String ownerId, String collection) {

    public CollectionPath {
        Assert.hasText(ownerId, "ownerId must not be empty");
        Assert.hasText(collection, "collection must not be empty");
        ownerId = ownerId.trim();
        collection = collection.trim();
    }

    @Override
    public String toString() {
        return "users/" + ownerId + "/" + collection;
    }
}
