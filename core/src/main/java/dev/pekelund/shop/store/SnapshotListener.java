package dev.pekelund.shop.store;

import java.util.List;

/**
 * Receives the full content of a collection every time it changes.
 */
public interface SnapshotListener {

    void onSnapshot(List<StoredDocument> documents);

    /**
     * Called once when the listener fails. No further callbacks follow.
     */
    void onError(Throwable error);
}
