package dev.pekelund.shop.registry;

import dev.pekelund.shop.collection.CollectionFields;
import dev.pekelund.shop.collection.CollectionKind;
import dev.pekelund.shop.collection.InvariantViolationException;
import dev.pekelund.shop.store.StoredDocument;
import java.util.List;
import java.util.Optional;

/**
 * Decides what happens to the default flag when an item is deleted.
 */
public enum DeletionGuardPolicy {

    /**
     * Deletes unconditionally. Removing the default leaves the collection without one.
     */
    UNRESTRICTED {
        @Override
        public Optional<StoredDocument> selectReplacement(CollectionKind kind, StoredDocument target,
                                                          List<StoredDocument> others) {
            return Optional.empty();
        }
    },

    /**
     * Removing the default requires another item to take over; the first one found is promoted. Removing
     * the only item while it is the default is rejected.
     */
    REQUIRE_REPLACEMENT_OR_REJECT {
        @Override
        public Optional<StoredDocument> selectReplacement(CollectionKind kind, StoredDocument target,
                                                          List<StoredDocument> others) {
            if (!target.getBoolean(CollectionFields.IS_DEFAULT)) {
                return Optional.empty();
            }
            if (others.isEmpty()) {
                throw new InvariantViolationException("Cannot remove the only default " + kind.label()
                    + ". Please add another " + kind.label() + " first.");
            }
            return Optional.of(others.get(0));
        }
    };

    /**
     * @param target the item being deleted
     * @param others every other item of the collection, in store order
     * @return the item to promote to default in the same batch as the delete, if any
     * @throws InvariantViolationException when the delete must not happen
     */
    public abstract Optional<StoredDocument> selectReplacement(CollectionKind kind, StoredDocument target,
                                                               List<StoredDocument> others);
}
